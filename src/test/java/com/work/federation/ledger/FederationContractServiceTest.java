package com.work.federation.ledger;

import com.work.federation.TestDomain;
import com.work.federation.core.exception.LedgerRejectedException;
import com.work.federation.core.exception.MalformedInputException;
import com.work.federation.core.exception.NotWinnerException;
import com.work.federation.model.ServiceEndpoint;
import com.work.federation.model.ServiceRequirements;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class FederationContractServiceTest {

    private InMemoryFederationLedger ledger;
    private TestDomain consumer;
    private TestDomain providerA;
    private TestDomain providerB;

    @BeforeEach
    public void setUp() {
        ledger = new InMemoryFederationLedger();
        consumer = TestDomain.registered(ledger, TestDomain.CONSUMER, "consumer");
        providerA = TestDomain.registered(ledger, TestDomain.PROVIDER_A, "provider-a");
        providerB = TestDomain.registered(ledger, TestDomain.PROVIDER_B, "provider-b");
    }

    @Test
    public void non_winner_cannot_confirm_deployment_and_nothing_is_submitted() {
        String id = consumer.contract().announceService(ServiceRequirements.ofType("k8s_deployment"), null).getServiceId();
        providerA.contract().placeBid(id, BigInteger.valueOf(10), null);
        providerB.contract().placeBid(id, BigInteger.valueOf(20), null);
        consumer.contract().chooseProvider(id, 0);
        long nonceBefore = ledger.getPendingNonce(TestDomain.PROVIDER_B);
        long blockBefore = ledger.getLatestBlockNumber();

        NotWinnerException e = assertThrows(NotWinnerException.class,
                () -> providerB.contract().confirmDeployment(id, "10.0.0.9"));
        assertEquals(id, e.getServiceId());
        assertEquals(nonceBefore, ledger.getPendingNonce(TestDomain.PROVIDER_B));
        assertEquals(blockBefore, ledger.getLatestBlockNumber());
    }

    @Test
    public void confirm_deployment_before_closure_is_not_winner() {
        String id = consumer.contract().announceService(ServiceRequirements.ofType("k8s_deployment"), null).getServiceId();
        providerA.contract().placeBid(id, BigInteger.valueOf(10), null);

        assertThrows(NotWinnerException.class, () -> providerA.contract().confirmDeployment(id, "10.0.0.9"));
    }

    @Test
    public void choose_provider_on_closed_service_fails_before_submitting() {
        String id = consumer.contract().announceService(ServiceRequirements.ofType("k8s_deployment"), null).getServiceId();
        providerA.contract().placeBid(id, BigInteger.valueOf(10), null);
        consumer.contract().chooseProvider(id, 0);
        long nextNonce = consumer.client().peekNextNonce();

        LedgerRejectedException e = assertThrows(LedgerRejectedException.class,
                () -> consumer.contract().chooseProvider(id, 0));
        assertEquals(LedgerRejectedException.Reason.ILLEGAL_TRANSITION, e.getReason());
        assertEquals(nextNonce, consumer.client().peekNextNonce());
        assertEquals(nextNonce, ledger.getPendingNonce(TestDomain.CONSUMER));
    }

    @Test
    public void invalid_requirements_are_rejected_without_touching_the_nonce() {
        long pending = ledger.getPendingNonce(TestDomain.CONSUMER);
        ServiceRequirements bad = new ServiceRequirements("k8s_deployment", -1.0, null, null, null);

        assertThrows(MalformedInputException.class, () -> consumer.contract().announceService(bad, null));
        assertThrows(MalformedInputException.class, () -> consumer.contract().announceService(
                ServiceRequirements.ofType("k8s_deployment"), new ServiceEndpoint("ftp://catalog", null, null, null)));
        assertEquals(pending, ledger.getPendingNonce(TestDomain.CONSUMER));
    }

    @Test
    public void negative_price_and_empty_host_are_malformed() {
        String id = consumer.contract().announceService(ServiceRequirements.ofType("k8s_deployment"), null).getServiceId();

        assertThrows(MalformedInputException.class,
                () -> providerA.contract().placeBid(id, BigInteger.valueOf(-1), null));
        assertThrows(MalformedInputException.class, () -> providerA.contract().confirmDeployment(id, " "));
        assertThrows(MalformedInputException.class, () -> consumer.contract().chooseProvider(id, -1));
    }

    @Test
    public void each_announcement_gets_a_fresh_service_id() {
        String first = consumer.contract().announceService(ServiceRequirements.ofType("k8s_deployment"), null).getServiceId();
        String second = consumer.contract().announceService(ServiceRequirements.ofType("k8s_deployment"), null).getServiceId();

        assertNotEquals(first, second);
    }

    @Test
    public void winner_updates_its_endpoint_after_closure() {
        String id = consumer.contract().announceService(ServiceRequirements.ofType("k8s_deployment"), null).getServiceId();
        providerA.contract().placeBid(id, BigInteger.valueOf(10), null);
        consumer.contract().chooseProvider(id, 0);
        ServiceEndpoint updated = new ServiceEndpoint(null, null, "nsd-7", "ns-7");

        providerA.contract().updateEndpoint(id, true, updated);

        assertEquals(updated, consumer.model().getServiceInfo(id, false).getEndpoint());
        assertThrows(LedgerRejectedException.class, () -> providerB.contract().updateEndpoint(id, true, updated));
    }
}
