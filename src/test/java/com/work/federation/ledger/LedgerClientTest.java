package com.work.federation.ledger;

import com.work.federation.TestDomain;
import com.work.federation.config.LedgerProperties;
import com.work.federation.core.exception.LedgerRejectedException;
import com.work.federation.core.exception.LedgerUnavailableException;
import com.work.federation.core.lock.SubmitLockCoordinator;
import com.work.federation.core.lock.impl.InMemorySubmitLockManager;
import com.work.federation.core.metrics.FederationMetrics;
import com.work.federation.core.metrics.NoopFederationMetrics;
import com.work.federation.model.ServiceEndpoint;
import com.work.federation.model.ServiceRequirements;
import org.junit.jupiter.api.Test;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class LedgerClientTest {

    private static LedgerCall announce(String serviceId) {
        return FederationAbi.announceService(ServiceRequirements.ofType("k8s_deployment"), serviceId, ServiceEndpoint.EMPTY);
    }

    @Test
    public void nonces_are_strictly_increasing_without_gaps() {
        InMemoryFederationLedger ledger = new InMemoryFederationLedger();
        TestDomain domain = TestDomain.registered(ledger, TestDomain.CONSUMER, "consumer");

        SubmittedTransaction first = domain.client().submit(announce("svc-1"));
        SubmittedTransaction second = domain.client().submit(announce("svc-2"));

        assertEquals(1L, first.getNonce());
        assertEquals(2L, second.getNonce());
        assertEquals(3L, ledger.getPendingNonce(TestDomain.CONSUMER));
        assertEquals(3L, domain.client().peekNextNonce());
    }

    @Test
    public void first_submission_starts_from_chain_pending_nonce() {
        InMemoryFederationLedger ledger = new InMemoryFederationLedger();
        ledger.advanceNonceExternally(TestDomain.CONSUMER, 5);
        TestDomain domain = TestDomain.on(ledger, TestDomain.CONSUMER);

        assertEquals(-1L, domain.client().peekNextNonce());
        SubmittedTransaction tx = domain.contract().registerDomain("consumer");

        assertEquals(5L, tx.getNonce());
    }

    @Test
    public void rejected_submission_does_not_advance_nonce() {
        InMemoryFederationLedger ledger = new InMemoryFederationLedger();
        TestDomain domain = TestDomain.registered(ledger, TestDomain.CONSUMER, "consumer");

        ledger.failNextSubmit(new LedgerRejectedException(LedgerRejectedException.Reason.REVERTED, "execution reverted"));
        assertThrows(LedgerRejectedException.class, () -> domain.client().submit(announce("svc-1")));
        assertEquals(1L, domain.client().peekNextNonce());

        assertEquals(1L, domain.client().submit(announce("svc-1")).getNonce());
    }

    @Test
    public void nonce_conflict_is_surfaced_and_next_submission_resyncs_with_chain() {
        InMemoryFederationLedger ledger = new InMemoryFederationLedger();
        TestDomain domain = TestDomain.registered(ledger, TestDomain.CONSUMER, "consumer");
        // 另一个客户端用同一账户发了两笔
        ledger.advanceNonceExternally(TestDomain.CONSUMER, 2);

        LedgerRejectedException e = assertThrows(LedgerRejectedException.class,
                () -> domain.client().submit(announce("svc-1")));
        assertEquals(LedgerRejectedException.Reason.NONCE_CONFLICT, e.getReason());
        assertEquals(-1L, domain.client().peekNextNonce());

        assertEquals(3L, domain.client().submit(announce("svc-1")).getNonce());
    }

    @Test
    public void unavailable_submission_is_not_retried_and_nonce_never_goes_backwards() {
        LedgerConnector connector = mock(LedgerConnector.class);
        when(connector.getPendingNonce(eq(TestDomain.CONSUMER))).thenReturn(4L, 2L);
        when(connector.sendTransaction(eq(TestDomain.CONSUMER), eq(4L), any()))
                .thenThrow(new LedgerUnavailableException("connection refused"));
        LedgerClient client = newClient(connector, new NoopFederationMetrics(), new ArrayList<>());

        assertThrows(LedgerUnavailableException.class, () -> client.submit(announce("svc-1")));
        verify(connector, times(1)).sendTransaction(eq(TestDomain.CONSUMER), eq(4L), any());

        // 链上 pending 回落到 2（节点重启丢了 txpool），本地仍从 max(2, 4) 开始
        doReturn("0xdef").when(connector).sendTransaction(eq(TestDomain.CONSUMER), eq(4L), any());
        SubmittedTransaction tx = client.submit(announce("svc-1"));
        assertEquals(4L, tx.getNonce());
    }

    @Test
    public void query_retries_unavailable_with_exponential_backoff() {
        LedgerConnector connector = mock(LedgerConnector.class);
        List<Type<?>> state = Collections.singletonList(new Uint256(1));
        when(connector.call(eq(TestDomain.CONSUMER), any()))
                .thenThrow(new LedgerUnavailableException("timeout"))
                .thenThrow(new LedgerUnavailableException("timeout"))
                .thenReturn(state);
        List<Duration> sleeps = new ArrayList<>();
        LedgerClient client = newClient(connector, new NoopFederationMetrics(), sleeps);

        assertSame(state, client.query(FederationAbi.getServiceState("svc-1")));
        assertEquals(2, sleeps.size());
        assertEquals(Duration.ofMillis(500), sleeps.get(0));
        assertEquals(Duration.ofMillis(1000), sleeps.get(1));
    }

    @Test
    public void query_gives_up_after_max_attempts() {
        LedgerConnector connector = mock(LedgerConnector.class);
        when(connector.call(eq(TestDomain.CONSUMER), any())).thenThrow(new LedgerUnavailableException("down"));
        FederationMetrics metrics = mock(FederationMetrics.class);
        LedgerClient client = newClient(connector, metrics, new ArrayList<>());

        assertThrows(LedgerUnavailableException.class, () -> client.query(FederationAbi.getServiceState("svc-1")));
        verify(connector, times(3)).call(eq(TestDomain.CONSUMER), any());
        verify(metrics, times(3)).ledgerQuery("GET_SERVICE_STATE", "unavailable");
    }

    @Test
    public void submit_and_query_reject_the_wrong_function_kind() {
        LedgerConnector connector = mock(LedgerConnector.class);
        LedgerClient client = newClient(connector, new NoopFederationMetrics(), new ArrayList<>());

        assertThrows(IllegalArgumentException.class, () -> client.submit(FederationAbi.getServiceState("svc-1")));
        assertThrows(IllegalArgumentException.class, () -> client.query(announce("svc-1")));
        verify(connector, never()).getPendingNonce(any());
    }

    @Test
    public void concurrent_submissions_use_each_nonce_exactly_once() throws Exception {
        InMemoryFederationLedger ledger = new InMemoryFederationLedger();
        TestDomain domain = TestDomain.registered(ledger, TestDomain.CONSUMER, "consumer");
        int threads = 4;
        int perThread = 10;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        Set<Long> nonces = new ConcurrentSkipListSet<>();
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            final int worker = t;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    nonces.add(domain.client().submit(announce("svc-" + worker + "-" + i)).getNonce());
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        pool.shutdownNow();

        Set<Long> expected = new TreeSet<>();
        for (long n = 1; n <= threads * perThread; n++) {
            expected.add(n);
        }
        assertEquals(expected, nonces);
        assertEquals(threads * perThread + 1L, ledger.getPendingNonce(TestDomain.CONSUMER));
    }

    private LedgerClient newClient(LedgerConnector connector, FederationMetrics metrics, List<Duration> sleeps) {
        LedgerProperties props = new LedgerProperties();
        props.setQueryMaxAttempts(3);
        props.setQueryBackoff(Duration.ofMillis(500));
        SubmitLockCoordinator coordinator = new SubmitLockCoordinator(new InMemorySubmitLockManager(),
                Duration.ofSeconds(5), Duration.ofSeconds(1));
        return new LedgerClient(TestDomain.CONSUMER, connector, coordinator, props, metrics, sleeps::add);
    }
}
