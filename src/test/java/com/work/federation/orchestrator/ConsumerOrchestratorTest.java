package com.work.federation.orchestrator;

import com.work.federation.ForwardingLedgerConnector;
import com.work.federation.TestDomain;
import com.work.federation.collaborator.NetworkConnector;
import com.work.federation.collaborator.TunnelRequest;
import com.work.federation.config.FederationProperties;
import com.work.federation.core.exception.LedgerUnavailableException;
import com.work.federation.ledger.InMemoryFederationLedger;
import com.work.federation.ledger.LedgerCall;
import com.work.federation.ledger.LedgerConnector;
import com.work.federation.ledger.LedgerFunction;
import com.work.federation.ledger.ServiceDirectory;
import com.work.federation.ledger.event.FederationEvent;
import com.work.federation.ledger.event.FederationEventKind;
import com.work.federation.model.ServiceAnnouncement;
import com.work.federation.model.ServiceEndpoint;
import com.work.federation.model.ServiceRequirements;
import com.work.federation.negotiation.ServiceState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

public class ConsumerOrchestratorTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    private InMemoryFederationLedger ledger;
    private TestDomain providerA;
    private TestDomain providerB;
    private ExecutorService executor;

    @BeforeEach
    public void setUp() {
        ledger = new InMemoryFederationLedger();
        providerA = TestDomain.registered(ledger, TestDomain.PROVIDER_A, "provider-a");
        providerB = TestDomain.registered(ledger, TestDomain.PROVIDER_B, "provider-b");
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    private static NegotiationSession session() {
        return new NegotiationSession("run-consumer", NegotiationRole.CONSUMER, Clock.systemUTC(), null);
    }

    /**
     * 等到 consumer 的公告上链，返回服务 id。
     */
    private String awaitAnnouncement() {
        ServiceDirectory directory = new ServiceDirectory(providerA.model(), providerA.cursors());
        String[] id = new String[1];
        TestDomain.waitUntil(() -> {
            List<ServiceAnnouncement> open = directory.openAnnouncements(20);
            if (open.isEmpty()) {
                return false;
            }
            id[0] = open.get(0).getServiceId();
            return true;
        }, WAIT);
        return id[0];
    }

    private static final ServiceEndpoint CONSUMER_ENDPOINT =
            new ServiceEndpoint("http://10.0.0.1:5000/catalog", "http://10.0.0.1:5000/topology", null, null);

    private static ConsumerRequest request(int quorum) {
        return request(quorum, false);
    }

    private static ConsumerRequest request(int quorum, boolean establishConnectivity) {
        return new ConsumerRequest(ServiceRequirements.ofType("k8s_deployment"), CONSUMER_ENDPOINT, quorum,
                establishConnectivity);
    }

    @Test
    public void cheapest_bid_wins_and_run_completes_after_deployment() throws Exception {
        TestDomain consumer = TestDomain.registered(ledger, TestDomain.CONSUMER, "consumer");
        ConsumerOrchestrator orchestrator = consumer.consumerOrchestrator(TestDomain.fastProperties());

        Future<NegotiationResult> run = executor.submit(() -> orchestrator.run(session(), request(2)));
        String id = awaitAnnouncement();
        providerA.contract().placeBid(id, BigInteger.valueOf(50), null);
        ServiceEndpoint providerEp = new ServiceEndpoint(null, null, "nsd-b", "ns-b");
        providerB.contract().placeBid(id, BigInteger.valueOf(30), providerEp);
        TestDomain.waitUntil(() -> providerB.model().isWinner(id), WAIT);
        providerB.contract().confirmDeployment(id, "10.1.1.1");
        NegotiationResult result = run.get(10, TimeUnit.SECONDS);

        assertEquals(NegotiationOutcome.COMPLETED, result.getOutcome());
        assertEquals(1, result.getWinningBid().getBidIndex());
        assertEquals(TestDomain.PROVIDER_B, result.getWinningBid().getProviderAddress());
        assertEquals("10.1.1.1", result.getFederatedHost());
        assertEquals(providerEp, result.getPeerEndpoint());
        assertEquals(ServiceState.DEPLOYED, providerA.model().getState(id));
    }

    @Test
    public void too_few_bids_times_out_and_leaves_service_open() {
        TestDomain consumer = TestDomain.registered(ledger, TestDomain.CONSUMER, "consumer");
        FederationProperties props = TestDomain.fastProperties();
        props.getNegotiation().setBidTimeout(Duration.ofMillis(300));
        ConsumerOrchestrator orchestrator = consumer.consumerOrchestrator(props);
        NegotiationSession session = session();

        NegotiationTimeoutException e = assertThrows(NegotiationTimeoutException.class,
                () -> orchestrator.run(session, request(2)));

        assertEquals(NegotiationStep.AWAIT_BIDS, e.getStep());
        assertEquals(ServiceState.OPEN, consumer.model().getState(session.getServiceId()));
    }

    @Test
    public void choose_provider_is_submitted_once_even_when_the_node_fails() throws Exception {
        AtomicInteger chooseAttempts = new AtomicInteger();
        LedgerConnector flaky = new ChooseFailingConnector(ledger, chooseAttempts);
        TestDomain consumer = TestDomain.on(flaky, TestDomain.CONSUMER);
        consumer.contract().registerDomain("consumer");
        ConsumerOrchestrator orchestrator = consumer.consumerOrchestrator(TestDomain.fastProperties());

        Future<NegotiationResult> run = executor.submit(() -> orchestrator.run(session(), request(1)));
        String id = awaitAnnouncement();
        providerA.contract().placeBid(id, BigInteger.valueOf(10), null);

        ExecutionException e = assertThrows(ExecutionException.class, () -> run.get(10, TimeUnit.SECONDS));
        NegotiationFailedException failed = assertInstanceOf(NegotiationFailedException.class, e.getCause());
        assertEquals(NegotiationStep.CHOOSE_PROVIDER, failed.getStep());
        assertInstanceOf(LedgerUnavailableException.class, failed.getCause());
        assertEquals(1, chooseAttempts.get());
        assertEquals(ServiceState.OPEN, providerA.model().getState(id));
    }

    @Test
    public void lowest_of_three_bids_arriving_across_polls_is_chosen_once() throws Exception {
        TestDomain providerC = TestDomain.registered(ledger, TestDomain.PROVIDER_C, "provider-c");
        GatedConnector gated = new GatedConnector(ledger);
        TestDomain consumer = TestDomain.on(gated, TestDomain.CONSUMER);
        consumer.contract().registerDomain("consumer");
        ConsumerOrchestrator orchestrator = consumer.consumerOrchestrator(TestDomain.fastProperties());

        Future<NegotiationResult> run = executor.submit(() -> orchestrator.run(session(), request(2)));
        String id = awaitAnnouncement();
        providerA.contract().placeBid(id, BigInteger.valueOf(50), null);
        TestDomain.waitUntil(() -> gated.pollsWithBids.get() > 0, WAIT);
        // 第二、三笔报价在同一轮轮询之间到达
        gated.hold();
        try {
            providerB.contract().placeBid(id, BigInteger.valueOf(30), null);
            providerC.contract().placeBid(id, BigInteger.valueOf(40), null);
        } finally {
            gated.release();
        }
        TestDomain.waitUntil(() -> providerB.model().isWinner(id), WAIT);
        providerB.contract().confirmDeployment(id, "10.1.1.2");
        NegotiationResult result = run.get(10, TimeUnit.SECONDS);

        assertEquals(NegotiationOutcome.COMPLETED, result.getOutcome());
        assertEquals(1, result.getWinningBid().getBidIndex());
        assertEquals(BigInteger.valueOf(30), result.getWinningBid().getPrice());
        assertEquals(TestDomain.PROVIDER_B, result.getWinningBid().getProviderAddress());
        assertEquals(3, providerA.model().listBids(id, 3).size());
        assertEquals(1, gated.chooseSubmissions.get());
    }

    @Test
    public void tunnel_targets_the_provider_endpoint_read_from_the_ledger() throws Exception {
        TestDomain consumer = TestDomain.registered(ledger, TestDomain.CONSUMER, "consumer");
        NetworkConnector network = mock(NetworkConnector.class);
        ConsumerOrchestrator orchestrator = consumer.consumerOrchestrator(TestDomain.fastProperties(), network);

        Future<NegotiationResult> run = executor.submit(() -> orchestrator.run(session(), request(1, true)));
        String id = awaitAnnouncement();
        ServiceEndpoint providerEp = new ServiceEndpoint("http://10.2.0.7:5000/catalog",
                "http://10.2.0.7:5000/topology", "nsd-b", "ns-b");
        providerB.contract().placeBid(id, BigInteger.valueOf(20), providerEp);
        TestDomain.waitUntil(() -> providerB.model().isWinner(id), WAIT);
        providerB.contract().confirmDeployment(id, "10.1.1.3");
        NegotiationResult result = run.get(10, TimeUnit.SECONDS);

        assertEquals(NegotiationOutcome.COMPLETED, result.getOutcome());
        ArgumentCaptor<TunnelRequest> captor = ArgumentCaptor.forClass(TunnelRequest.class);
        verify(network, times(1)).establishTunnel(captor.capture());
        TunnelRequest tunnel = captor.getValue();
        assertEquals(providerEp, tunnel.getRemoteEndpoint());
        assertEquals(CONSUMER_ENDPOINT, tunnel.getLocalEndpoint());
        assertEquals("10.2.0.7", tunnel.getRemoteIp());
        assertEquals(id, tunnel.getServiceId());
    }

    @Test
    public void ledger_outage_while_waiting_for_bids_fails_the_step_with_its_own_error() throws Exception {
        TestDomain consumer = TestDomain.registered(ledger, TestDomain.CONSUMER, "consumer");
        ConsumerOrchestrator orchestrator = consumer.consumerOrchestrator(TestDomain.fastProperties());

        Future<NegotiationResult> run = executor.submit(() -> orchestrator.run(session(), request(2)));
        awaitAnnouncement();
        ledger.failNextCalls(Integer.MAX_VALUE);

        ExecutionException e = assertThrows(ExecutionException.class, () -> run.get(5, TimeUnit.SECONDS));
        NegotiationFailedException failed = assertInstanceOf(NegotiationFailedException.class, e.getCause());
        assertEquals(NegotiationStep.AWAIT_BIDS, failed.getStep());
        assertInstanceOf(LedgerUnavailableException.class, failed.getCause());
    }

    @Test
    public void invalid_request_is_rejected_before_announcing() {
        TestDomain consumer = TestDomain.registered(ledger, TestDomain.CONSUMER, "consumer");
        ConsumerOrchestrator orchestrator = consumer.consumerOrchestrator(TestDomain.fastProperties());
        long latest = ledger.getLatestBlockNumber();

        assertThrows(RuntimeException.class, () -> orchestrator.run(session(), request(0)));
        assertEquals(latest, ledger.getLatestBlockNumber());
    }

    /**
     * ChooseProvider 交易一律模拟节点不可达。
     */
    private static final class ChooseFailingConnector extends ForwardingLedgerConnector {

        private final AtomicInteger chooseAttempts;

        ChooseFailingConnector(LedgerConnector delegate, AtomicInteger chooseAttempts) {
            super(delegate);
            this.chooseAttempts = chooseAttempts;
        }

        @Override
        public String sendTransaction(String from, long nonce, LedgerCall call) {
            if (call.getFunction() == LedgerFunction.CHOOSE_PROVIDER) {
                chooseAttempts.incrementAndGet();
                throw new LedgerUnavailableException("connection reset");
            }
            return delegate.sendTransaction(from, nonce, call);
        }
    }

    /**
     * 持有写锁期间 consumer 读不到区块高度和日志，用来让多笔报价落在同一轮轮询之间。
     */
    private static final class GatedConnector extends ForwardingLedgerConnector {

        private final ReentrantReadWriteLock gate = new ReentrantReadWriteLock();
        private final AtomicInteger pollsWithBids = new AtomicInteger();
        private final AtomicInteger chooseSubmissions = new AtomicInteger();

        GatedConnector(LedgerConnector delegate) {
            super(delegate);
        }

        void hold() {
            gate.writeLock().lock();
        }

        void release() {
            gate.writeLock().unlock();
        }

        @Override
        public long getLatestBlockNumber() {
            gate.readLock().lock();
            try {
                return delegate.getLatestBlockNumber();
            } finally {
                gate.readLock().unlock();
            }
        }

        @Override
        public List<FederationEvent> getLogs(FederationEventKind kind, long fromBlock, long toBlock) {
            gate.readLock().lock();
            try {
                List<FederationEvent> events = delegate.getLogs(kind, fromBlock, toBlock);
                if (kind == FederationEventKind.NEW_BID && !events.isEmpty()) {
                    pollsWithBids.incrementAndGet();
                }
                return events;
            } finally {
                gate.readLock().unlock();
            }
        }

        @Override
        public String sendTransaction(String from, long nonce, LedgerCall call) {
            if (call.getFunction() == LedgerFunction.CHOOSE_PROVIDER) {
                chooseSubmissions.incrementAndGet();
            }
            return delegate.sendTransaction(from, nonce, call);
        }
    }
}
