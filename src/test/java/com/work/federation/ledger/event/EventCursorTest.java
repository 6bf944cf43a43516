package com.work.federation.ledger.event;

import com.work.federation.TestDomain;
import com.work.federation.ledger.FederationAbi;
import com.work.federation.ledger.InMemoryFederationLedger;
import com.work.federation.ledger.LedgerConnector;
import com.work.federation.model.ServiceRequirements;
import org.junit.jupiter.api.Test;
import org.web3j.abi.datatypes.generated.Uint256;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class EventCursorTest {

    private static FederationEvent bid(long block, long txIndex, long logIndex, int count) {
        return FederationEvent.fromValues(FederationEventKind.NEW_BID, "0x" + block + txIndex + logIndex,
                block, txIndex, logIndex, Arrays.asList(FederationAbi.bytes32("service1"), new Uint256(count)));
    }

    @Test
    public void poll_returns_events_in_ledger_order() {
        LedgerConnector connector = mock(LedgerConnector.class);
        when(connector.getLatestBlockNumber()).thenReturn(9L);
        when(connector.getLogs(FederationEventKind.NEW_BID, 0L, 9L)).thenReturn(Arrays.asList(
                bid(7, 0, 1, 3), bid(5, 1, 0, 2), bid(7, 0, 0, 4), bid(5, 0, 0, 1)));

        List<FederationEvent> events = EventCursor.fromBlock(connector, FederationEventKind.NEW_BID, 0L).poll();

        assertEquals(Arrays.asList(1, 2, 4, 3), Arrays.asList(events.get(0).getBidCount(), events.get(1).getBidCount(),
                events.get(2).getBidCount(), events.get(3).getBidCount()));
    }

    @Test
    public void next_poll_rereads_the_latest_block() {
        InMemoryFederationLedger ledger = new InMemoryFederationLedger();
        TestDomain consumer = TestDomain.registered(ledger, TestDomain.CONSUMER, "consumer");
        EventCursor cursor = EventCursor.fromBlock(ledger, FederationEventKind.SERVICE_ANNOUNCEMENT, 0L);
        String id = consumer.contract().announceService(ServiceRequirements.ofType("k8s_deployment"), null).getServiceId();

        List<FederationEvent> first = cursor.poll();
        List<FederationEvent> second = cursor.poll();

        assertEquals(1, first.size());
        assertEquals(id, first.get(0).getServiceId());
        assertEquals(1, second.size());
        assertEquals(first.get(0).dedupeKey(), second.get(0).dedupeKey());
        assertEquals(2L, cursor.getNextBlock());
    }

    @Test
    public void latest_only_skips_history_but_keeps_the_tip_block() {
        InMemoryFederationLedger ledger = new InMemoryFederationLedger();
        TestDomain consumer = TestDomain.registered(ledger, TestDomain.CONSUMER, "consumer");
        consumer.contract().announceService(ServiceRequirements.ofType("k8s_deployment"), null);
        consumer.contract().announceService(ServiceRequirements.ofType("k8s_deployment"), null);

        EventCursor cursor = EventCursor.latestOnly(ledger, FederationEventKind.SERVICE_ANNOUNCEMENT);
        assertEquals(1, cursor.poll().size());

        consumer.contract().announceService(ServiceRequirements.ofType("nginx"), null);
        List<FederationEvent> events = cursor.poll();
        assertEquals(2, events.size());
        assertEquals("service_type=nginx; bandwidth_gbps=None; rtt_latency_ms=None; compute_cpus=None; compute_ram_gb=None",
                events.get(1).getRequirements());
    }

    @Test
    public void lookback_starts_that_many_blocks_behind() {
        LedgerConnector connector = mock(LedgerConnector.class);
        when(connector.getLatestBlockNumber()).thenReturn(100L);

        assertEquals(90L, EventCursor.lookback(connector, FederationEventKind.NEW_BID, 10).getNextBlock());
        assertEquals(0L, EventCursor.lookback(connector, FederationEventKind.NEW_BID, 1000).getNextBlock());
    }

    @Test
    public void empty_ledger_range_is_not_queried() {
        LedgerConnector connector = mock(LedgerConnector.class);
        when(connector.getLatestBlockNumber()).thenReturn(3L);

        assertTrue(EventCursor.fromBlock(connector, FederationEventKind.NEW_BID, 10L).poll().isEmpty());
        verify(connector, never()).getLogs(eq(FederationEventKind.NEW_BID), anyLong(), anyLong());
    }

    @Test
    public void only_the_requested_kind_is_returned() {
        InMemoryFederationLedger ledger = new InMemoryFederationLedger();
        TestDomain consumer = TestDomain.registered(ledger, TestDomain.CONSUMER, "consumer");
        TestDomain provider = TestDomain.registered(ledger, TestDomain.PROVIDER_A, "provider-a");
        String id = consumer.contract().announceService(ServiceRequirements.ofType("k8s_deployment"), null).getServiceId();
        provider.contract().placeBid(id, BigInteger.TEN, null);

        List<FederationEvent> bids = EventCursor.fromBlock(ledger, FederationEventKind.NEW_BID, 0L).poll();
        List<FederationEvent> operators = EventCursor.fromBlock(ledger, FederationEventKind.OPERATOR_REGISTERED, 0L).poll();

        assertEquals(1, bids.size());
        assertEquals(Integer.valueOf(1), bids.get(0).getBidCount());
        assertEquals(2, operators.size());
        assertEquals("provider-a", operators.get(1).getOperatorName());
    }
}
