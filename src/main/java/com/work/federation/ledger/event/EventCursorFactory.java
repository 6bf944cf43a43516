package com.work.federation.ledger.event;

import com.work.federation.core.metrics.FederationMetrics;
import com.work.federation.ledger.LedgerConnector;

import static com.work.federation.core.support.ValidationUtils.requireNonNegative;
import static com.work.federation.core.support.ValidationUtils.requireNonNull;

/**
 * 绑定同一账本连接与 metrics 的游标工厂。
 */
public class EventCursorFactory {

    private final LedgerConnector connector;
    private final FederationMetrics metrics;

    public EventCursorFactory(LedgerConnector connector, FederationMetrics metrics) {
        this.connector = requireNonNull(connector, "connector");
        this.metrics = requireNonNull(metrics, "metrics");
    }

    public EventCursor fromBlock(FederationEventKind kind, long fromBlock) {
        return new EventCursor(connector, kind, fromBlock, metrics);
    }

    public EventCursor latestOnly(FederationEventKind kind) {
        return new EventCursor(connector, kind, connector.getLatestBlockNumber(), metrics);
    }

    public EventCursor lookback(FederationEventKind kind, long blocks) {
        requireNonNegative(blocks, "blocks");
        return new EventCursor(connector, kind, Math.max(0L, connector.getLatestBlockNumber() - blocks), metrics);
    }
}
