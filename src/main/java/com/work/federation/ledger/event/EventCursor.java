package com.work.federation.ledger.event;

import com.work.federation.core.metrics.FederationMetrics;
import com.work.federation.core.metrics.NoopFederationMetrics;
import com.work.federation.ledger.LedgerConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import static com.work.federation.core.support.ValidationUtils.requireNonNegative;
import static com.work.federation.core.support.ValidationUtils.requireNonNull;

/**
 * 单一事件种类的轮询游标。
 * <p>
 * 每次 poll 读取 [nextBlock, latest]，然后把 nextBlock 置为 latest：下一次会重读最新区块，
 * 因此同一事件可能被多次返回，调用方必须幂等处理（见 {@link ProcessedEventRegistry}）。
 * 单次 poll 内按 (区块号, 交易序号, log 序号) 升序返回。
 * <p>
 * 非线程安全：一个游标只属于一次协商运行。
 */
public class EventCursor {

    private static final Logger log = LoggerFactory.getLogger(EventCursor.class);

    private static final Comparator<FederationEvent> LEDGER_ORDER = Comparator
            .comparingLong(FederationEvent::getBlockNumber)
            .thenComparingLong(FederationEvent::getTransactionIndex)
            .thenComparingLong(FederationEvent::getLogIndex);

    private final LedgerConnector connector;
    private final FederationEventKind kind;
    private final FederationMetrics metrics;
    private long nextBlock;

    EventCursor(LedgerConnector connector, FederationEventKind kind, long startBlock, FederationMetrics metrics) {
        this.connector = requireNonNull(connector, "connector");
        this.kind = requireNonNull(kind, "kind");
        this.nextBlock = requireNonNegative(startBlock, "startBlock");
        this.metrics = metrics == null ? new NoopFederationMetrics() : metrics;
    }

    public static EventCursor fromBlock(LedgerConnector connector, FederationEventKind kind, long fromBlock) {
        return new EventCursor(connector, kind, fromBlock, null);
    }

    /**
     * 只关心创建之后（含当前最新区块）的事件。
     */
    public static EventCursor latestOnly(LedgerConnector connector, FederationEventKind kind) {
        return new EventCursor(connector, kind, connector.getLatestBlockNumber(), null);
    }

    /**
     * 从最新区块往回看 blocks 个区块。
     */
    public static EventCursor lookback(LedgerConnector connector, FederationEventKind kind, long blocks) {
        requireNonNegative(blocks, "blocks");
        long latest = connector.getLatestBlockNumber();
        return new EventCursor(connector, kind, Math.max(0L, latest - blocks), null);
    }

    public List<FederationEvent> poll() {
        long latest = connector.getLatestBlockNumber();
        if (latest < nextBlock) {
            return Collections.emptyList();
        }
        List<FederationEvent> events = new ArrayList<>(connector.getLogs(kind, nextBlock, latest));
        events.sort(LEDGER_ORDER);
        if (log.isDebugEnabled()) {
            log.debug("[ledger] poll kind={} range=[{}, {}] events={}", kind, nextBlock, latest, events.size());
        }
        nextBlock = latest;
        metrics.eventsPolled(kind.name(), events.size());
        return events;
    }

    public FederationEventKind getKind() {
        return kind;
    }

    public long getNextBlock() {
        return nextBlock;
    }
}
