package com.work.federation.ledger;

import com.work.federation.config.LedgerProperties;
import com.work.federation.core.exception.LedgerRejectedException;
import com.work.federation.core.exception.LedgerUnavailableException;
import com.work.federation.core.lock.SubmitLockCoordinator;
import com.work.federation.core.metrics.FederationMetrics;
import com.work.federation.core.support.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.datatypes.Type;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import static com.work.federation.core.support.ValidationUtils.requireNonNull;
import static com.work.federation.core.support.ValidationUtils.requireValidAddress;

/**
 * 本域账本身份的唯一 nonce 持有者。
 * <p>
 * 所有提交串行化（JVM 锁 + 身份维度的提交锁），nonce 取 max(链上 pending, 本地 next)，
 * 只有节点接受交易后才推进本地 nonce。nonce 冲突与连接失败都直接抛给调用方，从不自动重发：
 * 盲目重发可能造成重复提交。出错后本地 nonce 标记为过期，下一次提交重新与链对齐。
 * <p>
 * query 不触碰 nonce，账本不可用时按指数退避重试。
 */
public class LedgerClient {

    private static final Logger log = LoggerFactory.getLogger(LedgerClient.class);

    private static final long MAX_QUERY_BACKOFF_MS = 30_000L;

    private final String address;
    private final LedgerConnector connector;
    private final SubmitLockCoordinator lockCoordinator;
    private final LedgerProperties props;
    private final FederationMetrics metrics;
    private final Sleeper sleeper;

    private final ReentrantLock submitLock = new ReentrantLock(true);

    /**
     * 本地下一个可用 nonce；null 表示尚未初始化或已过期，需要与链对齐。仅在 submitLock 内读写。
     */
    private Long nextNonce;

    /**
     * 过期前的本地值，用于 max(chain, local)，保证 nonce 永不回退。
     */
    private long lastKnownNonce = -1L;

    public LedgerClient(String address,
                        LedgerConnector connector,
                        SubmitLockCoordinator lockCoordinator,
                        LedgerProperties props,
                        FederationMetrics metrics,
                        Sleeper sleeper) {
        this.address = requireValidAddress(address, "address");
        this.connector = requireNonNull(connector, "connector");
        this.lockCoordinator = requireNonNull(lockCoordinator, "lockCoordinator");
        this.props = requireNonNull(props, "props");
        this.metrics = requireNonNull(metrics, "metrics");
        this.sleeper = requireNonNull(sleeper, "sleeper");
    }

    /**
     * 提交一笔改变账本状态的调用。
     *
     * @throws IllegalArgumentException 传入的是 QUERY 类函数
     * @throws LedgerRejectedException  节点拒绝（nonce 冲突、回滚、未授权）
     * @throws LedgerUnavailableException 无法连接节点，本地 nonce 未推进
     */
    public SubmittedTransaction submit(LedgerCall call) {
        requireNonNull(call, "call");
        if (call.getFunction().isQuery()) {
            throw new IllegalArgumentException("QUERY 类函数不能通过 submit 调用: " + call.getFunction());
        }
        submitLock.lock();
        try {
            return lockCoordinator.executeWithLock(address, owner -> doSubmit(call));
        } finally {
            submitLock.unlock();
        }
    }

    private SubmittedTransaction doSubmit(LedgerCall call) {
        LedgerFunction function = call.getFunction();
        long nonce = resolveNonce();
        String txHash;
        try {
            txHash = connector.sendTransaction(address, nonce, call);
        } catch (LedgerRejectedException e) {
            if (e.getReason() == LedgerRejectedException.Reason.NONCE_CONFLICT) {
                markStale();
                metrics.ledgerSubmit(function.name(), "nonce_conflict");
                log.warn("[ledger] nonce conflict, function={} address={} nonce={} err={}",
                        function, address, nonce, e.getMessage());
            } else {
                metrics.ledgerSubmit(function.name(), "rejected");
                log.warn("[ledger] submit rejected, function={} reason={} nonce={} err={}",
                        function, e.getReason(), nonce, e.getMessage());
            }
            throw e;
        } catch (LedgerUnavailableException e) {
            // 节点是否已收到交易未知，下次提交以链上 pending 为准
            markStale();
            metrics.ledgerSubmit(function.name(), "unavailable");
            log.warn("[ledger] submit failed, ledger unavailable, function={} nonce={} err={}",
                    function, nonce, e.getMessage());
            throw e;
        }
        nextNonce = nonce + 1;
        metrics.ledgerSubmit(function.name(), "accepted");
        log.info("[ledger] submitted function={} address={} nonce={} txHash={}", function, address, nonce, txHash);
        return new SubmittedTransaction(txHash, nonce, function);
    }

    private long resolveNonce() {
        if (nextNonce != null) {
            return nextNonce;
        }
        long chainNext = connector.getPendingNonce(address);
        long resolved = chainNext;
        if (lastKnownNonce >= 0 && lastKnownNonce > chainNext) {
            resolved = lastKnownNonce;
        }
        log.info("[ledger] nonce resync address={} chainPending={} local={} next={}",
                address, chainNext, lastKnownNonce, resolved);
        metrics.nonceResync(address);
        nextNonce = resolved;
        return resolved;
    }

    private void markStale() {
        if (nextNonce != null) {
            lastKnownNonce = Math.max(lastKnownNonce, nextNonce);
        }
        nextNonce = null;
    }

    /**
     * 只读调用；账本不可用时退避重试，最多 queryMaxAttempts 次。
     *
     * @throws IllegalArgumentException 传入的是 SUBMIT 类函数
     */
    public List<Type<?>> query(LedgerCall call) {
        requireNonNull(call, "call");
        if (!call.getFunction().isQuery()) {
            throw new IllegalArgumentException("SUBMIT 类函数不能通过 query 调用: " + call.getFunction());
        }
        int maxAttempts = Math.max(1, props.getQueryMaxAttempts());
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                List<Type<?>> values = connector.call(address, call);
                metrics.ledgerQuery(call.getFunction().name(), "ok");
                return values;
            } catch (LedgerUnavailableException e) {
                metrics.ledgerQuery(call.getFunction().name(), "unavailable");
                if (attempt >= maxAttempts) {
                    throw e;
                }
                Duration backoff = backoff(attempt);
                log.warn("[ledger] query unavailable function={} attempt={} backoff={} err={}",
                        call.getFunction(), attempt, backoff, e.getMessage());
                pause(backoff, e);
            }
        }
    }

    public LedgerReceipt getTransactionReceipt(String txHash) {
        return connector.getTransactionReceipt(txHash);
    }

    public long latestBlockNumber() {
        return connector.getLatestBlockNumber();
    }

    /**
     * 下一笔提交将使用的 nonce；本地未初始化时返回 -1。
     */
    public long peekNextNonce() {
        submitLock.lock();
        try {
            return nextNonce == null ? -1L : nextNonce;
        } finally {
            submitLock.unlock();
        }
    }

    public String getAddress() {
        return address;
    }

    public LedgerConnector getConnector() {
        return connector;
    }

    private Duration backoff(int attempt) {
        long base = Math.max(1L, props.getQueryBackoff() == null ? 500L : props.getQueryBackoff().toMillis());
        long pow = 1L << Math.min(10, Math.max(0, attempt - 1));
        return Duration.ofMillis(Math.min(MAX_QUERY_BACKOFF_MS, base * pow));
    }

    private void pause(Duration backoff, LedgerUnavailableException cause) {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new LedgerUnavailableException("query 重试等待被中断", cause);
        }
    }
}
