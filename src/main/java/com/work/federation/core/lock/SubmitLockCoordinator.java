package com.work.federation.core.lock;

import com.work.federation.core.exception.LedgerUnavailableException;
import com.work.federation.core.support.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.time.Duration;
import java.util.UUID;

import static com.work.federation.core.support.ValidationUtils.requireNonEmpty;
import static com.work.federation.core.support.ValidationUtils.requireNonNull;
import static com.work.federation.core.support.ValidationUtils.requirePositive;

/**
 * 账本身份维度的互斥协调器，集中管理提交锁的获取/释放。
 * <p>
 * 获取失败时在 lockWait 内短暂重试；仍拿不到则视为账本暂不可用（可重试）。
 */
public class SubmitLockCoordinator {

    private static final Logger log = LoggerFactory.getLogger(SubmitLockCoordinator.class);

    private static final Duration RETRY_INTERVAL = Duration.ofMillis(50);

    private final SubmitLockManager lockManager;
    private final Duration lockTtl;
    private final Duration lockWait;
    private final Sleeper sleeper;

    public SubmitLockCoordinator(SubmitLockManager lockManager, Duration lockTtl, Duration lockWait) {
        this(lockManager, lockTtl, lockWait, Sleeper.THREAD);
    }

    public SubmitLockCoordinator(SubmitLockManager lockManager, Duration lockTtl, Duration lockWait, Sleeper sleeper) {
        this.lockManager = requireNonNull(lockManager, "lockManager");
        this.lockTtl = requirePositive(lockTtl, "lockTtl");
        this.lockWait = requireNonNull(lockWait, "lockWait");
        this.sleeper = requireNonNull(sleeper, "sleeper");
    }

    @FunctionalInterface
    public interface LockCallback<T> {
        T doInLock(String lockOwner);
    }

    public <T> T executeWithLock(String identity, LockCallback<T> action) {
        requireNonEmpty(identity, "identity");
        requireNonNull(action, "action");

        final String lockOwner = buildLockOwner();
        acquire(identity, lockOwner);
        try {
            return action.doInLock(lockOwner);
        } finally {
            releaseSafely(identity, lockOwner);
        }
    }

    private void acquire(String identity, String owner) {
        long deadline = System.nanoTime() + lockWait.toNanos();
        while (true) {
            if (lockManager.tryLock(identity, owner, lockTtl)) {
                return;
            }
            if (System.nanoTime() >= deadline) {
                throw new LedgerUnavailableException("提交锁竞争超时: " + identity);
            }
            try {
                sleeper.sleep(RETRY_INTERVAL);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LedgerUnavailableException("等待提交锁时被中断: " + identity, e);
            }
        }
    }

    /**
     * 释放锁时不向上抛异常，避免覆盖 finally 之前的真实错误；锁本身有 TTL 兜底。
     */
    private void releaseSafely(String identity, String owner) {
        try {
            lockManager.unlock(identity, owner);
        } catch (RuntimeException ex) {
            log.warn("[ledger] release submit lock failed, identity={}, owner={}", identity, owner, ex);
        }
    }

    /**
     * 生成“机器名 + 线程 ID + UUID”的锁持有者标识，便于排查日志。
     */
    private String buildLockOwner() {
        try {
            String host = InetAddress.getLocalHost().getHostName();
            return host + "-" + Thread.currentThread().getId() + "-" + UUID.randomUUID();
        } catch (Exception ex) {
            return "unknown-" + Thread.currentThread().getId() + "-" + UUID.randomUUID();
        }
    }
}
