package com.work.federation.core.lock.impl;

import com.work.federation.core.lock.SubmitLockManager;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 使用 ConcurrentHashMap 模拟 Redis 锁的简单实现，适用于单进程部署与测试。
 */
public class InMemorySubmitLockManager implements SubmitLockManager {

    private static class LockInfo {
        String owner;
        Instant expireAt;
    }

    private final Map<String, LockInfo> locks = new ConcurrentHashMap<>();

    @Override
    public boolean tryLock(String identity, String lockOwner, Duration ttl) {
        final boolean[] acquired = {false};
        locks.compute(identity, (key, existing) -> {
            Instant now = Instant.now();
            if (existing == null || existing.expireAt.isBefore(now)) {
                LockInfo lock = new LockInfo();
                lock.owner = lockOwner;
                lock.expireAt = now.plus(ttl);
                acquired[0] = true;
                return lock;
            }
            if (existing.owner.equals(lockOwner)) {
                existing.expireAt = now.plus(ttl);
                acquired[0] = true;
            }
            return existing;
        });
        return acquired[0];
    }

    @Override
    public void unlock(String identity, String lockOwner) {
        locks.computeIfPresent(identity, (key, existing) ->
                existing.owner.equals(lockOwner) || existing.expireAt.isBefore(Instant.now()) ? null : existing);
    }
}
