package com.work.federation.core.lock;

import java.time.Duration;

/**
 * 按账本身份（address）提供互斥的提交锁。同一身份可能被多个进程共享，
 * 因此生产环境使用 Redis 实现，单进程 / 测试使用内存实现。
 */
public interface SubmitLockManager {

    /**
     * 尝试获取身份维度的锁。
     *
     * @param identity  账本身份（地址）
     * @param lockOwner 当前线程/节点的标识
     * @param ttl       锁超时时间
     * @return true 表示加锁成功
     */
    boolean tryLock(String identity, String lockOwner, Duration ttl);

    /**
     * 释放锁（若锁已超时/转移，实现需要自行判断）。
     */
    void unlock(String identity, String lockOwner);
}
