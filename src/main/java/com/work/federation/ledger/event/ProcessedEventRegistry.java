package com.work.federation.ledger.event;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;

/**
 * 已处理事件登记表，用于重叠轮询窗口下的幂等折叠。
 * <p>
 * 只记录事件身份（txHash#logIndex），从不缓存账本状态。
 */
public class ProcessedEventRegistry {

    private final Cache<String, Boolean> processed;

    public ProcessedEventRegistry() {
        this(10_000L, Duration.ofHours(1));
    }

    public ProcessedEventRegistry(long maximumSize, Duration expireAfterWrite) {
        this.processed = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(expireAfterWrite)
                .build();
    }

    /**
     * @return true 表示首次看到该事件，调用方应处理；false 表示重复
     */
    public boolean markProcessed(FederationEvent event) {
        return processed.asMap().putIfAbsent(event.dedupeKey(), Boolean.TRUE) == null;
    }

    public boolean isProcessed(FederationEvent event) {
        return processed.getIfPresent(event.dedupeKey()) != null;
    }

    public long size() {
        return processed.estimatedSize();
    }
}
