package com.work.federation.core.metrics;

/**
 * 可观测性端口（不强依赖 Micrometer/Prometheus）。
 *
 * 核心路径只调用接口；平台侧可通过自定义 Bean 接入具体实现。
 */
public interface FederationMetrics {

    /**
     * @param function 账本函数名
     * @param result   accepted / nonce_conflict / rejected / unavailable
     */
    default void ledgerSubmit(String function, String result) {
    }

    default void ledgerQuery(String function, String result) {
    }

    default void nonceResync(String identity) {
    }

    default void eventsPolled(String kind, int count) {
    }

    /**
     * @param role    consumer / provider
     * @param outcome 运行结局
     */
    default void negotiationFinished(String role, String outcome) {
    }
}
