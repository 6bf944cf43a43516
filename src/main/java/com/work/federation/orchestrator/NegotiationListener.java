package com.work.federation.orchestrator;

/**
 * 运行过程回调（持久化时间线等）。回调里的异常不会中断协商。
 */
public interface NegotiationListener {

    NegotiationListener NOOP = new NegotiationListener() {
    };

    default void onStep(NegotiationSession session, StepMark mark) {
    }

    default void onServiceId(NegotiationSession session, String serviceId) {
    }
}
