package com.work.federation.orchestrator;

/**
 * 协商运行的结局。NOT_CHOSEN 是 provider 的正常结局，不是错误。
 */
public enum NegotiationOutcome {
    RUNNING,
    COMPLETED,
    NOT_CHOSEN,
    FAILED,
    TIMED_OUT,
    CANCELLED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
