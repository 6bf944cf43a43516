package com.work.federation.orchestrator;

import com.work.federation.core.exception.FederationException;

import java.time.Duration;

/**
 * 等待某个账本事件超过了该步骤的截止时间。账本状态保持原样，不做任何回滚。
 */
public class NegotiationTimeoutException extends FederationException {

    private final NegotiationStep step;
    private final Duration timeout;

    public NegotiationTimeoutException(NegotiationStep step, Duration timeout) {
        super("步骤 " + step + " 等待超时 (" + timeout + ")");
        this.step = step;
        this.timeout = timeout;
    }

    public NegotiationStep getStep() {
        return step;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
