package com.work.federation.orchestrator;

import com.work.federation.core.exception.FederationException;

/**
 * 运行被取消（显式 cancel 或线程中断）。
 */
public class NegotiationCancelledException extends FederationException {

    private final NegotiationStep step;

    public NegotiationCancelledException(NegotiationStep step) {
        super("协商在步骤 " + step + " 被取消");
        this.step = step;
    }

    public NegotiationStep getStep() {
        return step;
    }
}
