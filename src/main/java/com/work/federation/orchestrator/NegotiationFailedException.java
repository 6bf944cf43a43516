package com.work.federation.orchestrator;

import com.work.federation.core.exception.FederationException;

/**
 * 某个步骤失败，cause 保留原始错误种类。
 */
public class NegotiationFailedException extends FederationException {

    private final NegotiationStep step;

    public NegotiationFailedException(NegotiationStep step, Throwable cause) {
        super("步骤 " + step + " 失败: " + cause.getMessage(), cause);
        this.step = step;
    }

    public NegotiationStep getStep() {
        return step;
    }
}
