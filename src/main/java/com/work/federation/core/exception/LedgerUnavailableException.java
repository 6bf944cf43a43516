package com.work.federation.core.exception;

/**
 * 账本节点不可达（连接失败、超时、RPC I/O 错误）。
 * <p>
 * 对只读查询可重试；对写交易不做自动重试，由调用方决定是否重新发起整个步骤。
 */
public class LedgerUnavailableException extends FederationException {

    public LedgerUnavailableException(String message) {
        super(message);
    }

    public LedgerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
