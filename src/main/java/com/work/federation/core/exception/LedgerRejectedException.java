package com.work.federation.core.exception;

/**
 * 账本拒绝了本次调用：nonce 冲突、非法状态迁移、调用方无权限或合约执行 revert。
 * <p>
 * 永远不做盲目重试：同一调用再次提交可能造成重复提交或第二次非法迁移。
 */
public class LedgerRejectedException extends FederationException {

    public enum Reason {
        NONCE_CONFLICT,
        ILLEGAL_TRANSITION,
        UNAUTHORIZED,
        REVERTED
    }

    private final Reason reason;

    public LedgerRejectedException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public LedgerRejectedException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
