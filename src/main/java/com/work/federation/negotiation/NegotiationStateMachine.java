package com.work.federation.negotiation;

import com.work.federation.core.exception.LedgerRejectedException;

/**
 * 服务生命周期的合法迁移：OPEN → CLOSED → DEPLOYED，严格单调，无回退、无跳跃。
 */
public final class NegotiationStateMachine {

    private NegotiationStateMachine() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static boolean isLegal(ServiceState from, ServiceState to) {
        if (from == null || to == null) {
            return false;
        }
        switch (from) {
            case OPEN:
                return to == ServiceState.CLOSED;
            case CLOSED:
                return to == ServiceState.DEPLOYED;
            case DEPLOYED:
            default:
                return false;
        }
    }

    /**
     * @throws LedgerRejectedException reason=ILLEGAL_TRANSITION
     */
    public static void requireTransition(ServiceState from, ServiceState to) {
        if (!isLegal(from, to)) {
            throw new LedgerRejectedException(LedgerRejectedException.Reason.ILLEGAL_TRANSITION,
                    "非法状态迁移: " + from + " -> " + to);
        }
    }

    /**
     * 只有 OPEN 状态接受报价。
     */
    public static boolean acceptsBids(ServiceState state) {
        return state == ServiceState.OPEN;
    }

    /**
     * 只有 CLOSED 状态下 isWinner 才可能为 true。
     */
    public static boolean winnerDecided(ServiceState state) {
        return state == ServiceState.CLOSED;
    }

    /**
     * observed 是否不早于 target（用于等待某状态时把更靠后的状态也视为已到达）。
     */
    public static boolean reached(ServiceState observed, ServiceState target) {
        return observed != null && target != null && observed.ordinal() >= target.ordinal();
    }
}
