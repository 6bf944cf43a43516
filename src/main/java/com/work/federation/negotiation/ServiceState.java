package com.work.federation.negotiation;

import com.work.federation.core.exception.LedgerAbiMismatchException;

/**
 * 服务在账本上的生命周期状态，code 与合约 GetServiceState 的返回值一致。
 */
public enum ServiceState {

    OPEN(0),
    CLOSED(1),
    DEPLOYED(2);

    private final int code;

    ServiceState(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static ServiceState fromCode(long code) {
        for (ServiceState s : values()) {
            if (s.code == code) {
                return s;
            }
        }
        throw new LedgerAbiMismatchException("未知的服务状态码: " + code);
    }
}
