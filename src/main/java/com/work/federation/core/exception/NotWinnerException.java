package com.work.federation.core.exception;

/**
 * provider 在未中标的情况下尝试确认部署。编排层把它视为正常的否定结果而非崩溃。
 */
public class NotWinnerException extends FederationException {

    private final String serviceId;

    public NotWinnerException(String serviceId, String message) {
        super(message);
        this.serviceId = serviceId;
    }

    public String getServiceId() {
        return serviceId;
    }
}
