package com.work.federation.core.exception;

/**
 * 查询的服务或报价在账本上不存在（对外映射为 404）。
 */
public class ServiceNotFoundException extends FederationException {

    public ServiceNotFoundException(String message) {
        super(message);
    }

    public ServiceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
