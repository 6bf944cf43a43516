package com.work.federation.core.exception;

/**
 * 联邦协商组件的统一异常类型，便于编排层按类型转换为结构化失败或 HTTP 状态码。
 */
public class FederationException extends RuntimeException {

    public FederationException(String message) {
        super(message);
    }

    public FederationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 标识该异常是否可通过重试解决（仅只读查询会参考该标记）。
     * 默认不可重试。
     */
    public boolean isRetryable() {
        return false;
    }
}
