package com.work.federation.core.exception;

/**
 * 观察到的服务状态序列出现倒退（例如 CLOSED 之后又读到 OPEN）。
 */
public class LifecycleViolationException extends FederationException {

    public LifecycleViolationException(String message) {
        super(message);
    }
}
