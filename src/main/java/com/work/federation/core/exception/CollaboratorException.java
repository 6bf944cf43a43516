package com.work.federation.core.exception;

/**
 * 外部协作方（部署后端、网络隧道配置）调用失败。
 */
public class CollaboratorException extends FederationException {

    public CollaboratorException(String message) {
        super(message);
    }

    public CollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
