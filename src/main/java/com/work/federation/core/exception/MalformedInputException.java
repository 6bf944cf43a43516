package com.work.federation.core.exception;

/**
 * requirements / endpoint 等输入格式非法。必须在发出任何账本调用之前抛出。
 */
public class MalformedInputException extends FederationException {

    public MalformedInputException(String message) {
        super(message);
    }
}
