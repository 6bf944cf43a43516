package com.work.federation.core.exception;

/**
 * 本域的注册状态不允许当前操作：重复注册、未注册即注销、协商进行中注销（对外映射为 409）。
 */
public class DomainStateException extends FederationException {

    public DomainStateException(String message) {
        super(message);
    }
}
