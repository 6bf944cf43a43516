package com.work.federation.core.exception;

/**
 * 合约 ABI 与本地定义不一致（未知函数、返回值无法解码、未知状态码）。属于编程错误，直接终止。
 */
public class LedgerAbiMismatchException extends FederationException {

    public LedgerAbiMismatchException(String message) {
        super(message);
    }

    public LedgerAbiMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
