package com.dealrelay.core.ledger;

/** 원장 파일/피드 I/O 실패 */
public class LedgerException extends RuntimeException {
    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
