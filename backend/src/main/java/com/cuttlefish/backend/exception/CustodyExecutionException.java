package com.cuttlefish.backend.exception;

import lombok.Getter;

@Getter
public class CustodyExecutionException extends TradingException {

    private final String reason;

    public CustodyExecutionException(String reason) {
        super(reason);
        this.reason = reason;
    }

    public CustodyExecutionException(String reason, Throwable cause) {
        super(reason, cause);
        this.reason = reason;
    }
}
