package com.cuttlefish.backend.exception;

public class ReentrantCallException extends TradingException {
    public ReentrantCallException(String operation) {
        super("Re-entrant call rejected: " + operation);
    }
}
