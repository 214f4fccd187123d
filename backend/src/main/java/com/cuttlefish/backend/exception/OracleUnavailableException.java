package com.cuttlefish.backend.exception;

import lombok.Getter;

@Getter
public class OracleUnavailableException extends TradingException {

    private final String feedId;

    public OracleUnavailableException(String feedId, String message) {
        super("Oracle " + feedId + " unavailable: " + message);
        this.feedId = feedId;
    }
}
