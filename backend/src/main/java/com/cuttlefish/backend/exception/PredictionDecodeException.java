package com.cuttlefish.backend.exception;

public class PredictionDecodeException extends TradingException {
    public PredictionDecodeException(String message) {
        super(message);
    }
}
