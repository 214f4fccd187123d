package com.cuttlefish.backend.model;

/**
 * Reason codes for gate rejections. The message is the human readable form also returned by
 * the eligibility check.
 */
public enum RejectReason {
    EMERGENCY_STOP_ACTIVE("Emergency stop active"),
    PAUSED("Contract paused"),
    TRADE_AMOUNT_TOO_LARGE("Amount too large"),
    COOLDOWN_NOT_MET("Cooldown period not met"),
    CONFIDENCE_TOO_LOW("Confidence too low"),
    DAILY_LIMIT_EXCEEDED("Daily limit exceeded"),
    INVALID_PRICE("Invalid price data"),
    PRICE_DATA_STALE("Price data stale"),
    ORACLE_UNAVAILABLE("Price oracle unavailable"),
    PRICE_BELOW_THRESHOLD("Price below threshold"),
    COMPLIANCE_REJECTED("Compliance check failed"),
    ECO_SCORE_TOO_HIGH("Eco score too high"),
    PENDING_REQUEST_EXISTS("Prediction request already pending"),
    PREDICTIONS_DISABLED("Predictions disabled"),
    UPKEEP_NOT_NEEDED("Upkeep not needed"),
    PENDING_REQUEST_NOT_EXPIRED("Pending request has not timed out"),
    NO_PENDING_REQUEST("No pending prediction request");

    private final String message;

    RejectReason(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
