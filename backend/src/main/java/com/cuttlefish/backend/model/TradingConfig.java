package com.cuttlefish.backend.model;

import lombok.Builder;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Trading limits of one agent. Replaced as a whole, never field by field.
 */
@Builder(toBuilder = true)
public record TradingConfig(
        BigInteger priceThreshold,
        BigInteger maxTradeSize,
        BigInteger dailyTradeLimit,
        Duration cooldownPeriod,
        int maxSlippageBps,
        int confidenceThresholdBps,
        int deviationThresholdBps,
        BigInteger ecoThreshold,
        Duration predictionInterval
) {

    public static final int MAX_SLIPPAGE_BPS = 1_000;
    public static final int MAX_CONFIDENCE_BPS = 10_000;
    public static final int MAX_DEVIATION_BPS = 5_000;

    public List<String> violations() {
        List<String> violations = new ArrayList<>();
        if (priceThreshold == null || priceThreshold.signum() <= 0) {
            violations.add("priceThreshold must be positive");
        }
        if (maxTradeSize == null || maxTradeSize.signum() <= 0) {
            violations.add("maxTradeSize must be positive");
        }
        if (dailyTradeLimit == null || dailyTradeLimit.signum() <= 0) {
            violations.add("dailyTradeLimit must be positive");
        }
        if (cooldownPeriod == null || cooldownPeriod.isNegative()) {
            violations.add("cooldownPeriod must not be negative");
        }
        if (maxSlippageBps < 0 || maxSlippageBps > MAX_SLIPPAGE_BPS) {
            violations.add("maxSlippageBps must be within 0.." + MAX_SLIPPAGE_BPS);
        }
        if (confidenceThresholdBps < 0 || confidenceThresholdBps > MAX_CONFIDENCE_BPS) {
            violations.add("confidenceThresholdBps must be within 0.." + MAX_CONFIDENCE_BPS);
        }
        if (deviationThresholdBps < 0 || deviationThresholdBps > MAX_DEVIATION_BPS) {
            violations.add("deviationThresholdBps must be within 0.." + MAX_DEVIATION_BPS);
        }
        if (ecoThreshold == null || ecoThreshold.signum() < 0) {
            violations.add("ecoThreshold must not be negative");
        }
        if (predictionInterval == null || predictionInterval.isNegative()) {
            violations.add("predictionInterval must not be negative");
        }
        return violations;
    }
}
