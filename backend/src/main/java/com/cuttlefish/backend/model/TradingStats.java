package com.cuttlefish.backend.model;

import java.math.BigInteger;
import java.time.Instant;

public record TradingStats(
        long totalTrades,
        long successfulTrades,
        long successRateBps,
        BigInteger dailyTradeVolume,
        BigInteger remainingDailyVolume,
        Instant lastTradeTimestamp,
        Instant lastDayReset
) {
}
