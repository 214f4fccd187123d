package com.cuttlefish.backend.model;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;

/**
 * Rate limiting counters of one agent. Immutable; every transition returns a new instance.
 */
public record RateState(
        Instant lastTradeTimestamp,
        BigInteger dailyTradeVolume,
        Instant lastDayReset,
        long totalTrades,
        long successfulTrades,
        BigInteger lastValidPrice
) {

    public static final Duration DAY = Duration.ofDays(1);

    public static RateState initial(Instant now) {
        return new RateState(Instant.EPOCH, BigInteger.ZERO, now, 0, 0, BigInteger.ZERO);
    }

    public boolean dayResetDue(Instant now) {
        return !now.isBefore(lastDayReset.plus(DAY));
    }

    /**
     * Volume traded in the current rolling window; zero once the window has elapsed even though
     * the reset has not been committed yet.
     */
    public BigInteger currentDayVolume(Instant now) {
        return dayResetDue(now) ? BigInteger.ZERO : dailyTradeVolume;
    }

    public RateState withAdmission(BigInteger amountIn, BigInteger price, Instant now) {
        boolean reset = dayResetDue(now);
        BigInteger baseVolume = reset ? BigInteger.ZERO : dailyTradeVolume;
        return new RateState(
                now,
                baseVolume.add(amountIn),
                reset ? now : lastDayReset,
                totalTrades + 1,
                successfulTrades,
                price
        );
    }

    public RateState withRollback(BigInteger amountIn) {
        BigInteger volume = dailyTradeVolume.subtract(amountIn);
        return new RateState(
                lastTradeTimestamp,
                volume.signum() < 0 ? BigInteger.ZERO : volume,
                lastDayReset,
                Math.max(successfulTrades, totalTrades - 1),
                successfulTrades,
                lastValidPrice
        );
    }

    public RateState withSuccess() {
        return new RateState(lastTradeTimestamp, dailyTradeVolume, lastDayReset, totalTrades,
                Math.min(totalTrades, successfulTrades + 1), lastValidPrice);
    }

    public RateState withLastValidPrice(BigInteger price) {
        return new RateState(lastTradeTimestamp, dailyTradeVolume, lastDayReset, totalTrades,
                successfulTrades, price);
    }
}
