package com.cuttlefish.backend.service;

import com.cuttlefish.backend.model.RateState;
import com.cuttlefish.backend.model.RejectReason;
import com.cuttlefish.backend.model.TradingConfig;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Size, cooldown, confidence and daily-volume admission. {@link #admit} is a pure check; the
 * caller commits an admitted trade with {@link #commit}.
 */
@Service
public class RiskLimiter {

    public AdmissionDecision admit(TradingConfig config, RateState state, BigInteger amount, int confidenceBps, Instant now) {
        if (amount.compareTo(config.maxTradeSize()) > 0) {
            return AdmissionDecision.reject(RejectReason.TRADE_AMOUNT_TOO_LARGE);
        }
        if (now.isBefore(state.lastTradeTimestamp().plus(config.cooldownPeriod()))) {
            return AdmissionDecision.reject(RejectReason.COOLDOWN_NOT_MET);
        }
        if (confidenceBps < config.confidenceThresholdBps()) {
            return AdmissionDecision.reject(RejectReason.CONFIDENCE_TOO_LOW);
        }
        if (state.currentDayVolume(now).add(amount).compareTo(config.dailyTradeLimit()) > 0) {
            return AdmissionDecision.reject(RejectReason.DAILY_LIMIT_EXCEEDED);
        }
        return AdmissionDecision.admit();
    }

    /**
     * Applies the day reset if due, then records the trade against the window.
     */
    public RateState commit(RateState state, BigInteger amount, BigInteger price, Instant now) {
        return state.withAdmission(amount, price, now);
    }

    public BigInteger remainingDailyVolume(TradingConfig config, RateState state, Instant now) {
        BigInteger remaining = config.dailyTradeLimit().subtract(state.currentDayVolume(now));
        return remaining.signum() < 0 ? BigInteger.ZERO : remaining;
    }

    public record AdmissionDecision(boolean admitted, RejectReason reason) {
        static AdmissionDecision admit() {
            return new AdmissionDecision(true, null);
        }

        static AdmissionDecision reject(RejectReason reason) {
            return new AdmissionDecision(false, reason);
        }
    }
}
