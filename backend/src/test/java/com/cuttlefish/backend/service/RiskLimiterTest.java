package com.cuttlefish.backend.service;

import com.cuttlefish.backend.model.RateState;
import com.cuttlefish.backend.model.RejectReason;
import com.cuttlefish.backend.model.TradingConfig;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RiskLimiterTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final BigInteger E18 = BigInteger.TEN.pow(18);

    private final RiskLimiter riskLimiter = new RiskLimiter();

    private static TradingConfig config() {
        return TradingConfig.builder()
                .priceThreshold(BigInteger.valueOf(2000).multiply(BigInteger.TEN.pow(8)))
                .maxTradeSize(BigInteger.valueOf(100).multiply(E18))
                .dailyTradeLimit(BigInteger.valueOf(1000).multiply(E18))
                .cooldownPeriod(Duration.ofSeconds(300))
                .maxSlippageBps(300)
                .confidenceThresholdBps(7000)
                .deviationThresholdBps(1000)
                .ecoThreshold(BigInteger.valueOf(1000))
                .predictionInterval(Duration.ofHours(1))
                .build();
    }

    @Test
    void sizeIsCheckedBeforeEverythingElse() {
        RateState justTraded = new RateState(NOW, BigInteger.valueOf(999).multiply(E18), NOW, 5, 5, BigInteger.ONE);

        RiskLimiter.AdmissionDecision decision =
                riskLimiter.admit(config(), justTraded, BigInteger.valueOf(101).multiply(E18), 0, NOW);

        assertThat(decision.admitted()).isFalse();
        assertThat(decision.reason()).isEqualTo(RejectReason.TRADE_AMOUNT_TOO_LARGE);
    }

    @Test
    void cooldownPrecedesConfidence() {
        RateState state = new RateState(NOW.minusSeconds(10), BigInteger.ZERO, NOW, 1, 1, BigInteger.ONE);

        RiskLimiter.AdmissionDecision decision = riskLimiter.admit(config(), state, E18, 0, NOW);

        assertThat(decision.reason()).isEqualTo(RejectReason.COOLDOWN_NOT_MET);
    }

    @Test
    void confidenceBelowThresholdIsRejected() {
        RiskLimiter.AdmissionDecision decision = riskLimiter.admit(config(), RateState.initial(NOW), E18, 6999, NOW);

        assertThat(decision.reason()).isEqualTo(RejectReason.CONFIDENCE_TOO_LOW);
    }

    @Test
    void dailyVolumeResetsLazilyAfterWindow() {
        RateState state = new RateState(NOW.minus(Duration.ofDays(1)), BigInteger.valueOf(950).multiply(E18),
                NOW.minus(Duration.ofDays(1)), 10, 10, BigInteger.ONE);
        BigInteger amount = BigInteger.valueOf(100).multiply(E18);

        assertThat(riskLimiter.admit(config(), state, amount, 8000, NOW).admitted()).isTrue();
        assertThat(riskLimiter.admit(config(), state, amount, 8000, NOW.minusSeconds(1)).reason())
                .isEqualTo(RejectReason.DAILY_LIMIT_EXCEEDED);
        assertThat(state.dailyTradeVolume()).isEqualTo(BigInteger.valueOf(950).multiply(E18));
    }

    @Test
    void commitAppliesResetAndRecordsTrade() {
        Instant yesterday = NOW.minus(Duration.ofDays(2));
        RateState state = new RateState(yesterday, BigInteger.valueOf(500).multiply(E18), yesterday, 3, 3, BigInteger.ONE);

        RateState committed = riskLimiter.commit(state, E18, BigInteger.TEN, NOW);

        assertThat(committed.dailyTradeVolume()).isEqualTo(E18);
        assertThat(committed.lastDayReset()).isEqualTo(NOW);
        assertThat(committed.lastTradeTimestamp()).isEqualTo(NOW);
        assertThat(committed.totalTrades()).isEqualTo(4);
        assertThat(committed.lastValidPrice()).isEqualTo(BigInteger.TEN);
        assertThat(riskLimiter.remainingDailyVolume(config(), committed, NOW))
                .isEqualTo(BigInteger.valueOf(999).multiply(E18));
    }
}
