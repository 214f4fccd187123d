package com.cuttlefish.backend.service;

import com.cuttlefish.backend.config.OracleProperties;
import com.cuttlefish.backend.event.PriceDeviationDetectedEvent;
import com.cuttlefish.backend.exception.OracleUnavailableException;
import com.cuttlefish.backend.exception.TradeRejectedException;
import com.cuttlefish.backend.exception.TradingException;
import com.cuttlefish.backend.model.OracleReading;
import com.cuttlefish.backend.model.PriceSnapshot;
import com.cuttlefish.backend.model.RejectReason;
import com.cuttlefish.backend.model.TradingConfig;
import com.cuttlefish.backend.service.port.OracleFeed;
import com.cuttlefish.backend.service.port.OracleRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Reads and validates the price feed. Stale and non-positive readings are fatal; a large move
 * against the last committed price only marks the snapshot as unconfirmed.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PriceOracleGateway {

    public static final Duration MAX_PRICE_AGE = Duration.ofHours(1);
    public static final int MIN_PRICE_DEVIATION_BPS = 500;

    private static final BigInteger BPS = BigInteger.valueOf(10_000);

    private final OracleRegistry oracleRegistry;
    private final OracleProperties oracleProperties;
    private final TradingAgentState agentState;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private volatile OracleFeed feed;

    @PostConstruct
    void init() {
        feed = oracleRegistry.require(oracleProperties.getPriceFeed());
    }

    public PriceSnapshot getLatestPrice() {
        return read(clock.instant(), true);
    }

    /**
     * Same validation as {@link #getLatestPrice()} without publishing the deviation signal.
     */
    public PriceSnapshot peekLatestPrice(Instant now) {
        return read(now, false);
    }

    PriceSnapshot read(Instant now, boolean signal) {
        OracleFeed current = feed;
        if (current == null) {
            throw new TradeRejectedException(RejectReason.ORACLE_UNAVAILABLE, "no price feed configured");
        }
        OracleReading reading;
        try {
            reading = current.latestReading();
        } catch (OracleUnavailableException ex) {
            throw new TradeRejectedException(RejectReason.ORACLE_UNAVAILABLE, ex.getMessage());
        }
        if (reading.value() == null || reading.value().signum() <= 0) {
            throw new TradeRejectedException(RejectReason.INVALID_PRICE);
        }
        if (reading.updatedAt() == null
                || Duration.between(reading.updatedAt(), now).compareTo(MAX_PRICE_AGE) > 0) {
            throw new TradeRejectedException(RejectReason.PRICE_DATA_STALE);
        }

        BigInteger lastValidPrice = agentState.rateState().lastValidPrice();
        if (lastValidPrice.signum() <= 0) {
            return new PriceSnapshot(reading.value(), reading.updatedAt(), true, 0);
        }
        long deviationBps = reading.value().subtract(lastValidPrice).abs()
                .multiply(BPS)
                .divide(lastValidPrice)
                .min(BigInteger.valueOf(Long.MAX_VALUE))
                .longValue();
        int threshold = deviationThreshold(agentState.config());
        boolean confirmed = deviationBps <= threshold;
        if (!confirmed && signal) {
            log.warn("Price deviation detected previous={} current={} deviationBps={} thresholdBps={}",
                    lastValidPrice, reading.value(), deviationBps, threshold);
            eventPublisher.publishEvent(new PriceDeviationDetectedEvent(
                    lastValidPrice, reading.value(), deviationBps, threshold, now));
        }
        return new PriceSnapshot(reading.value(), reading.updatedAt(), confirmed, deviationBps);
    }

    /**
     * Start-up seed for the deviation basis: the current price, or zero (no basis) when the feed
     * cannot be read.
     */
    public BigInteger fetchPriceOrDefault() {
        try {
            return read(clock.instant(), false).price();
        } catch (TradingException ex) {
            log.warn("Initial price fetch failed, using fallback price 0: {}", ex.getMessage());
            return BigInteger.ZERO;
        }
    }

    public void rotateFeed(OracleFeed next) {
        OracleFeed previous = feed;
        feed = next;
        log.info("Price feed rotated from={} to={}", previous != null ? previous.id() : null, next.id());
    }

    public String currentFeedId() {
        OracleFeed current = feed;
        return current != null ? current.id() : null;
    }

    static int deviationThreshold(TradingConfig config) {
        return config.deviationThresholdBps() > 0 ? config.deviationThresholdBps() : MIN_PRICE_DEVIATION_BPS;
    }
}
