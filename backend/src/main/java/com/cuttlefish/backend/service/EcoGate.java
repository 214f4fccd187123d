package com.cuttlefish.backend.service;

import com.cuttlefish.backend.config.OracleProperties;
import com.cuttlefish.backend.exception.OracleUnavailableException;
import com.cuttlefish.backend.model.OracleReading;
import com.cuttlefish.backend.service.port.OracleFeed;
import com.cuttlefish.backend.service.port.OracleRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Environmental impact score. An empty slot passes everything (score 0); a configured feed that
 * cannot be read blocks everything ({@link #MAX_SCORE}).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EcoGate {

    public static final BigInteger MAX_SCORE = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);
    public static final Duration MAX_SCORE_AGE = Duration.ofHours(1);

    private final OracleRegistry oracleRegistry;
    private final OracleProperties oracleProperties;
    private final Clock clock;

    private volatile OracleFeed feed;

    @PostConstruct
    void init() {
        String feedId = oracleProperties.getEcoFeed();
        // a named feed must exist; only a blank id leaves the slot empty
        feed = feedId == null || feedId.isBlank() ? null : oracleRegistry.require(feedId);
        if (feed == null) {
            log.info("Eco gate unconfigured, all trades pass");
        }
    }

    public BigInteger score() {
        OracleFeed current = feed;
        if (current == null) {
            return BigInteger.ZERO;
        }
        Instant now = clock.instant();
        try {
            OracleReading reading = current.latestReading();
            if (reading.value() == null || reading.value().signum() < 0) {
                log.warn("Eco feed {} returned an invalid score {}", current.id(), reading.value());
                return MAX_SCORE;
            }
            if (reading.updatedAt() == null || Duration.between(reading.updatedAt(), now).compareTo(MAX_SCORE_AGE) > 0) {
                log.warn("Eco feed {} is stale updatedAt={}", current.id(), reading.updatedAt());
                return MAX_SCORE;
            }
            return reading.value();
        } catch (OracleUnavailableException ex) {
            log.warn("Eco feed unreadable, blocking: {}", ex.getMessage());
            return MAX_SCORE;
        }
    }

    public boolean isConfigured() {
        return feed != null;
    }

    /**
     * Points the gate at another feed; null empties the slot.
     */
    public void rotateFeed(OracleFeed next) {
        feed = next;
        log.info("Eco feed set to {}", next != null ? next.id() : "none");
    }

    public String currentFeedId() {
        OracleFeed current = feed;
        return current != null ? current.id() : null;
    }
}
