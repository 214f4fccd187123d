package com.cuttlefish.backend.service;

import com.cuttlefish.backend.config.ComplianceProperties;
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
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Volatility, regulatory-status and trader-eligibility checks. A regulatory reading other than
 * zero means trading is halted.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ComplianceEngine implements ComplianceGate {

    private final OracleRegistry oracleRegistry;
    private final ComplianceProperties properties;
    private final Clock clock;

    private final Set<String> blockedTraders = ConcurrentHashMap.newKeySet();
    private volatile OracleFeed volatilityFeed;
    private volatile OracleFeed regulatoryFeed;

    @PostConstruct
    void init() {
        volatilityFeed = resolve(properties.getVolatilityFeed());
        regulatoryFeed = resolve(properties.getRegulatoryFeed());
        blockedTraders.addAll(properties.getBlockedTraders());
    }

    @Override
    public boolean validatePrediction(String requestId, BigInteger predictedPrice) {
        if (predictedPrice == null || predictedPrice.signum() == 0) {
            log.info("Compliance rejected requestId={} reason=zero predicted price", requestId);
            return false;
        }
        return marketSignalsAllow(requestId);
    }

    @Override
    public boolean validateTrade(String actor, BigInteger amountIn, BigInteger price) {
        if (actor != null && blockedTraders.contains(actor)) {
            log.info("Compliance rejected actor={} reason=trader not eligible", actor);
            return false;
        }
        return marketSignalsAllow(actor);
    }

    private boolean marketSignalsAllow(String subject) {
        OracleFeed volatility = volatilityFeed;
        if (volatility != null) {
            BigInteger value = readOrNull(volatility);
            if (value == null) {
                log.warn("Compliance rejected subject={} reason=volatility signal unreadable", subject);
                return false;
            }
            if (value.compareTo(BigInteger.valueOf(properties.getMaxVolatilityBps())) > 0) {
                log.info("Compliance rejected subject={} reason=volatility {} bps", subject, value);
                return false;
            }
        }
        OracleFeed regulatory = regulatoryFeed;
        if (regulatory != null) {
            BigInteger status = readOrNull(regulatory);
            if (status == null) {
                log.warn("Compliance rejected subject={} reason=regulatory signal unreadable", subject);
                return false;
            }
            if (status.signum() != 0) {
                log.info("Compliance rejected subject={} reason=regulatory halt status={}", subject, status);
                return false;
            }
        }
        return true;
    }

    private OracleFeed resolve(String feedId) {
        return feedId == null || feedId.isBlank() ? null : oracleRegistry.require(feedId);
    }

    private BigInteger readOrNull(OracleFeed feed) {
        try {
            OracleReading reading = feed.latestReading();
            if (reading.value() == null || reading.value().signum() < 0 || reading.updatedAt() == null) {
                return null;
            }
            if (Duration.between(reading.updatedAt(), clock.instant()).compareTo(properties.getMaxSignalAge()) > 0) {
                return null;
            }
            return reading.value();
        } catch (OracleUnavailableException ex) {
            log.warn("Compliance signal read failed: {}", ex.getMessage());
            return null;
        }
    }

    /**
     * Replaces both signal slots; null empties a slot.
     */
    public void setFeeds(OracleFeed volatility, OracleFeed regulatory) {
        this.volatilityFeed = volatility;
        this.regulatoryFeed = regulatory;
        log.info("Compliance feeds set volatility={} regulatory={}",
                volatility != null ? volatility.id() : "none",
                regulatory != null ? regulatory.id() : "none");
    }

    public void blockTrader(String actor) {
        blockedTraders.add(actor);
    }

    public void unblockTrader(String actor) {
        blockedTraders.remove(actor);
    }

    public Set<String> getBlockedTraders() {
        return Set.copyOf(blockedTraders);
    }
}
