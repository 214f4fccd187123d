package com.cuttlefish.backend.service.port;

import com.cuttlefish.backend.exception.OracleUnavailableException;
import com.cuttlefish.backend.model.OracleReading;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Feed whose reading is pushed from outside (config, dev endpoint, tests).
 */
public class StaticOracleFeed implements OracleFeed {

    private final String id;
    private final int decimals;
    private final String description;

    private volatile OracleReading reading;
    private volatile String unavailableReason;

    public StaticOracleFeed(String id, int decimals, String description) {
        this.id = id;
        this.decimals = decimals;
        this.description = description;
        this.unavailableReason = "no reading yet";
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public int decimals() {
        return decimals;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public OracleReading latestReading() {
        String reason = unavailableReason;
        OracleReading current = reading;
        if (reason != null || current == null) {
            throw new OracleUnavailableException(id, reason != null ? reason : "no reading yet");
        }
        return current;
    }

    public void update(BigInteger value, Instant updatedAt) {
        this.reading = new OracleReading(value, updatedAt);
        this.unavailableReason = null;
    }

    public void markUnavailable(String reason) {
        this.unavailableReason = reason == null || reason.isBlank() ? "unavailable" : reason;
    }
}
