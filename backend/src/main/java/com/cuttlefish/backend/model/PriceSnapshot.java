package com.cuttlefish.backend.model;

import java.math.BigInteger;
import java.time.Instant;

/**
 * A validated oracle price. {@code confirmed} is false when the read moved further from the last
 * committed price than the deviation threshold allows.
 */
public record PriceSnapshot(BigInteger price, Instant updatedAt, boolean confirmed, long deviationBps) {
}
