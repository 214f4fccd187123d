package com.cuttlefish.backend.event;

import java.math.BigInteger;
import java.time.Instant;

public record PriceDeviationDetectedEvent(
        BigInteger previousPrice,
        BigInteger currentPrice,
        long deviationBps,
        int thresholdBps,
        Instant occurredAt
) {
}
