package com.cuttlefish.backend.event;

import java.math.BigInteger;
import java.time.Instant;

public record PriceCheckedEvent(
        BigInteger price,
        BigInteger threshold,
        boolean valid,
        boolean confirmed,
        Instant occurredAt
) {
}
