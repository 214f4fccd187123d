package com.cuttlefish.backend.event;

import java.math.BigInteger;
import java.time.Instant;

public record EcoScoreCheckedEvent(
        String requestId,
        BigInteger score,
        BigInteger threshold,
        boolean blocked,
        Instant occurredAt
) {
}
