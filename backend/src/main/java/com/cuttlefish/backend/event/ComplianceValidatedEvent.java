package com.cuttlefish.backend.event;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Outcome of a compliance check. {@code requestId} is set for prediction checks, {@code actor}
 * for trade checks.
 */
public record ComplianceValidatedEvent(
        String requestId,
        String actor,
        BigInteger value,
        boolean approved,
        Instant occurredAt
) {
}
