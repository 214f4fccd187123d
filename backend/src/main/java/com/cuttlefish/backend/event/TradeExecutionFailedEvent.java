package com.cuttlefish.backend.event;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Custody execution failed and the admission was rolled back. {@code repeated} marks a failure
 * streak long enough to need an operator.
 */
public record TradeExecutionFailedEvent(
        long tradeId,
        BigInteger amountIn,
        String reason,
        int consecutiveFailures,
        boolean repeated,
        Instant occurredAt
) {
}
