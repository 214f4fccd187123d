package com.cuttlefish.backend.event;

import java.math.BigInteger;
import java.time.Instant;

public record PredictionRequestedEvent(String requestId, BigInteger currentPrice, Instant occurredAt) {
}
