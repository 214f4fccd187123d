package com.cuttlefish.backend.event;

import com.cuttlefish.backend.model.PredictionStatus;

import java.math.BigInteger;
import java.time.Instant;

public record PredictionFulfilledEvent(
        String requestId,
        PredictionStatus status,
        BigInteger predictedPrice,
        int confidenceBps,
        boolean anomaly,
        String reason,
        Instant occurredAt
) {
}
