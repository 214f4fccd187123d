package com.cuttlefish.backend.model;

import java.math.BigInteger;
import java.time.Instant;

/**
 * One oracle prediction round trip. Rejected, errored and abandoned requests keep their
 * prediction fields at the initial values; only {@code status} records how they ended.
 */
public record PredictionRequest(
        String requestId,
        Instant timestamp,
        BigInteger currentPriceAtRequest,
        boolean priceConfirmed,
        PredictionStatus status,
        boolean fulfilled,
        BigInteger predictedPrice,
        int confidenceBps,
        boolean anomaly,
        boolean executed,
        String failureReason
) {

    public static PredictionRequest requested(String requestId, Instant timestamp, PriceSnapshot snapshot) {
        return new PredictionRequest(requestId, timestamp, snapshot.price(), snapshot.confirmed(),
                PredictionStatus.REQUESTED, false, BigInteger.ZERO, 0, false, false, null);
    }

    public boolean isPending() {
        return status == PredictionStatus.REQUESTED;
    }

    public PredictionRequest fulfilledWith(BigInteger predictedPrice, int confidenceBps, boolean anomaly) {
        return new PredictionRequest(requestId, timestamp, currentPriceAtRequest, priceConfirmed,
                PredictionStatus.FULFILLED, true, predictedPrice, confidenceBps, anomaly, false, null);
    }

    public PredictionRequest endedWith(PredictionStatus endStatus, String reason) {
        return new PredictionRequest(requestId, timestamp, currentPriceAtRequest, priceConfirmed,
                endStatus, fulfilled, predictedPrice, confidenceBps, anomaly, executed, reason);
    }

    public PredictionRequest markExecuted() {
        return new PredictionRequest(requestId, timestamp, currentPriceAtRequest, priceConfirmed,
                status, fulfilled, predictedPrice, confidenceBps, anomaly, true, failureReason);
    }
}
