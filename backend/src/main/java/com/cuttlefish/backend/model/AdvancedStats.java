package com.cuttlefish.backend.model;

import java.time.Instant;

public record AdvancedStats(
        TradingStats trading,
        long totalPredictions,
        long fulfilledPredictions,
        long rejectedPredictions,
        long erroredPredictions,
        long abandonedPredictions,
        long rewardTokensMinted,
        int pendingRequests,
        Instant lastPredictionTime
) {
}
