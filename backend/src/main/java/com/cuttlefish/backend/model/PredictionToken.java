package com.cuttlefish.backend.model;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Reward token minted for a high-confidence prediction. {@code owner} stays null while the token
 * sits in the pending-claim pool.
 */
public record PredictionToken(
        long tokenId,
        String requestId,
        BigInteger predictedPrice,
        int confidenceBps,
        Instant mintedAt,
        String owner,
        Instant claimedAt
) {

    public boolean isClaimed() {
        return owner != null;
    }

    public PredictionToken claimedBy(String recipient, Instant at) {
        return new PredictionToken(tokenId, requestId, predictedPrice, confidenceBps, mintedAt, recipient, at);
    }
}
