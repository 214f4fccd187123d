package com.cuttlefish.backend.event;

import java.time.Instant;

public record PredictionTokenMintedEvent(long tokenId, String requestId, int confidenceBps, Instant occurredAt) {
}
