package com.cuttlefish.backend.event;

import java.time.Instant;
import java.util.List;

public record PendingPredictionResetEvent(String actor, List<String> abandonedRequestIds, Instant occurredAt) {
}
