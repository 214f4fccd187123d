package com.cuttlefish.backend.event;

import java.time.Duration;
import java.time.Instant;

public record StalePredictionDetectedEvent(String requestId, Duration pendingFor, Instant occurredAt) {
}
