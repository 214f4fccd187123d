package com.cuttlefish.backend.event;

import java.time.Instant;

public record EmergencyStopActivatedEvent(String actor, String reason, Instant occurredAt) {
}
