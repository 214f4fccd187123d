package com.cuttlefish.backend.event;

import java.time.Instant;

public record EmergencyStopDeactivatedEvent(String actor, Instant occurredAt) {
}
