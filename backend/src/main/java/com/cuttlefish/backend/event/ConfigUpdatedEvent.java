package com.cuttlefish.backend.event;

import com.cuttlefish.backend.model.TradingConfig;

import java.time.Instant;

public record ConfigUpdatedEvent(String actor, TradingConfig oldConfig, TradingConfig newConfig, Instant occurredAt) {
}
