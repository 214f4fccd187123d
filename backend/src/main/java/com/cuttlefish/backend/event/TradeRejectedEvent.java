package com.cuttlefish.backend.event;

import com.cuttlefish.backend.model.RejectReason;

import java.math.BigInteger;
import java.time.Instant;

public record TradeRejectedEvent(String actor, BigInteger amountIn, RejectReason reason, Instant occurredAt) {
}
