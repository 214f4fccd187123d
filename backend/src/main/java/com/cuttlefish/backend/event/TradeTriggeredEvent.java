package com.cuttlefish.backend.event;

import java.math.BigInteger;
import java.time.Instant;

public record TradeTriggeredEvent(
        long tradeId,
        String actor,
        BigInteger amountIn,
        BigInteger amountOutMin,
        BigInteger amountOut,
        BigInteger price,
        int confidenceBps,
        Instant occurredAt
) {
}
