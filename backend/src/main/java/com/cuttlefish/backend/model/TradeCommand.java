package com.cuttlefish.backend.model;

import java.math.BigInteger;
import java.time.Instant;

public record TradeCommand(BigInteger amountIn, BigInteger amountOutMin, Instant deadline, int confidenceBps) {
}
