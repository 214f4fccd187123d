package com.cuttlefish.backend.model;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

public record ExecutionReceipt(
        String executionId,
        BigInteger amountIn,
        BigInteger amountOut,
        List<String> path,
        Instant executedAt
) {
}
