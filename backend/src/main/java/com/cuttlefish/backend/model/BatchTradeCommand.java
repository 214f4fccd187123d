package com.cuttlefish.backend.model;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

public record BatchTradeCommand(
        List<BigInteger> amountsIn,
        List<BigInteger> amountsOutMin,
        Instant deadline,
        int confidenceBps
) {
}
