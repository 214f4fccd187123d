package com.cuttlefish.backend.service.port;

import com.cuttlefish.backend.model.ExecutionReceipt;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

/**
 * The component that holds the funds and performs the swap. Failures are reported as
 * {@link com.cuttlefish.backend.exception.CustodyExecutionException} carrying the custody's own reason.
 */
public interface CustodyPort {

    ExecutionReceipt execute(BigInteger amountIn, BigInteger minAmountOut, List<String> path, Instant deadline);
}
