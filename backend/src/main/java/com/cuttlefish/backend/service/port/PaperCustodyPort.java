package com.cuttlefish.backend.service.port;

import com.cuttlefish.backend.config.CustodyProperties;
import com.cuttlefish.backend.exception.CustodyExecutionException;
import com.cuttlefish.backend.model.ExecutionReceipt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * In-process vault that simulates swaps at a fixed exchange rate.
 */
@Service
@Slf4j
public class PaperCustodyPort implements CustodyPort {

    private static final BigInteger UNIT = BigInteger.TEN.pow(18);
    private static final BigInteger BPS = BigInteger.valueOf(10_000);

    private final CustodyProperties properties;
    private final Clock clock;

    private BigInteger balance;
    private BigInteger feesAccrued = BigInteger.ZERO;

    public PaperCustodyPort(CustodyProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.balance = properties.getInitialBalance();
    }

    @Override
    public synchronized ExecutionReceipt execute(BigInteger amountIn, BigInteger minAmountOut, List<String> path, Instant deadline) {
        Instant now = clock.instant();
        if (deadline == null || now.isAfter(deadline)) {
            throw new CustodyExecutionException("Transaction too old");
        }
        if (path == null || path.size() < 2) {
            throw new CustodyExecutionException("Invalid path");
        }
        if (amountIn == null || amountIn.signum() <= 0) {
            throw new CustodyExecutionException("Invalid amount");
        }
        if (balance.compareTo(amountIn) < 0) {
            throw new CustodyExecutionException("Insufficient vault balance");
        }
        BigInteger fee = amountIn.multiply(BigInteger.valueOf(properties.getFeeBps())).divide(BPS);
        BigInteger amountOut = amountIn.subtract(fee).multiply(properties.getExchangeRate()).divide(UNIT);
        BigInteger floor = minAmountOut == null ? BigInteger.ZERO : minAmountOut;
        if (amountOut.compareTo(floor) < 0) {
            throw new CustodyExecutionException("Insufficient output amount");
        }
        balance = balance.subtract(amountIn);
        feesAccrued = feesAccrued.add(fee);
        String executionId = UUID.randomUUID().toString();
        log.info("Paper swap executed id={} path={} amountIn={} amountOut={} fee={}",
                executionId, path, amountIn, amountOut, fee);
        return new ExecutionReceipt(executionId, amountIn, amountOut, List.copyOf(path), now);
    }

    public synchronized BigInteger getBalance() {
        return balance;
    }

    public synchronized BigInteger getFeesAccrued() {
        return feesAccrued;
    }
}
