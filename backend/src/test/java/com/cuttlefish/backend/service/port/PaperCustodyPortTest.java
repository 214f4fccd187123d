package com.cuttlefish.backend.service.port;

import com.cuttlefish.backend.config.CustodyProperties;
import com.cuttlefish.backend.exception.CustodyExecutionException;
import com.cuttlefish.backend.model.ExecutionReceipt;
import com.cuttlefish.backend.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PaperCustodyPortTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final BigInteger E18 = BigInteger.TEN.pow(18);
    private static final List<String> PATH = List.of("WETH", "USDC");

    private final MutableClock clock = new MutableClock(NOW);
    private CustodyProperties properties;
    private PaperCustodyPort custody;

    @BeforeEach
    void setUp() {
        properties = new CustodyProperties();
        properties.setInitialBalance(BigInteger.valueOf(5).multiply(E18));
        custody = new PaperCustodyPort(properties, clock);
    }

    @Test
    void swapDebitsVaultAndChargesFee() {
        ExecutionReceipt receipt = custody.execute(E18, BigInteger.ZERO, PATH, NOW.plusSeconds(60));

        // 1 WETH less 30 bps at 2500 USDC (6 decimals)
        assertThat(receipt.amountOut()).isEqualTo(BigInteger.valueOf(2_492_500_000L));
        assertThat(receipt.path()).isEqualTo(PATH);
        assertThat(custody.getBalance()).isEqualTo(BigInteger.valueOf(4).multiply(E18));
        assertThat(custody.getFeesAccrued()).isEqualTo(E18.divide(BigInteger.valueOf(10_000)).multiply(BigInteger.valueOf(30)));
    }

    @Test
    void expiredDeadlineIsRefused() {
        assertThatThrownBy(() -> custody.execute(E18, BigInteger.ZERO, PATH, NOW.minusSeconds(1)))
                .isInstanceOfSatisfying(CustodyExecutionException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo("Transaction too old"));
    }

    @Test
    void slippageFloorIsEnforced() {
        assertThatThrownBy(() -> custody.execute(E18, BigInteger.valueOf(2_500_000_000L), PATH, NOW))
                .isInstanceOfSatisfying(CustodyExecutionException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo("Insufficient output amount"));
        assertThat(custody.getBalance()).isEqualTo(BigInteger.valueOf(5).multiply(E18));
    }

    @Test
    void vaultCannotGoNegative() {
        assertThatThrownBy(() -> custody.execute(BigInteger.valueOf(6).multiply(E18), BigInteger.ZERO, PATH, NOW))
                .isInstanceOfSatisfying(CustodyExecutionException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo("Insufficient vault balance"));
    }
}
