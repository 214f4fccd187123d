package com.cuttlefish.backend.dto;

import com.cuttlefish.backend.model.TradingConfig;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Duration;

/**
 * Full replacement of the trading config. Range rules are enforced by {@link TradingConfig#violations()}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfigUpdateRequest {

    @NotNull
    private BigInteger priceThreshold;

    @NotNull
    private BigInteger maxTradeSize;

    @NotNull
    private BigInteger dailyTradeLimit;

    @PositiveOrZero
    private long cooldownSeconds;

    private int maxSlippageBps;

    private int confidenceThresholdBps;

    private int deviationThresholdBps;

    @NotNull
    private BigInteger ecoThreshold;

    @PositiveOrZero
    private long predictionIntervalSeconds;

    public TradingConfig toConfig() {
        return TradingConfig.builder()
                .priceThreshold(priceThreshold)
                .maxTradeSize(maxTradeSize)
                .dailyTradeLimit(dailyTradeLimit)
                .cooldownPeriod(Duration.ofSeconds(cooldownSeconds))
                .maxSlippageBps(maxSlippageBps)
                .confidenceThresholdBps(confidenceThresholdBps)
                .deviationThresholdBps(deviationThresholdBps)
                .ecoThreshold(ecoThreshold)
                .predictionInterval(Duration.ofSeconds(predictionIntervalSeconds))
                .build();
    }
}
