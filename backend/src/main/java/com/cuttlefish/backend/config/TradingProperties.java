package com.cuttlefish.backend.config;

import com.cuttlefish.backend.model.TradingConfig;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigInteger;
import java.time.Duration;

/**
 * Initial trading limits. Runtime replacement goes through the admin API.
 */
@Configuration
@ConfigurationProperties(prefix = "agent.trading")
@Data
@Validated
public class TradingProperties {

    @NotBlank
    private String sourceAsset = "WETH";

    @NotBlank
    private String targetAsset = "USDC";

    @NotNull
    private BigInteger priceThreshold = new BigInteger("200000000000");

    @NotNull
    private BigInteger maxTradeSize = new BigInteger("100000000000000000000");

    @NotNull
    private BigInteger dailyTradeLimit = new BigInteger("1000000000000000000000");

    @NotNull
    private Duration cooldownPeriod = Duration.ofSeconds(300);

    @Min(0)
    @Max(TradingConfig.MAX_SLIPPAGE_BPS)
    private int maxSlippageBps = 300;

    @Min(0)
    @Max(TradingConfig.MAX_CONFIDENCE_BPS)
    private int confidenceThresholdBps = 7000;

    @Min(0)
    @Max(TradingConfig.MAX_DEVIATION_BPS)
    private int deviationThresholdBps = 1000;

    @NotNull
    private BigInteger ecoThreshold = BigInteger.valueOf(1000);

    @NotNull
    private Duration predictionInterval = Duration.ofHours(1);

    @Min(1)
    private int maxConsecutiveExecutionFailures = 3;

    public TradingConfig toTradingConfig() {
        return TradingConfig.builder()
                .priceThreshold(priceThreshold)
                .maxTradeSize(maxTradeSize)
                .dailyTradeLimit(dailyTradeLimit)
                .cooldownPeriod(cooldownPeriod)
                .maxSlippageBps(maxSlippageBps)
                .confidenceThresholdBps(confidenceThresholdBps)
                .deviationThresholdBps(deviationThresholdBps)
                .ecoThreshold(ecoThreshold)
                .predictionInterval(predictionInterval)
                .build();
    }
}
