package com.cuttlefish.backend.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "agent.prediction")
@Data
@Validated
public class PredictionProperties {

    private boolean enabled = true;

    @NotBlank
    private String sourceCode = "eth-usd-forecast";

    private long subscriptionId = 1;

    @NotBlank
    private String donId = "fun-local-1";

    @Min(1)
    private int callbackGasLimit = 300_000;

    @NotNull
    private Duration pendingTimeout = Duration.ofHours(1);

    @NotNull
    private Duration tradeDeadline = Duration.ofMinutes(5);

    @Min(0)
    @Max(10_000)
    private int rewardConfidenceBps = 8000;

    private boolean upkeepEnabled = true;

    @Min(1000)
    private long upkeepPollMillis = 60_000;

    @NotBlank
    private String keeperActor = "automation-keeper";
}
