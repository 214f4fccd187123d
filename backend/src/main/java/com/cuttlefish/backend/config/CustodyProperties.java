package com.cuttlefish.backend.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigInteger;

@Configuration
@ConfigurationProperties(prefix = "agent.custody")
@Data
@Validated
public class CustodyProperties {

    @NotNull
    private BigInteger initialBalance = new BigInteger("10000000000000000000000");

    // output units received per 1e18 input units
    @NotNull
    private BigInteger exchangeRate = BigInteger.valueOf(2_500_000_000L);

    @Min(0)
    @Max(10_000)
    private int feeBps = 30;
}
