package com.cuttlefish.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "agent.oracles")
@Data
@Validated
public class OracleProperties {

    @NotBlank
    private String priceFeed = "eth-usd";

    // blank leaves the eco slot unconfigured
    private String ecoFeed;

    private Map<String, FeedDefinition> feeds = new LinkedHashMap<>();

    @Data
    public static class FeedDefinition {
        @Min(0)
        private int decimals = 8;

        private String description;

        // null starts the feed without a reading
        private BigInteger initialValue;
    }
}
