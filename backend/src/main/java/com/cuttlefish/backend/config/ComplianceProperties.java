package com.cuttlefish.backend.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

@Configuration
@ConfigurationProperties(prefix = "agent.compliance")
@Data
@Validated
public class ComplianceProperties {

    private String volatilityFeed;

    private String regulatoryFeed;

    @Min(0)
    private int maxVolatilityBps = 2000;

    private Duration maxSignalAge = Duration.ofHours(1);

    private Set<String> blockedTraders = new LinkedHashSet<>();
}
