package com.cuttlefish.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "agent.security")
@Data
public class SecurityProperties {

    /** HMAC secret for bearer tokens, at least 32 characters. */
    private String jwtSecret;

    private Duration tokenTtl = Duration.ofHours(1);

    /**
     * API keys per actor id in delegating-encoder form, e.g. {bcrypt}$2a$10$... or {noop}key.
     * Only actors listed here can exchange a key for a token.
     */
    private Map<String, String> apiKeys = new LinkedHashMap<>();
}
