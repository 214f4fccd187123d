package com.cuttlefish.backend.config;

import com.cuttlefish.backend.model.Capability;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Capabilities granted at start-up, keyed by actor id.
 */
@Configuration
@ConfigurationProperties(prefix = "agent.access")
@Data
public class AccessProperties {

    private Map<String, Set<Capability>> grants = new LinkedHashMap<>();
}
