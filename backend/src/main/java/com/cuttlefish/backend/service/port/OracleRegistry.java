package com.cuttlefish.backend.service.port;

import com.cuttlefish.backend.config.OracleProperties;
import com.cuttlefish.backend.exception.BadRequestException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Known oracle feeds by id. Rotating a gate to another feed means pointing it at another id here.
 */
@Component
@Slf4j
public class OracleRegistry {

    private final Map<String, OracleFeed> feeds = new ConcurrentHashMap<>();

    public OracleRegistry(OracleProperties properties, Clock clock) {
        properties.getFeeds().forEach((id, definition) -> {
            StaticOracleFeed feed = new StaticOracleFeed(id, definition.getDecimals(), definition.getDescription());
            if (definition.getInitialValue() != null) {
                feed.update(definition.getInitialValue(), clock.instant());
            }
            register(feed);
        });
    }

    public void register(OracleFeed feed) {
        feeds.put(feed.id(), feed);
        log.info("Registered oracle feed id={} decimals={} description={}", feed.id(), feed.decimals(), feed.description());
    }

    public Optional<OracleFeed> find(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(feeds.get(id));
    }

    public OracleFeed require(String id) {
        return find(id).orElseThrow(() -> new BadRequestException("Unknown oracle feed: " + id));
    }

    public List<String> ids() {
        return feeds.keySet().stream().sorted().toList();
    }
}
