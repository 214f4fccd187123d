package com.cuttlefish.backend.service;

import com.cuttlefish.backend.config.PredictionProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Automation keeper: polls checkUpkeep and fires performUpkeep as the configured keeper actor.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "agent.prediction", name = "upkeep-enabled", havingValue = "true", matchIfMissing = true)
public class UpkeepScheduler {

    private final PredictionLifecycle lifecycle;
    private final PredictionProperties properties;

    @Scheduled(fixedDelayString = "${agent.prediction.upkeep-poll-millis:60000}")
    public void poll() {
        lifecycle.detectStalePending();
        PredictionLifecycle.UpkeepCheck check = lifecycle.checkUpkeep();
        if (!check.upkeepNeeded()) {
            log.debug("Upkeep not needed reason={}", check.reason());
            return;
        }
        try {
            lifecycle.performUpkeep(properties.getKeeperActor());
        } catch (RuntimeException ex) {
            log.warn("Upkeep failed keeper={} reason={}", properties.getKeeperActor(), ex.getMessage());
        }
    }
}
