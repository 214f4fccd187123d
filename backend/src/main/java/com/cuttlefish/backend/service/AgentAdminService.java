package com.cuttlefish.backend.service;

import com.cuttlefish.backend.event.ConfigUpdatedEvent;
import com.cuttlefish.backend.exception.BadRequestException;
import com.cuttlefish.backend.model.Capability;
import com.cuttlefish.backend.model.TradingConfig;
import com.cuttlefish.backend.service.port.OracleFeed;
import com.cuttlefish.backend.service.port.OracleRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * ADMIN setters: config replacement, target asset and oracle rotation.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AgentAdminService {

    private final TradingAgentState agentState;
    private final AccessControlService accessControl;
    private final SingleFlightGuard guard;
    private final OracleRegistry oracleRegistry;
    private final PriceOracleGateway priceOracle;
    private final EcoGate ecoGate;
    private final ComplianceEngine complianceEngine;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public TradingConfig updateConfig(String actor, TradingConfig next) {
        return applyConfig(actor, current -> next);
    }

    public TradingConfig setPriceThreshold(String actor, BigInteger priceThreshold) {
        return applyConfig(actor, current -> current.toBuilder().priceThreshold(priceThreshold).build());
    }

    public String setTargetAsset(String actor, String asset) {
        accessControl.requireCapability(actor, Capability.ADMIN);
        if (asset == null || asset.isBlank()) {
            throw new BadRequestException("Invalid target asset");
        }
        if (asset.equalsIgnoreCase(agentState.sourceAsset())) {
            throw new BadRequestException("Target asset must differ from source asset");
        }
        return guard.run("setTargetAsset", () -> {
            String previous = agentState.targetAsset();
            agentState.changeTargetAsset(asset);
            log.info("Target asset changed from={} to={} actor={}", previous, asset, actor);
            return asset;
        });
    }

    public String rotatePriceFeed(String actor, String feedId) {
        accessControl.requireCapability(actor, Capability.ADMIN);
        OracleFeed feed = oracleRegistry.require(feedId);
        guard.run("rotatePriceFeed", () -> priceOracle.rotateFeed(feed));
        return feed.id();
    }

    /**
     * A blank feed id empties the eco slot.
     */
    public String rotateEcoFeed(String actor, String feedId) {
        accessControl.requireCapability(actor, Capability.ADMIN);
        OracleFeed feed = feedId == null || feedId.isBlank() ? null : oracleRegistry.require(feedId);
        guard.run("rotateEcoFeed", () -> ecoGate.rotateFeed(feed));
        return feed == null ? null : feed.id();
    }

    public void setComplianceFeeds(String actor, String volatilityFeedId, String regulatoryFeedId) {
        accessControl.requireCapability(actor, Capability.ADMIN);
        OracleFeed volatility = volatilityFeedId == null || volatilityFeedId.isBlank()
                ? null : oracleRegistry.require(volatilityFeedId);
        OracleFeed regulatory = regulatoryFeedId == null || regulatoryFeedId.isBlank()
                ? null : oracleRegistry.require(regulatoryFeedId);
        guard.run("setComplianceFeeds", () -> complianceEngine.setFeeds(volatility, regulatory));
    }

    private TradingConfig applyConfig(String actor, UnaryOperator<TradingConfig> change) {
        accessControl.requireCapability(actor, Capability.ADMIN);
        return guard.run("updateConfig", () -> {
            TradingConfig current = agentState.config();
            TradingConfig next = change.apply(current);
            List<String> violations = next == null ? List.of("config is required") : next.violations();
            if (!violations.isEmpty()) {
                throw new BadRequestException("Invalid config: " + String.join(", ", violations));
            }
            TradingConfig previous = agentState.replaceConfig(next);
            log.info("Trading config updated actor={} old={} new={}", actor, previous, next);
            eventPublisher.publishEvent(new ConfigUpdatedEvent(actor, previous, next, clock.instant()));
            return next;
        });
    }
}
