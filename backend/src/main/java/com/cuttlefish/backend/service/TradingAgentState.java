package com.cuttlefish.backend.service;

import com.cuttlefish.backend.config.TradingProperties;
import com.cuttlefish.backend.model.EmergencyState;
import com.cuttlefish.backend.model.RateState;
import com.cuttlefish.backend.model.TradingConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Mutable state of the agent. Readers get immutable snapshots; writers are the services of this
 * package, which reach the mutators only from inside their guarded entry points.
 */
@Component
@Slf4j
public class TradingAgentState {

    private final AtomicReference<TradingConfig> config;
    private final AtomicReference<RateState> rateState;
    private final AtomicReference<EmergencyState> emergencyState = new AtomicReference<>(EmergencyState.operational());
    private final AtomicInteger consecutiveExecutionFailures = new AtomicInteger();
    private final String sourceAsset;
    private volatile String targetAsset;

    public TradingAgentState(TradingProperties properties, Clock clock) {
        TradingConfig initial = properties.toTradingConfig();
        List<String> violations = initial.violations();
        if (!violations.isEmpty()) {
            throw new IllegalStateException("Invalid initial trading config: " + String.join(", ", violations));
        }
        this.config = new AtomicReference<>(initial);
        this.rateState = new AtomicReference<>(RateState.initial(clock.instant()));
        this.sourceAsset = properties.getSourceAsset();
        this.targetAsset = properties.getTargetAsset();
    }

    public TradingConfig config() {
        return config.get();
    }

    public RateState rateState() {
        return rateState.get();
    }

    public EmergencyState emergencyState() {
        return emergencyState.get();
    }

    public String sourceAsset() {
        return sourceAsset;
    }

    public String targetAsset() {
        return targetAsset;
    }

    public int consecutiveExecutionFailures() {
        return consecutiveExecutionFailures.get();
    }

    TradingConfig replaceConfig(TradingConfig next) {
        return config.getAndSet(next);
    }

    void updateRateState(UnaryOperator<RateState> transition) {
        rateState.updateAndGet(transition);
    }

    EmergencyState updateEmergencyState(UnaryOperator<EmergencyState> transition) {
        return emergencyState.getAndUpdate(transition);
    }

    void seedLastValidPrice(BigInteger price) {
        rateState.updateAndGet(state -> state.withLastValidPrice(price));
    }

    void changeTargetAsset(String asset) {
        this.targetAsset = asset;
    }

    int recordExecutionFailure() {
        return consecutiveExecutionFailures.incrementAndGet();
    }

    void resetExecutionFailures() {
        consecutiveExecutionFailures.set(0);
    }
}
