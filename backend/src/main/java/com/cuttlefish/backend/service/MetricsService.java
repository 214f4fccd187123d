package com.cuttlefish.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;
    private final TradingAgentState agentState;
    private final PredictionLifecycle lifecycle;

    private final AtomicLong tradesSettled = new AtomicLong();
    private final AtomicLong tradesRolledBack = new AtomicLong();
    private final ConcurrentHashMap<String, AtomicLong> rejectsByReason = new ConcurrentHashMap<>();

    private Counter tradesSettledCounter;
    private Counter tradesRolledBackCounter;
    private Counter emergencyStopsCounter;
    private Counter rewardTokensCounter;

    @jakarta.annotation.PostConstruct
    void init() {
        tradesSettledCounter = Counter.builder("agent_trades_settled_total").register(meterRegistry);
        tradesRolledBackCounter = Counter.builder("agent_trades_rolled_back_total").register(meterRegistry);
        emergencyStopsCounter = Counter.builder("agent_emergency_stops_total").register(meterRegistry);
        rewardTokensCounter = Counter.builder("agent_reward_tokens_minted_total").register(meterRegistry);
        Gauge.builder("agent_pending_predictions", lifecycle, PredictionLifecycle::getPendingRequestsCount)
                .register(meterRegistry);
        // 18-decimal amount scaled to whole units
        Gauge.builder("agent_daily_trade_volume", agentState,
                        state -> new BigDecimal(state.rateState().dailyTradeVolume()).movePointLeft(18).doubleValue())
                .register(meterRegistry);
        Gauge.builder("agent_consecutive_execution_failures", agentState, TradingAgentState::consecutiveExecutionFailures)
                .register(meterRegistry);
    }

    public void recordTradeSettled() {
        tradesSettled.incrementAndGet();
        if (tradesSettledCounter != null) {
            tradesSettledCounter.increment();
        }
    }

    public void recordTradeRolledBack() {
        tradesRolledBack.incrementAndGet();
        if (tradesRolledBackCounter != null) {
            tradesRolledBackCounter.increment();
        }
    }

    public void recordReject(String reason) {
        rejectsByReason.computeIfAbsent(reason, key -> new AtomicLong()).incrementAndGet();
        Counter.builder("agent_trades_rejected_total")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    public void recordPredictionOutcome(String status) {
        Counter.builder("agent_predictions_total")
                .tag("status", status == null ? "unknown" : status)
                .register(meterRegistry)
                .increment();
    }

    public void recordEmergencyStop() {
        if (emergencyStopsCounter != null) {
            emergencyStopsCounter.increment();
        }
    }

    public void recordRewardTokenMinted() {
        if (rewardTokensCounter != null) {
            rewardTokensCounter.increment();
        }
    }

    public long tradesSettled() {
        return tradesSettled.get();
    }

    public long tradesRolledBack() {
        return tradesRolledBack.get();
    }

    public Map<String, Long> rejectCounts() {
        return rejectsByReason.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, entry -> entry.getValue().get()));
    }
}
