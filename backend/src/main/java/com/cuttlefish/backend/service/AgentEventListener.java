package com.cuttlefish.backend.service;

import com.cuttlefish.backend.event.ComplianceValidatedEvent;
import com.cuttlefish.backend.event.ConfigUpdatedEvent;
import com.cuttlefish.backend.event.EcoScoreCheckedEvent;
import com.cuttlefish.backend.event.EmergencyStopActivatedEvent;
import com.cuttlefish.backend.event.EmergencyStopDeactivatedEvent;
import com.cuttlefish.backend.event.PendingPredictionResetEvent;
import com.cuttlefish.backend.event.PredictionFulfilledEvent;
import com.cuttlefish.backend.event.PredictionRequestedEvent;
import com.cuttlefish.backend.event.PredictionTokenMintedEvent;
import com.cuttlefish.backend.event.PriceCheckedEvent;
import com.cuttlefish.backend.event.PriceDeviationDetectedEvent;
import com.cuttlefish.backend.event.StalePredictionDetectedEvent;
import com.cuttlefish.backend.event.TradeExecutionFailedEvent;
import com.cuttlefish.backend.event.TradeRejectedEvent;
import com.cuttlefish.backend.event.TradeTriggeredEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs agent events and feeds the Micrometer meters.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AgentEventListener {

    private final MetricsService metricsService;

    @EventListener
    public void onTradeTriggered(TradeTriggeredEvent event) {
        log.info("event=TradeTriggered tradeId={} actor={} amountIn={} amountOut={} price={} confidenceBps={}",
                event.tradeId(), event.actor(), event.amountIn(), event.amountOut(), event.price(), event.confidenceBps());
        metricsService.recordTradeSettled();
    }

    @EventListener
    public void onTradeRejected(TradeRejectedEvent event) {
        log.debug("event=TradeRejected actor={} amountIn={} reason={}", event.actor(), event.amountIn(), event.reason());
        metricsService.recordReject(event.reason().name());
    }

    @EventListener
    public void onTradeExecutionFailed(TradeExecutionFailedEvent event) {
        if (event.repeated()) {
            log.error("event=TradeExecutionFailed tradeId={} reason={} consecutiveFailures={} operator attention required",
                    event.tradeId(), event.reason(), event.consecutiveFailures());
        } else {
            log.warn("event=TradeExecutionFailed tradeId={} reason={} consecutiveFailures={}",
                    event.tradeId(), event.reason(), event.consecutiveFailures());
        }
        metricsService.recordTradeRolledBack();
    }

    @EventListener
    public void onPriceChecked(PriceCheckedEvent event) {
        log.debug("event=PriceChecked price={} threshold={} valid={} confirmed={}",
                event.price(), event.threshold(), event.valid(), event.confirmed());
    }

    @EventListener
    public void onPriceDeviation(PriceDeviationDetectedEvent event) {
        log.warn("event=PriceDeviationDetected previous={} current={} deviationBps={} thresholdBps={}",
                event.previousPrice(), event.currentPrice(), event.deviationBps(), event.thresholdBps());
    }

    @EventListener
    public void onConfigUpdated(ConfigUpdatedEvent event) {
        log.info("event=ConfigUpdated actor={} old={} new={}", event.actor(), event.oldConfig(), event.newConfig());
    }

    @EventListener
    public void onEmergencyActivated(EmergencyStopActivatedEvent event) {
        log.error("event=EmergencyStopActivated actor={} reason={}", event.actor(), event.reason());
        metricsService.recordEmergencyStop();
    }

    @EventListener
    public void onEmergencyDeactivated(EmergencyStopDeactivatedEvent event) {
        log.warn("event=EmergencyStopDeactivated actor={}", event.actor());
    }

    @EventListener
    public void onComplianceValidated(ComplianceValidatedEvent event) {
        log.info("event=ComplianceValidated requestId={} actor={} value={} approved={}",
                event.requestId(), event.actor(), event.value(), event.approved());
    }

    @EventListener
    public void onEcoScoreChecked(EcoScoreCheckedEvent event) {
        log.info("event=EcoScoreChecked requestId={} score={} threshold={} blocked={}",
                event.requestId(), event.score(), event.threshold(), event.blocked());
    }

    @EventListener
    public void onPredictionRequested(PredictionRequestedEvent event) {
        log.info("event=PredictionRequested requestId={} currentPrice={}", event.requestId(), event.currentPrice());
        metricsService.recordPredictionOutcome("REQUESTED");
    }

    @EventListener
    public void onPredictionFulfilled(PredictionFulfilledEvent event) {
        log.info("event=PredictionFulfilled requestId={} status={} predictedPrice={} confidenceBps={} anomaly={} reason={}",
                event.requestId(), event.status(), event.predictedPrice(), event.confidenceBps(), event.anomaly(),
                event.reason());
        metricsService.recordPredictionOutcome(event.status().name());
    }

    @EventListener
    public void onTokenMinted(PredictionTokenMintedEvent event) {
        log.info("event=PredictionTokenMinted tokenId={} requestId={}", event.tokenId(), event.requestId());
        metricsService.recordRewardTokenMinted();
    }

    @EventListener
    public void onPendingReset(PendingPredictionResetEvent event) {
        log.warn("event=PendingPredictionReset actor={} abandoned={}", event.actor(), event.abandonedRequestIds());
        metricsService.recordPredictionOutcome("ABANDONED");
    }

    @EventListener
    public void onStalePrediction(StalePredictionDetectedEvent event) {
        log.error("event=StalePredictionDetected requestId={} pendingFor={} operator reset required",
                event.requestId(), event.pendingFor());
    }
}
