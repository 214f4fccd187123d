package com.cuttlefish.backend.service;

import com.cuttlefish.backend.config.PredictionProperties;
import com.cuttlefish.backend.event.ComplianceValidatedEvent;
import com.cuttlefish.backend.event.EcoScoreCheckedEvent;
import com.cuttlefish.backend.event.PendingPredictionResetEvent;
import com.cuttlefish.backend.event.PredictionFulfilledEvent;
import com.cuttlefish.backend.event.PredictionRequestedEvent;
import com.cuttlefish.backend.event.StalePredictionDetectedEvent;
import com.cuttlefish.backend.exception.BadRequestException;
import com.cuttlefish.backend.exception.PredictionDecodeException;
import com.cuttlefish.backend.exception.TradeRejectedException;
import com.cuttlefish.backend.model.AdvancedStats;
import com.cuttlefish.backend.model.Capability;
import com.cuttlefish.backend.model.EmergencyState;
import com.cuttlefish.backend.model.PredictionRequest;
import com.cuttlefish.backend.model.PredictionStatus;
import com.cuttlefish.backend.model.PredictionToken;
import com.cuttlefish.backend.model.PriceSnapshot;
import com.cuttlefish.backend.model.RejectReason;
import com.cuttlefish.backend.model.TradingConfig;
import com.cuttlefish.backend.service.port.PredictionBridge;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Request/fulfillment cycle with the off-chain prediction service. At most one request is in
 * flight; a fulfilled request may trigger one trade through {@link TradeAuthorizer}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PredictionLifecycle {

    public static final int MAX_CONFIDENCE_BPS = 10_000;
    public static final String PREDICTION_TRADER = "prediction-lifecycle";

    private static final BigInteger BPS = BigInteger.valueOf(10_000);
    private static final BigInteger MAX_MULTIPLIER = BigInteger.valueOf(3);

    private final TradingAgentState agentState;
    private final EmergencyControl emergencyControl;
    private final PredictionProperties properties;
    private final PredictionBridge bridge;
    private final PredictionPayloadDecoder decoder;
    private final PriceOracleGateway priceOracle;
    private final ComplianceGate complianceGate;
    private final EcoGate ecoGate;
    private final TradeAuthorizer tradeAuthorizer;
    private final PredictionTokenService tokenService;
    private final AccessControlService accessControl;
    private final SingleFlightGuard guard;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private final Map<String, PredictionRequest> requests = new LinkedHashMap<>();
    private volatile String pendingRequestId;
    private volatile String staleReportedId;
    private volatile int pendingRequestsCount;
    private volatile Instant lastPredictionTime = Instant.EPOCH;
    private volatile long totalPredictions;
    private volatile long fulfilledPredictions;
    private volatile long rejectedPredictions;
    private volatile long erroredPredictions;
    private volatile long abandonedPredictions;

    public PredictionRequest requestPrediction(String actor) {
        accessControl.requireCapability(actor, Capability.AI_TRADER);
        return guard.run("requestPrediction", () -> issueRequest(actor));
    }

    /**
     * Whether the scheduled trigger should fire now. Never mutates state.
     */
    public UpkeepCheck checkUpkeep() {
        EmergencyState emergency = agentState.emergencyState();
        if (emergency.emergencyStop()) {
            return UpkeepCheck.notNeeded("Emergency stop active");
        }
        if (emergency.paused()) {
            return UpkeepCheck.notNeeded("Contract paused");
        }
        if (!properties.isEnabled()) {
            return UpkeepCheck.notNeeded("Predictions disabled");
        }
        if (pendingRequestsCount > 0) {
            return UpkeepCheck.notNeeded("Pending request exists");
        }
        Duration interval = agentState.config().predictionInterval();
        if (clock.instant().isBefore(lastPredictionTime.plus(interval))) {
            return UpkeepCheck.notNeeded("Prediction interval not elapsed");
        }
        return UpkeepCheck.needed();
    }

    public PredictionRequest performUpkeep(String actor) {
        accessControl.requireCapability(actor, Capability.KEEPER);
        return guard.run("performUpkeep", () -> {
            emergencyControl.requireOperational();
            UpkeepCheck check = checkUpkeep();
            if (!check.upkeepNeeded()) {
                throw new TradeRejectedException(RejectReason.UPKEEP_NOT_NEEDED, check.reason());
            }
            return issueRequest(actor);
        });
    }

    /**
     * Callback from the prediction bridge. Decode, range and compliance failures end the request
     * as REJECTED and are reported in the result; only unknown or already settled ids throw.
     */
    public FulfillmentResult fulfill(String actor, String requestId, byte[] payload, String error) {
        accessControl.requireCapability(actor, Capability.PREDICTION_BRIDGE);
        return guard.run("fulfillPrediction", () -> handleFulfillment(requestId, () -> payload, error));
    }

    /**
     * As {@link #fulfill} with the payload as a hex string; a malformed string rejects the request
     * like any other decode failure.
     */
    public FulfillmentResult fulfillHex(String actor, String requestId, String payloadHex, String error) {
        accessControl.requireCapability(actor, Capability.PREDICTION_BRIDGE);
        return guard.run("fulfillPrediction",
                () -> handleFulfillment(requestId, () -> decoder.parseHex(payloadHex), error));
    }

    public PredictionRequest resetPendingRequest(String actor) {
        accessControl.requireCapability(actor, Capability.ADMIN);
        return guard.run("resetPendingRequest", () -> {
            Instant now = clock.instant();
            PredictionRequest pending = pendingRequestId == null ? null : getRequest(pendingRequestId).orElse(null);
            if (pending == null || pendingRequestsCount == 0) {
                throw new TradeRejectedException(RejectReason.NO_PENDING_REQUEST);
            }
            Duration age = Duration.between(pending.timestamp(), now);
            if (age.compareTo(properties.getPendingTimeout()) < 0) {
                throw new TradeRejectedException(RejectReason.PENDING_REQUEST_NOT_EXPIRED,
                        "pending for " + age.toSeconds() + "s, timeout " + properties.getPendingTimeout().toSeconds() + "s");
            }
            PredictionRequest abandoned = pending.endedWith(PredictionStatus.ABANDONED, "Reset by " + actor);
            store(abandoned);
            clearPending();
            abandonedPredictions++;
            log.warn("Pending prediction abandoned requestId={} pendingFor={} actor={}", abandoned.requestId(), age, actor);
            eventPublisher.publishEvent(new PendingPredictionResetEvent(actor, List.of(abandoned.requestId()), now));
            return abandoned;
        });
    }

    /**
     * Returns the in-flight request once it has outlived the pending timeout. The stale signal is
     * published once per request.
     */
    public Optional<PredictionRequest> detectStalePending() {
        String id = pendingRequestId;
        if (id == null) {
            return Optional.empty();
        }
        PredictionRequest pending = getRequest(id).orElse(null);
        if (pending == null || !pending.isPending()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        Duration age = Duration.between(pending.timestamp(), now);
        if (age.compareTo(properties.getPendingTimeout()) < 0) {
            return Optional.empty();
        }
        if (!id.equals(staleReportedId)) {
            staleReportedId = id;
            log.error("Prediction request stuck requestId={} pendingFor={}", id, age);
            eventPublisher.publishEvent(new StalePredictionDetectedEvent(id, age, now));
        }
        return Optional.of(pending);
    }

    public Optional<PredictionRequest> getRequest(String requestId) {
        synchronized (requests) {
            return Optional.ofNullable(requests.get(requestId));
        }
    }

    public List<PredictionRequest> getRequests() {
        synchronized (requests) {
            return List.copyOf(requests.values());
        }
    }

    public int getPendingRequestsCount() {
        return pendingRequestsCount;
    }

    public Instant getLastPredictionTime() {
        return lastPredictionTime;
    }

    public AdvancedStats getAdvancedStats() {
        return new AdvancedStats(
                tradeAuthorizer.getTradingStats(),
                totalPredictions,
                fulfilledPredictions,
                rejectedPredictions,
                erroredPredictions,
                abandonedPredictions,
                tokenService.totalSupply(),
                pendingRequestsCount,
                lastPredictionTime
        );
    }

    /**
     * Quarter of the max trade size scaled by up to 3x with confidence, capped at the max size.
     */
    public static BigInteger computeTradeSize(TradingConfig config, int confidenceBps) {
        BigInteger base = config.maxTradeSize().divide(BigInteger.valueOf(4));
        BigInteger scaled = base.multiply(BigInteger.valueOf(confidenceBps)).multiply(MAX_MULTIPLIER).divide(BPS);
        return scaled.min(config.maxTradeSize());
    }

    private PredictionRequest issueRequest(String actor) {
        emergencyControl.requireOperational();
        if (!properties.isEnabled()) {
            throw new TradeRejectedException(RejectReason.PREDICTIONS_DISABLED);
        }
        if (pendingRequestsCount > 0) {
            throw new TradeRejectedException(RejectReason.PENDING_REQUEST_EXISTS, pendingRequestId);
        }
        Instant now = clock.instant();
        PriceSnapshot snapshot = priceOracle.getLatestPrice();

        List<String> args = List.of(snapshot.price().toString(), String.valueOf(now.getEpochSecond()));
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("subscriptionId", properties.getSubscriptionId());
        metadata.put("donId", properties.getDonId());
        metadata.put("callbackGasLimit", properties.getCallbackGasLimit());
        String requestId = bridge.submitRequest(properties.getSourceCode(), args, metadata);

        PredictionRequest request = PredictionRequest.requested(requestId, now, snapshot);
        store(request);
        pendingRequestId = requestId;
        pendingRequestsCount++;
        lastPredictionTime = now;
        totalPredictions++;
        log.info("Prediction requested requestId={} actor={} price={} confirmed={}",
                requestId, actor, snapshot.price(), snapshot.confirmed());
        eventPublisher.publishEvent(new PredictionRequestedEvent(requestId, snapshot.price(), now));
        return request;
    }

    private FulfillmentResult handleFulfillment(String requestId, Supplier<byte[]> payload, String error) {
        PredictionRequest request = getRequest(requestId)
                .orElseThrow(() -> new BadRequestException("Unknown prediction request: " + requestId));
        if (!request.isPending()) {
            throw new BadRequestException("Prediction request already settled: " + requestId);
        }
        Instant now = clock.instant();

        if (error != null && !error.isBlank()) {
            erroredPredictions++;
            return end(request, PredictionStatus.ERRORED, error, now);
        }

        PredictionPayloadDecoder.DecodedPrediction decoded;
        try {
            decoded = decoder.decode(payload.get());
        } catch (PredictionDecodeException ex) {
            rejectedPredictions++;
            return end(request, PredictionStatus.REJECTED, ex.getMessage(), now);
        }
        if (decoded.predictedPrice().signum() == 0) {
            rejectedPredictions++;
            return end(request, PredictionStatus.REJECTED, "Invalid prediction price", now);
        }
        if (decoded.confidenceBps().compareTo(BigInteger.valueOf(MAX_CONFIDENCE_BPS)) > 0) {
            rejectedPredictions++;
            return end(request, PredictionStatus.REJECTED, "Invalid confidence", now);
        }
        int confidenceBps = decoded.confidenceBps().intValueExact();

        boolean approved = request.priceConfirmed()
                && complianceGate.validatePrediction(requestId, decoded.predictedPrice());
        eventPublisher.publishEvent(new ComplianceValidatedEvent(requestId, null, decoded.predictedPrice(), approved, now));
        if (!approved) {
            rejectedPredictions++;
            String reason = request.priceConfirmed() ? "Compliance check failed" : "Unconfirmed price at request";
            return end(request, PredictionStatus.REJECTED, reason, now);
        }

        PredictionRequest fulfilled = request.fulfilledWith(decoded.predictedPrice(), confidenceBps, decoded.anomaly());
        store(fulfilled);
        clearPending();
        fulfilledPredictions++;
        log.info("Prediction fulfilled requestId={} predictedPrice={} confidenceBps={} anomaly={}",
                requestId, decoded.predictedPrice(), confidenceBps, decoded.anomaly());
        eventPublisher.publishEvent(new PredictionFulfilledEvent(requestId, PredictionStatus.FULFILLED,
                decoded.predictedPrice(), confidenceBps, decoded.anomaly(), null, now));

        Long tokenId = null;
        if (confidenceBps >= properties.getRewardConfidenceBps()) {
            PredictionToken token = tokenService.mint(requestId, decoded.predictedPrice(), confidenceBps);
            tokenId = token.tokenId();
        }
        EvaluationOutcome evaluation = evaluateAndExecute(requestId);
        return new FulfillmentResult(requestId, PredictionStatus.FULFILLED, null, tokenId, evaluation);
    }

    /**
     * Decides whether a fulfilled prediction trades. Runs at most once per request and never
     * throws: a failed trade is logged and reported as {@link EvaluationOutcome#TRADE_FAILED}.
     */
    EvaluationOutcome evaluateAndExecute(String requestId) {
        guard.requireHeld("evaluateAndExecute");
        PredictionRequest request = getRequest(requestId).orElse(null);
        if (request == null || request.status() != PredictionStatus.FULFILLED || request.executed()) {
            return EvaluationOutcome.NOT_EVALUATED;
        }
        store(request.markExecuted());

        TradingConfig config = agentState.config();
        if (request.anomaly()) {
            log.info("Prediction trade skipped requestId={} reason=anomaly", requestId);
            return EvaluationOutcome.SKIPPED_ANOMALY;
        }
        if (request.confidenceBps() < config.confidenceThresholdBps()) {
            log.info("Prediction trade skipped requestId={} reason=low confidence {} < {}",
                    requestId, request.confidenceBps(), config.confidenceThresholdBps());
            return EvaluationOutcome.SKIPPED_LOW_CONFIDENCE;
        }
        BigInteger score = ecoGate.score();
        boolean blocked = score.compareTo(config.ecoThreshold()) > 0;
        eventPublisher.publishEvent(new EcoScoreCheckedEvent(requestId, score, config.ecoThreshold(), blocked, clock.instant()));
        if (blocked) {
            log.info("Prediction trade skipped requestId={} reason=eco score {} > {}", requestId, score, config.ecoThreshold());
            return EvaluationOutcome.SKIPPED_ECO_SCORE;
        }
        if (request.predictedPrice().compareTo(config.priceThreshold()) < 0) {
            log.info("Prediction trade skipped requestId={} reason=predicted price below threshold", requestId);
            return EvaluationOutcome.SKIPPED_PRICE_BELOW_THRESHOLD;
        }

        BigInteger amountIn = computeTradeSize(config, request.confidenceBps());
        if (amountIn.signum() == 0) {
            log.info("Prediction trade skipped requestId={} reason=zero trade size", requestId);
            return EvaluationOutcome.SKIPPED_ZERO_SIZE;
        }
        Instant deadline = clock.instant().plus(properties.getTradeDeadline());
        try {
            TradeAuthorizer.TradeResult result =
                    tradeAuthorizer.executePredictionTrade(PREDICTION_TRADER, amountIn, request.confidenceBps(), deadline);
            log.info("Prediction trade executed requestId={} tradeId={} amountIn={}", requestId, result.tradeId(), amountIn);
            return EvaluationOutcome.EXECUTED;
        } catch (RuntimeException ex) {
            log.warn("Prediction trade failed requestId={} amountIn={} reason={}", requestId, amountIn, ex.getMessage());
            return EvaluationOutcome.TRADE_FAILED;
        }
    }

    private FulfillmentResult end(PredictionRequest request, PredictionStatus status, String reason, Instant now) {
        store(request.endedWith(status, reason));
        clearPending();
        log.warn("Prediction request ended requestId={} status={} reason={}", request.requestId(), status, reason);
        eventPublisher.publishEvent(new PredictionFulfilledEvent(request.requestId(), status, BigInteger.ZERO, 0,
                false, reason, now));
        return new FulfillmentResult(request.requestId(), status, reason, null, EvaluationOutcome.NOT_EVALUATED);
    }

    private void store(PredictionRequest request) {
        synchronized (requests) {
            requests.put(request.requestId(), request);
        }
    }

    private void clearPending() {
        pendingRequestsCount = Math.max(0, pendingRequestsCount - 1);
        pendingRequestId = null;
    }

    public enum EvaluationOutcome {
        EXECUTED,
        TRADE_FAILED,
        SKIPPED_ANOMALY,
        SKIPPED_LOW_CONFIDENCE,
        SKIPPED_ECO_SCORE,
        SKIPPED_PRICE_BELOW_THRESHOLD,
        SKIPPED_ZERO_SIZE,
        NOT_EVALUATED
    }

    public record UpkeepCheck(boolean upkeepNeeded, String reason) {
        static UpkeepCheck needed() {
            return new UpkeepCheck(true, "Upkeep needed");
        }

        static UpkeepCheck notNeeded(String reason) {
            return new UpkeepCheck(false, reason);
        }
    }

    public record FulfillmentResult(
            String requestId,
            PredictionStatus status,
            String reason,
            Long rewardTokenId,
            EvaluationOutcome evaluation
    ) {}
}
