package com.cuttlefish.backend.service;

import com.cuttlefish.backend.event.ComplianceValidatedEvent;
import com.cuttlefish.backend.event.EcoScoreCheckedEvent;
import com.cuttlefish.backend.event.PendingPredictionResetEvent;
import com.cuttlefish.backend.event.PredictionFulfilledEvent;
import com.cuttlefish.backend.event.StalePredictionDetectedEvent;
import com.cuttlefish.backend.exception.BadRequestException;
import com.cuttlefish.backend.exception.CustodyExecutionException;
import com.cuttlefish.backend.exception.TradeRejectedException;
import com.cuttlefish.backend.exception.UnauthorizedActorException;
import com.cuttlefish.backend.model.AdvancedStats;
import com.cuttlefish.backend.model.PredictionRequest;
import com.cuttlefish.backend.model.PredictionStatus;
import com.cuttlefish.backend.model.RejectReason;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;

import static com.cuttlefish.backend.service.AgentTestFixture.ADMIN;
import static com.cuttlefish.backend.service.AgentTestFixture.BRIDGE;
import static com.cuttlefish.backend.service.AgentTestFixture.E8;
import static com.cuttlefish.backend.service.AgentTestFixture.KEEPER;
import static com.cuttlefish.backend.service.AgentTestFixture.START;
import static com.cuttlefish.backend.service.AgentTestFixture.TRADER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class PredictionLifecycleTest {

    private static byte[] payload(long dollars, long confidenceBps, boolean anomaly) {
        return PredictionPayloadDecoder.encode(BigInteger.valueOf(dollars).multiply(E8),
                BigInteger.valueOf(confidenceBps), anomaly);
    }

    @Test
    void lowConfidencePredictionSkipsExecution() {
        AgentTestFixture fixture = new AgentTestFixture().start();
        PredictionRequest request = fixture.lifecycle.requestPrediction(TRADER);
        assertThat(fixture.lifecycle.getPendingRequestsCount()).isEqualTo(1);

        PredictionLifecycle.FulfillmentResult result =
                fixture.lifecycle.fulfill(BRIDGE, request.requestId(), payload(2600, 5000, false), null);

        assertThat(result.status()).isEqualTo(PredictionStatus.FULFILLED);
        assertThat(result.evaluation()).isEqualTo(PredictionLifecycle.EvaluationOutcome.SKIPPED_LOW_CONFIDENCE);
        assertThat(result.rewardTokenId()).isNull();
        assertThat(fixture.lifecycle.getPendingRequestsCount()).isZero();
        verify(fixture.custody, never()).execute(any(), any(), any(), any());
    }

    @Test
    void requestSubmitsPriceSnapshotToBridge() {
        AgentTestFixture fixture = new AgentTestFixture().start();

        PredictionRequest request = fixture.lifecycle.requestPrediction(TRADER);

        assertThat(request.requestId()).isEqualTo("0xreq1");
        assertThat(request.status()).isEqualTo(PredictionStatus.REQUESTED);
        assertThat(request.currentPriceAtRequest()).isEqualTo(BigInteger.valueOf(2500).multiply(E8));
        assertThat(request.priceConfirmed()).isTrue();
        assertThat(fixture.lifecycle.getLastPredictionTime()).isEqualTo(START);
        verify(fixture.bridge).submitRequest(eq("eth-usd-forecast"),
                eq(List.of("250000000000", String.valueOf(START.getEpochSecond()))), anyMap());
    }

    @Test
    void secondRequestWhilePendingIsRejected() {
        AgentTestFixture fixture = new AgentTestFixture().start();
        fixture.lifecycle.requestPrediction(TRADER);

        assertThatThrownBy(() -> fixture.lifecycle.requestPrediction(TRADER))
                .isInstanceOfSatisfying(TradeRejectedException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(RejectReason.PENDING_REQUEST_EXISTS));
    }

    @Test
    void errorCallbackFreesThePendingSlot() {
        AgentTestFixture fixture = new AgentTestFixture().start();
        PredictionRequest request = fixture.lifecycle.requestPrediction(TRADER);

        PredictionLifecycle.FulfillmentResult result =
                fixture.lifecycle.fulfill(BRIDGE, request.requestId(), null, "DON timeout");

        assertThat(result.status()).isEqualTo(PredictionStatus.ERRORED);
        PredictionRequest stored = fixture.lifecycle.getRequest(request.requestId()).orElseThrow();
        assertThat(stored.fulfilled()).isFalse();
        assertThat(stored.failureReason()).isEqualTo("DON timeout");
        assertThat(fixture.lifecycle.getPendingRequestsCount()).isZero();
    }

    @Test
    void highVolatilityRejectsPrediction() {
        AgentTestFixture fixture = new AgentTestFixture().start();
        PredictionRequest request = fixture.lifecycle.requestPrediction(TRADER);
        fixture.feed("eth-volatility").update(BigInteger.valueOf(2500), fixture.clock.instant());

        PredictionLifecycle.FulfillmentResult result =
                fixture.lifecycle.fulfill(BRIDGE, request.requestId(), payload(2600, 9000, false), null);

        assertThat(result.status()).isEqualTo(PredictionStatus.REJECTED);
        assertThat(fixture.lifecycle.getPendingRequestsCount()).isZero();
        assertThat(fixture.published(ComplianceValidatedEvent.class))
                .extracting(ComplianceValidatedEvent::approved)
                .containsExactly(false);
        assertThat(fixture.tokenService.totalSupply()).isZero();
        verify(fixture.custody, never()).execute(any(), any(), any(), any());
    }

    @Test
    void unconfirmedPriceAtRequestMakesPredictionNonCompliant() {
        AgentTestFixture fixture = new AgentTestFixture().start();
        fixture.setPrice(3000);
        PredictionRequest request = fixture.lifecycle.requestPrediction(TRADER);
        assertThat(request.priceConfirmed()).isFalse();

        PredictionLifecycle.FulfillmentResult result =
                fixture.lifecycle.fulfill(BRIDGE, request.requestId(), payload(3100, 9000, false), null);

        assertThat(result.status()).isEqualTo(PredictionStatus.REJECTED);
        assertThat(result.reason()).isEqualTo("Unconfirmed price at request");
    }

    @Test
    void confidentPredictionMintsRewardAndTrades() {
        AgentTestFixture fixture = new AgentTestFixture().start();
        PredictionRequest request = fixture.lifecycle.requestPrediction(TRADER);

        PredictionLifecycle.FulfillmentResult result =
                fixture.lifecycle.fulfill(BRIDGE, request.requestId(), payload(2600, 9000, false), null);

        assertThat(result.rewardTokenId()).isEqualTo(1L);
        assertThat(result.evaluation()).isEqualTo(PredictionLifecycle.EvaluationOutcome.EXECUTED);
        verify(fixture.custody).execute(eq(new BigInteger("67500000000000000000")), eq(BigInteger.ZERO),
                eq(List.of("WETH", "USDC")), eq(START.plus(Duration.ofMinutes(5))));
        assertThat(fixture.agentState.rateState().successfulTrades()).isEqualTo(1);
        assertThat(fixture.tokenService.pendingTokens()).hasSize(1);
        PredictionRequest stored = fixture.lifecycle.getRequest(request.requestId()).orElseThrow();
        assertThat(stored.executed()).isTrue();
        assertThat(stored.predictedPrice()).isEqualTo(BigInteger.valueOf(2600).multiply(E8));
        assertThat(fixture.published(PredictionFulfilledEvent.class))
                .extracting(PredictionFulfilledEvent::status)
                .containsExactly(PredictionStatus.FULFILLED);
    }

    @Test
    void anomalyIsNeverTraded() {
        AgentTestFixture fixture = new AgentTestFixture().start();
        PredictionRequest request = fixture.lifecycle.requestPrediction(TRADER);

        PredictionLifecycle.FulfillmentResult result =
                fixture.lifecycle.fulfill(BRIDGE, request.requestId(), payload(2600, 9500, true), null);

        assertThat(result.evaluation()).isEqualTo(PredictionLifecycle.EvaluationOutcome.SKIPPED_ANOMALY);
        verify(fixture.custody, never()).execute(any(), any(), any(), any());
    }

    @Test
    void highEcoScoreSkipsWithSignal() {
        AgentTestFixture fixture = new AgentTestFixture().start();
        PredictionRequest request = fixture.lifecycle.requestPrediction(TRADER);
        fixture.feed("eco-score").update(BigInteger.valueOf(1500), fixture.clock.instant());

        PredictionLifecycle.FulfillmentResult result =
                fixture.lifecycle.fulfill(BRIDGE, request.requestId(), payload(2600, 9000, false), null);

        assertThat(result.evaluation()).isEqualTo(PredictionLifecycle.EvaluationOutcome.SKIPPED_ECO_SCORE);
        List<EcoScoreCheckedEvent> ecoEvents = fixture.published(EcoScoreCheckedEvent.class);
        assertThat(ecoEvents).hasSize(1);
        assertThat(ecoEvents.get(0).blocked()).isTrue();
        assertThat(ecoEvents.get(0).requestId()).isEqualTo(request.requestId());
    }

    @Test
    void predictedPriceBelowThresholdSkips() {
        AgentTestFixture fixture = new AgentTestFixture().start();
        PredictionRequest request = fixture.lifecycle.requestPrediction(TRADER);

        PredictionLifecycle.FulfillmentResult result =
                fixture.lifecycle.fulfill(BRIDGE, request.requestId(), payload(1900, 9000, false), null);

        assertThat(result.evaluation())
                .isEqualTo(PredictionLifecycle.EvaluationOutcome.SKIPPED_PRICE_BELOW_THRESHOLD);
    }

    @Test
    void failedPredictionTradeIsAbsorbed() {
        AgentTestFixture fixture = new AgentTestFixture().start();
        doThrow(new CustodyExecutionException("Insufficient vault balance"))
                .when(fixture.custody).execute(any(), any(), any(), any());
        PredictionRequest request = fixture.lifecycle.requestPrediction(TRADER);

        PredictionLifecycle.FulfillmentResult result =
                fixture.lifecycle.fulfill(BRIDGE, request.requestId(), payload(2600, 9000, false), null);

        assertThat(result.status()).isEqualTo(PredictionStatus.FULFILLED);
        assertThat(result.evaluation()).isEqualTo(PredictionLifecycle.EvaluationOutcome.TRADE_FAILED);
        assertThat(fixture.agentState.rateState().totalTrades()).isZero();
        assertThat(fixture.agentState.rateState().dailyTradeVolume()).isZero();
    }

    @Test
    void malformedPayloadsAreRejectedNotThrown() {
        AgentTestFixture fixture = new AgentTestFixture().start();

        PredictionRequest first = fixture.lifecycle.requestPrediction(TRADER);
        PredictionLifecycle.FulfillmentResult shortPayload =
                fixture.lifecycle.fulfill(BRIDGE, first.requestId(), new byte[64], null);
        assertThat(shortPayload.status()).isEqualTo(PredictionStatus.REJECTED);
        assertThat(shortPayload.reason()).startsWith("Invalid response length");

        fixture.advance(Duration.ofHours(1));
        PredictionRequest second = fixture.lifecycle.requestPrediction(TRADER);
        PredictionLifecycle.FulfillmentResult badConfidence =
                fixture.lifecycle.fulfill(BRIDGE, second.requestId(), payload(2600, 10_001, false), null);
        assertThat(badConfidence.reason()).isEqualTo("Invalid confidence");

        PredictionRequest third = fixture.lifecycle.requestPrediction(TRADER);
        PredictionLifecycle.FulfillmentResult badHex =
                fixture.lifecycle.fulfillHex(BRIDGE, third.requestId(), "0xzz", null);
        assertThat(badHex.status()).isEqualTo(PredictionStatus.REJECTED);

        PredictionRequest fourth = fixture.lifecycle.requestPrediction(TRADER);
        PredictionLifecycle.FulfillmentResult zeroPrice =
                fixture.lifecycle.fulfill(BRIDGE, fourth.requestId(), payload(0, 9000, false), null);
        assertThat(zeroPrice.reason()).isEqualTo("Invalid prediction price");
        assertThat(fixture.lifecycle.getPendingRequestsCount()).isZero();
    }

    @Test
    void unknownOrSettledRequestIdsAreRefused() {
        AgentTestFixture fixture = new AgentTestFixture().start();
        assertThatThrownBy(() -> fixture.lifecycle.fulfill(BRIDGE, "0xnope", payload(2600, 9000, false), null))
                .isInstanceOf(BadRequestException.class);

        PredictionRequest request = fixture.lifecycle.requestPrediction(TRADER);
        fixture.lifecycle.fulfill(BRIDGE, request.requestId(), payload(2600, 5000, false), null);

        assertThatThrownBy(() -> fixture.lifecycle.fulfill(BRIDGE, request.requestId(), payload(2600, 9000, false), null))
                .isInstanceOf(BadRequestException.class);
        assertThat(fixture.lifecycle.getRequest(request.requestId()).orElseThrow().confidenceBps()).isEqualTo(5000);
    }

    @Test
    void onlyTheBridgeMayFulfill() {
        AgentTestFixture fixture = new AgentTestFixture().start();
        PredictionRequest request = fixture.lifecycle.requestPrediction(TRADER);

        assertThatThrownBy(() -> fixture.lifecycle.fulfill(TRADER, request.requestId(), payload(2600, 9000, false), null))
                .isInstanceOf(UnauthorizedActorException.class);
        assertThat(fixture.lifecycle.getPendingRequestsCount()).isEqualTo(1);
    }

    @Test
    void stuckRequestCanOnlyBeResetAfterTimeout() {
        AgentTestFixture fixture = new AgentTestFixture().start();
        assertThatThrownBy(() -> fixture.lifecycle.resetPendingRequest(ADMIN))
                .isInstanceOfSatisfying(TradeRejectedException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(RejectReason.NO_PENDING_REQUEST));

        PredictionRequest request = fixture.lifecycle.requestPrediction(TRADER);
        fixture.advance(Duration.ofMinutes(30));
        assertThatThrownBy(() -> fixture.lifecycle.resetPendingRequest(ADMIN))
                .isInstanceOfSatisfying(TradeRejectedException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(RejectReason.PENDING_REQUEST_NOT_EXPIRED));
        assertThat(fixture.lifecycle.detectStalePending()).isEmpty();
        assertThatThrownBy(() -> fixture.lifecycle.resetPendingRequest(TRADER))
                .isInstanceOf(UnauthorizedActorException.class);

        fixture.advance(Duration.ofMinutes(30));
        assertThat(fixture.lifecycle.detectStalePending()).isPresent();
        assertThat(fixture.published(StalePredictionDetectedEvent.class)).hasSize(1);

        PredictionRequest abandoned = fixture.lifecycle.resetPendingRequest(ADMIN);
        assertThat(abandoned.status()).isEqualTo(PredictionStatus.ABANDONED);
        assertThat(fixture.lifecycle.getPendingRequestsCount()).isZero();
        assertThat(fixture.published(PendingPredictionResetEvent.class).get(0).abandonedRequestIds())
                .containsExactly(request.requestId());

        assertThatThrownBy(() -> fixture.lifecycle.fulfill(BRIDGE, request.requestId(), payload(2600, 9000, false), null))
                .isInstanceOf(BadRequestException.class);
        assertThat(fixture.lifecycle.requestPrediction(TRADER).requestId()).isEqualTo("0xreq2");
    }

    @Test
    void staleRequestIsReportedOncePerRequest() {
        AgentTestFixture fixture = new AgentTestFixture().start();
        fixture.lifecycle.requestPrediction(TRADER);
        fixture.advance(Duration.ofHours(2));

        assertThat(fixture.lifecycle.detectStalePending()).isPresent();
        assertThat(fixture.lifecycle.detectStalePending()).isPresent();
        fixture.advance(Duration.ofMinutes(10));
        assertThat(fixture.lifecycle.detectStalePending()).isPresent();

        assertThat(fixture.published(StalePredictionDetectedEvent.class)).hasSize(1);

        fixture.lifecycle.resetPendingRequest(ADMIN);
        fixture.lifecycle.requestPrediction(TRADER);
        fixture.advance(Duration.ofHours(2));
        fixture.lifecycle.detectStalePending();

        assertThat(fixture.published(StalePredictionDetectedEvent.class))
                .extracting(StalePredictionDetectedEvent::requestId)
                .containsExactly("0xreq1", "0xreq2");
    }

    @Test
    void zeroTradeSizeIsSkippedAfterFulfillment() {
        AgentTestFixture fixture = new AgentTestFixture();
        fixture.tradingProperties.setConfidenceThresholdBps(0);
        fixture.start();
        PredictionRequest request = fixture.lifecycle.requestPrediction(TRADER);

        PredictionLifecycle.FulfillmentResult result =
                fixture.lifecycle.fulfill(BRIDGE, request.requestId(), payload(2600, 0, false), null);

        assertThat(result.status()).isEqualTo(PredictionStatus.FULFILLED);
        assertThat(result.evaluation()).isEqualTo(PredictionLifecycle.EvaluationOutcome.SKIPPED_ZERO_SIZE);
        assertThat(fixture.lifecycle.getPendingRequestsCount()).isZero();
        assertThat(fixture.lifecycle.getRequest(request.requestId()).orElseThrow().executed()).isFalse();
        verify(fixture.custody, never()).execute(any(), any(), any(), any());
    }

    @Test
    void unexpectedTradeFailureStillCompletesFulfillment() {
        AgentTestFixture fixture = new AgentTestFixture().start();
        PredictionRequest request = fixture.lifecycle.requestPrediction(TRADER);
        doThrow(new IllegalStateException("custody offline"))
                .when(fixture.custody).execute(any(), any(), any(), any());

        PredictionLifecycle.FulfillmentResult result =
                fixture.lifecycle.fulfill(BRIDGE, request.requestId(), payload(2600, 9000, false), null);

        assertThat(result.status()).isEqualTo(PredictionStatus.FULFILLED);
        assertThat(result.evaluation()).isEqualTo(PredictionLifecycle.EvaluationOutcome.TRADE_FAILED);
        assertThat(fixture.lifecycle.getPendingRequestsCount()).isZero();
    }

    @Test
    void emergencyStopOutranksDisabledPredictions() {
        AgentTestFixture fixture = new AgentTestFixture();
        fixture.predictionProperties.setEnabled(false);
        fixture.start();
        assertThatThrownBy(() -> fixture.lifecycle.requestPrediction(TRADER))
                .isInstanceOfSatisfying(TradeRejectedException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(RejectReason.PREDICTIONS_DISABLED));

        fixture.emergencyControl.activate(AgentTestFixture.GUARDIAN, "halt");

        assertThatThrownBy(() -> fixture.lifecycle.requestPrediction(TRADER))
                .isInstanceOfSatisfying(TradeRejectedException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(RejectReason.EMERGENCY_STOP_ACTIVE));
        assertThatThrownBy(() -> fixture.lifecycle.performUpkeep(KEEPER))
                .isInstanceOfSatisfying(TradeRejectedException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(RejectReason.EMERGENCY_STOP_ACTIVE));
        assertThat(fixture.lifecycle.checkUpkeep().reason()).isEqualTo("Emergency stop active");
        verify(fixture.bridge, never()).submitRequest(any(), anyList(), anyMap());
    }

    @Test
    void upkeepFollowsIntervalPendingAndEmergencyState() {
        AgentTestFixture fixture = new AgentTestFixture().start();
        assertThat(fixture.lifecycle.checkUpkeep().upkeepNeeded()).isTrue();

        assertThatThrownBy(() -> fixture.lifecycle.performUpkeep(TRADER))
                .isInstanceOf(UnauthorizedActorException.class);
        PredictionRequest request = fixture.lifecycle.performUpkeep(KEEPER);
        assertThat(fixture.lifecycle.checkUpkeep().reason()).isEqualTo("Pending request exists");

        fixture.lifecycle.fulfill(BRIDGE, request.requestId(), payload(2600, 5000, false), null);
        assertThat(fixture.lifecycle.checkUpkeep().upkeepNeeded()).isFalse();
        assertThatThrownBy(() -> fixture.lifecycle.performUpkeep(KEEPER))
                .isInstanceOfSatisfying(TradeRejectedException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(RejectReason.UPKEEP_NOT_NEEDED));

        fixture.advance(Duration.ofHours(1));
        assertThat(fixture.lifecycle.checkUpkeep().upkeepNeeded()).isTrue();

        fixture.emergencyControl.activate(AgentTestFixture.GUARDIAN, "halt");
        assertThat(fixture.lifecycle.checkUpkeep().reason()).isEqualTo("Emergency stop active");
        verify(fixture.bridge).submitRequest(any(), anyList(), anyMap());
    }

    @Test
    void advancedStatsCountOutcomes() {
        AgentTestFixture fixture = new AgentTestFixture().start();
        PredictionRequest first = fixture.lifecycle.requestPrediction(TRADER);
        fixture.lifecycle.fulfill(BRIDGE, first.requestId(), payload(2600, 9000, false), null);
        PredictionRequest second = fixture.lifecycle.requestPrediction(TRADER);
        fixture.lifecycle.fulfill(BRIDGE, second.requestId(), null, "error");

        AdvancedStats stats = fixture.lifecycle.getAdvancedStats();

        assertThat(stats.totalPredictions()).isEqualTo(2);
        assertThat(stats.fulfilledPredictions()).isEqualTo(1);
        assertThat(stats.erroredPredictions()).isEqualTo(1);
        assertThat(stats.rewardTokensMinted()).isEqualTo(1);
        assertThat(stats.pendingRequests()).isZero();
        assertThat(stats.trading().totalTrades()).isEqualTo(1);
    }

    @Test
    void tradeSizeScalesWithConfidence() {
        AgentTestFixture fixture = new AgentTestFixture().start();

        assertThat(PredictionLifecycle.computeTradeSize(fixture.agentState.config(), 10_000))
                .isEqualTo(new BigInteger("75000000000000000000"));
        assertThat(PredictionLifecycle.computeTradeSize(fixture.agentState.config(), 0)).isZero();
    }
}
