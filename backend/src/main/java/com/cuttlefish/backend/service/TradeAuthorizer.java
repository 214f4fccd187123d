package com.cuttlefish.backend.service;

import com.cuttlefish.backend.config.TradingProperties;
import com.cuttlefish.backend.event.ComplianceValidatedEvent;
import com.cuttlefish.backend.event.EcoScoreCheckedEvent;
import com.cuttlefish.backend.event.PriceCheckedEvent;
import com.cuttlefish.backend.event.TradeExecutionFailedEvent;
import com.cuttlefish.backend.event.TradeRejectedEvent;
import com.cuttlefish.backend.event.TradeTriggeredEvent;
import com.cuttlefish.backend.exception.BadRequestException;
import com.cuttlefish.backend.exception.CustodyExecutionException;
import com.cuttlefish.backend.exception.TradeRejectedException;
import com.cuttlefish.backend.exception.TradingException;
import com.cuttlefish.backend.model.BatchTradeCommand;
import com.cuttlefish.backend.model.Capability;
import com.cuttlefish.backend.model.ExecutionReceipt;
import com.cuttlefish.backend.model.PriceSnapshot;
import com.cuttlefish.backend.model.RateState;
import com.cuttlefish.backend.model.RejectReason;
import com.cuttlefish.backend.model.TradeCommand;
import com.cuttlefish.backend.model.TradingConfig;
import com.cuttlefish.backend.model.TradingStats;
import com.cuttlefish.backend.service.port.CustodyPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Authorizes and executes trades. Every trade passes emergency/pause, risk admission, price,
 * threshold, compliance and eco gates in that order, is committed against the rate state and
 * then handed to custody. A custody failure rolls the commit back.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TradeAuthorizer {

    public static final int MAX_BATCH_SIZE = 10;
    public static final String TRADE_ALLOWED = "Trade allowed";

    private static final BigInteger BPS = BigInteger.valueOf(10_000);

    private final TradingAgentState agentState;
    private final TradingProperties tradingProperties;
    private final RiskLimiter riskLimiter;
    private final EmergencyControl emergencyControl;
    private final PriceOracleGateway priceOracle;
    private final ComplianceGate complianceGate;
    private final EcoGate ecoGate;
    private final CustodyPort custodyPort;
    private final AccessControlService accessControl;
    private final SingleFlightGuard guard;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @PostConstruct
    void seedDeviationBasis() {
        BigInteger price = priceOracle.fetchPriceOrDefault();
        agentState.seedLastValidPrice(price);
        log.info("Deviation basis seeded lastValidPrice={}", price);
    }

    public TradeResult triggerTrade(String actor, TradeCommand command) {
        accessControl.requireCapability(actor, Capability.AI_TRADER);
        return guard.run("triggerTrade", () -> authorize(actor, command.amountIn(), command.amountOutMin(),
                command.deadline(), command.confidenceBps(), true));
    }

    public BatchTradeResult triggerBatchTrade(String actor, BatchTradeCommand command) {
        accessControl.requireCapability(actor, Capability.AI_TRADER);
        return guard.run("triggerBatchTrade", () -> authorizeBatch(actor, command));
    }

    /**
     * Trade entered from a fulfilled prediction. Caller must already be inside the guard.
     */
    TradeResult executePredictionTrade(String actor, BigInteger amountIn, int confidenceBps, Instant deadline) {
        guard.requireHeld("executePredictionTrade");
        return authorize(actor, amountIn, BigInteger.ZERO, deadline, confidenceBps, true);
    }

    /**
     * What {@link #triggerTrade} would decide for the same inputs right now, without touching any
     * state or publishing anything.
     */
    public TradeEligibility canTrade(String actor, BigInteger amountIn, int confidenceBps) {
        Instant now = clock.instant();
        try {
            emergencyControl.requireOperational();
            requireValidAmount(amountIn);
            requireValidConfidence(confidenceBps);
            evaluateGates(actor, amountIn, confidenceBps, agentState.config(), now, true, false);
            return TradeEligibility.granted();
        } catch (TradeRejectedException ex) {
            return TradeEligibility.denied(ex.getReason());
        }
    }

    public TradingStats getTradingStats() {
        Instant now = clock.instant();
        RateState state = agentState.rateState();
        long successRate = state.totalTrades() == 0 ? 0 : state.successfulTrades() * 10_000 / state.totalTrades();
        return new TradingStats(
                state.totalTrades(),
                state.successfulTrades(),
                successRate,
                state.currentDayVolume(now),
                riskLimiter.remainingDailyVolume(agentState.config(), state, now),
                state.lastTradeTimestamp(),
                state.lastDayReset()
        );
    }

    private TradeResult authorize(String actor, BigInteger amountIn, BigInteger amountOutMin, Instant deadline,
                                  int confidenceBps, boolean admitRisk) {
        Instant now = clock.instant();
        TradingConfig config = agentState.config();
        PriceSnapshot snapshot;
        try {
            emergencyControl.requireOperational();
            requireValidAmount(amountIn);
            requireValidConfidence(confidenceBps);
            if (deadline == null) {
                throw new BadRequestException("deadline is required");
            }
            snapshot = evaluateGates(actor, amountIn, confidenceBps, config, now, admitRisk, true);
        } catch (TradeRejectedException ex) {
            log.info("Trade rejected actor={} amountIn={} reason={}", actor, amountIn, ex.getReason());
            eventPublisher.publishEvent(new TradeRejectedEvent(actor, amountIn, ex.getReason(), now));
            throw ex;
        }
        return execute(actor, amountIn, amountOutMin == null ? BigInteger.ZERO : amountOutMin, deadline,
                confidenceBps, snapshot.price(), now);
    }

    private PriceSnapshot evaluateGates(String actor, BigInteger amountIn, int confidenceBps, TradingConfig config,
                                        Instant now, boolean admitRisk, boolean publish) {
        emergencyControl.requireOperational();

        if (admitRisk) {
            RiskLimiter.AdmissionDecision decision =
                    riskLimiter.admit(config, agentState.rateState(), amountIn, confidenceBps, now);
            if (!decision.admitted()) {
                throw new TradeRejectedException(decision.reason());
            }
        }

        PriceSnapshot snapshot = priceOracle.read(now, publish);
        boolean valid = snapshot.price().compareTo(config.priceThreshold()) >= 0;
        if (publish) {
            eventPublisher.publishEvent(new PriceCheckedEvent(snapshot.price(), config.priceThreshold(), valid,
                    snapshot.confirmed(), now));
        }
        if (!valid) {
            throw new TradeRejectedException(RejectReason.PRICE_BELOW_THRESHOLD);
        }

        boolean approved = complianceGate.validateTrade(actor, amountIn, snapshot.price());
        if (publish) {
            eventPublisher.publishEvent(new ComplianceValidatedEvent(null, actor, amountIn, approved, now));
        }
        if (!approved) {
            throw new TradeRejectedException(RejectReason.COMPLIANCE_REJECTED);
        }

        BigInteger score = ecoGate.score();
        boolean blocked = score.compareTo(config.ecoThreshold()) > 0;
        if (publish) {
            eventPublisher.publishEvent(new EcoScoreCheckedEvent(null, score, config.ecoThreshold(), blocked, now));
        }
        if (blocked) {
            throw new TradeRejectedException(RejectReason.ECO_SCORE_TOO_HIGH);
        }
        return snapshot;
    }

    private TradeResult execute(String actor, BigInteger amountIn, BigInteger amountOutMin, Instant deadline,
                                int confidenceBps, BigInteger price, Instant now) {
        agentState.updateRateState(state -> riskLimiter.commit(state, amountIn, price, now));
        long tradeId = agentState.rateState().totalTrades();
        List<String> path = List.of(agentState.sourceAsset(), agentState.targetAsset());

        ExecutionReceipt receipt;
        try {
            receipt = custodyPort.execute(amountIn, amountOutMin, path, deadline);
        } catch (RuntimeException ex) {
            agentState.updateRateState(state -> state.withRollback(amountIn));
            int failures = agentState.recordExecutionFailure();
            boolean repeated = failures >= tradingProperties.getMaxConsecutiveExecutionFailures();
            String reason = ex instanceof CustodyExecutionException
                    ? ((CustodyExecutionException) ex).getReason()
                    : ex.getMessage();
            if (repeated) {
                log.error("Custody execution failing repeatedly tradeId={} consecutiveFailures={} reason={}",
                        tradeId, failures, reason);
            } else {
                log.warn("Custody execution failed, rolled back tradeId={} amountIn={} reason={}",
                        tradeId, amountIn, reason);
            }
            eventPublisher.publishEvent(new TradeExecutionFailedEvent(tradeId, amountIn, reason, failures, repeated, now));
            throw ex;
        }

        agentState.updateRateState(RateState::withSuccess);
        agentState.resetExecutionFailures();
        log.info("Trade settled tradeId={} actor={} amountIn={} amountOut={} price={} confidenceBps={}",
                tradeId, actor, amountIn, receipt.amountOut(), price, confidenceBps);
        eventPublisher.publishEvent(new TradeTriggeredEvent(tradeId, actor, amountIn, amountOutMin,
                receipt.amountOut(), price, confidenceBps, now));
        return new TradeResult(tradeId, amountIn, receipt.amountOut(), price, confidenceBps,
                receipt.executionId(), receipt.executedAt());
    }

    private BatchTradeResult authorizeBatch(String actor, BatchTradeCommand command) {
        Instant now = clock.instant();
        TradingConfig config = agentState.config();
        List<BigInteger> amounts = command.amountsIn();
        List<BigInteger> minimums = command.amountsOutMin();
        BigInteger total = BigInteger.ZERO;
        try {
            emergencyControl.requireOperational();
            if (amounts == null || minimums == null || amounts.isEmpty()) {
                throw new BadRequestException("Empty batch");
            }
            if (amounts.size() != minimums.size()) {
                throw new BadRequestException("Array length mismatch");
            }
            if (amounts.size() > MAX_BATCH_SIZE) {
                throw new BadRequestException("Too many trades");
            }
            if (command.deadline() == null) {
                throw new BadRequestException("deadline is required");
            }
            requireValidConfidence(command.confidenceBps());
            for (BigInteger amount : amounts) {
                if (amount == null || amount.signum() < 0) {
                    throw new BadRequestException("Batch amounts must not be negative");
                }
                total = total.add(amount);
            }
            if (total.signum() == 0) {
                throw new BadRequestException("Batch has no non-zero amount");
            }
            RiskLimiter.AdmissionDecision decision =
                    riskLimiter.admit(config, agentState.rateState(), total, command.confidenceBps(), now);
            if (!decision.admitted()) {
                throw new TradeRejectedException(decision.reason());
            }
        } catch (TradeRejectedException ex) {
            log.info("Batch rejected actor={} total={} reason={}", actor, total, ex.getReason());
            eventPublisher.publishEvent(new TradeRejectedEvent(actor, total, ex.getReason(), now));
            throw ex;
        }

        List<BatchElementOutcome> outcomes = new ArrayList<>();
        boolean halted = false;
        int settled = 0;
        for (int i = 0; i < amounts.size(); i++) {
            BigInteger amount = amounts.get(i);
            if (amount.signum() == 0) {
                outcomes.add(BatchElementOutcome.skipped(i, amount, "Zero amount"));
                continue;
            }
            if (halted) {
                outcomes.add(BatchElementOutcome.skipped(i, amount, "Not attempted after earlier failure"));
                continue;
            }
            try {
                TradeResult result = authorize(actor, amount, minimums.get(i), command.deadline(),
                        command.confidenceBps(), false);
                outcomes.add(BatchElementOutcome.settled(i, result));
                settled++;
            } catch (TradingException ex) {
                log.warn("Batch element failed index={} amountIn={} reason={}", i, amount, ex.getMessage());
                outcomes.add(BatchElementOutcome.failed(i, amount, ex.getMessage()));
                halted = true;
            }
        }
        log.info("Batch finished actor={} elements={} settled={} halted={}", actor, amounts.size(), settled, halted);
        return new BatchTradeResult(amounts.size(), settled, total, outcomes);
    }

    private static void requireValidAmount(BigInteger amountIn) {
        if (amountIn == null || amountIn.signum() <= 0) {
            throw new BadRequestException("amountIn must be positive");
        }
    }

    private static void requireValidConfidence(int confidenceBps) {
        if (confidenceBps < 0 || confidenceBps > BPS.intValue()) {
            throw new BadRequestException("confidenceBps must be within 0..10000");
        }
    }

    public record TradeResult(
            long tradeId,
            BigInteger amountIn,
            BigInteger amountOut,
            BigInteger price,
            int confidenceBps,
            String executionId,
            Instant executedAt
    ) {}

    public record TradeEligibility(boolean allowed, RejectReason rejectReason, String reason) {
        static TradeEligibility granted() {
            return new TradeEligibility(true, null, TRADE_ALLOWED);
        }

        static TradeEligibility denied(RejectReason reason) {
            return new TradeEligibility(false, reason, reason.getMessage());
        }
    }

    public enum BatchElementStatus {
        SETTLED,
        FAILED,
        SKIPPED
    }

    public record BatchElementOutcome(
            int index,
            BigInteger amountIn,
            BatchElementStatus status,
            Long tradeId,
            BigInteger amountOut,
            String reason
    ) {
        static BatchElementOutcome settled(int index, TradeResult result) {
            return new BatchElementOutcome(index, result.amountIn(), BatchElementStatus.SETTLED, result.tradeId(),
                    result.amountOut(), null);
        }

        static BatchElementOutcome failed(int index, BigInteger amountIn, String reason) {
            return new BatchElementOutcome(index, amountIn, BatchElementStatus.FAILED, null, null, reason);
        }

        static BatchElementOutcome skipped(int index, BigInteger amountIn, String reason) {
            return new BatchElementOutcome(index, amountIn, BatchElementStatus.SKIPPED, null, null, reason);
        }
    }

    public record BatchTradeResult(int elements, int settled, BigInteger totalAmountIn,
                                   List<BatchElementOutcome> outcomes) {}
}
