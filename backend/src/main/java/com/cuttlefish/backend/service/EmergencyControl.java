package com.cuttlefish.backend.service;

import com.cuttlefish.backend.event.EmergencyStopActivatedEvent;
import com.cuttlefish.backend.event.EmergencyStopDeactivatedEvent;
import com.cuttlefish.backend.exception.TradeRejectedException;
import com.cuttlefish.backend.model.Capability;
import com.cuttlefish.backend.model.EmergencyState;
import com.cuttlefish.backend.model.RejectReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Global stop switch and pause flag. Halting needs EMERGENCY; resuming needs ADMIN.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EmergencyControl {

    private final TradingAgentState agentState;
    private final AccessControlService accessControl;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public EmergencyState activate(String actor, String reason) {
        accessControl.requireCapability(actor, Capability.EMERGENCY);
        Instant now = clock.instant();
        EmergencyState previous = agentState.updateEmergencyState(state -> state.activated(reason, now));
        if (previous.emergencyStop()) {
            log.warn("Emergency stop re-armed actor={} reason={}", actor, reason);
        } else {
            log.error("Emergency stop activated actor={} reason={}", actor, reason);
        }
        eventPublisher.publishEvent(new EmergencyStopActivatedEvent(actor, reason, now));
        return agentState.emergencyState();
    }

    public EmergencyState deactivate(String actor) {
        accessControl.requireCapability(actor, Capability.ADMIN);
        EmergencyState previous = agentState.updateEmergencyState(EmergencyState::deactivated);
        if (previous.emergencyStop()) {
            log.warn("Emergency stop deactivated actor={} activeSince={}", actor, previous.emergencyStopTimestamp());
            eventPublisher.publishEvent(new EmergencyStopDeactivatedEvent(actor, clock.instant()));
        }
        return agentState.emergencyState();
    }

    public EmergencyState pause(String actor) {
        accessControl.requireCapability(actor, Capability.EMERGENCY);
        agentState.updateEmergencyState(state -> state.withPaused(true));
        log.warn("Trading paused actor={}", actor);
        return agentState.emergencyState();
    }

    public EmergencyState unpause(String actor) {
        accessControl.requireCapability(actor, Capability.ADMIN);
        agentState.updateEmergencyState(state -> state.withPaused(false));
        log.info("Trading unpaused actor={}", actor);
        return agentState.emergencyState();
    }

    public boolean isActive() {
        return agentState.emergencyState().emergencyStop();
    }

    public boolean isPaused() {
        return agentState.emergencyState().paused();
    }

    /**
     * Fails when the agent is stopped or paused. Runs before any other check of a
     * trade-initiating call.
     */
    public void requireOperational() {
        EmergencyState state = agentState.emergencyState();
        if (state.emergencyStop()) {
            throw new TradeRejectedException(RejectReason.EMERGENCY_STOP_ACTIVE);
        }
        if (state.paused()) {
            throw new TradeRejectedException(RejectReason.PAUSED);
        }
    }
}
