package com.cuttlefish.backend.model;

import java.time.Instant;

public record EmergencyState(
        boolean emergencyStop,
        Instant emergencyStopTimestamp,
        String reason,
        boolean paused
) {

    public static EmergencyState operational() {
        return new EmergencyState(false, null, null, false);
    }

    public EmergencyState activated(String reason, Instant at) {
        return new EmergencyState(true, at, reason, paused);
    }

    public EmergencyState deactivated() {
        return new EmergencyState(false, null, null, paused);
    }

    public EmergencyState withPaused(boolean paused) {
        return new EmergencyState(emergencyStop, emergencyStopTimestamp, reason, paused);
    }
}
