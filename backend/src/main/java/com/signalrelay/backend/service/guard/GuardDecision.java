package com.signalrelay.backend.service.guard;

import com.signalrelay.backend.model.SignalStatus;

/**
 * Verdict of a single guard. A veto carries the status the signal exits with: SKIPPED for operational
 * pauses, REJECTED for policy breaches.
 */
public record GuardDecision(String guard, boolean allowed, SignalStatus vetoStatus, String reason) {

    public static GuardDecision allow(String guard, String reason) {
        return new GuardDecision(guard, true, null, reason);
    }

    public static GuardDecision skip(String guard, String reason) {
        return new GuardDecision(guard, false, SignalStatus.SKIPPED, reason);
    }

    public static GuardDecision reject(String guard, String reason) {
        return new GuardDecision(guard, false, SignalStatus.REJECTED, reason);
    }
}
