package com.signalrelay.backend.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A validated incoming trade instruction. Immutable once built.
 */
public record Signal(
        Side side,
        String rawSymbol,
        BigDecimal price,
        Distance stop,
        Distance target,
        double requestedRiskPct,
        String orderId,
        boolean generatedOrderId,
        Instant receivedAt
) {
    public boolean hasStop() {
        return stop != null && stop.value() != null;
    }

    public boolean hasTarget() {
        return target != null && target.value() != null;
    }
}
