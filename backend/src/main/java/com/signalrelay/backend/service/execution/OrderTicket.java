package com.signalrelay.backend.service.execution;

import com.signalrelay.backend.model.Side;

import java.math.BigDecimal;

/**
 * A sized order ready for the execution targets. Stop and target prices may be null.
 */
public record OrderTicket(
        String orderId,
        String instrument,
        Side side,
        int units,
        BigDecimal entryPrice,
        BigDecimal stopPrice,
        BigDecimal targetPrice
) {
    public long signedUnits() {
        return (long) units * side.sign();
    }
}
