package com.signalrelay.backend.service.guard;

import com.signalrelay.backend.model.RiskPolicy;
import com.signalrelay.backend.service.oracle.PositionCensusReading;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Caps open positions globally and per instrument. A cap of 0 means unlimited.
 */
@Component
@Order(40)
public class ConcurrencyGuard implements AdmissionGuard {

    @Override
    public String name() {
        return "concurrency";
    }

    @Override
    public GuardDecision evaluate(GuardContext context, RiskPolicy policy) {
        PositionCensusReading positions = context.positions();
        int globalCap = policy.maxOpenPositions();
        if (globalCap > 0 && positions.total() >= globalCap) {
            return GuardDecision.reject(name(), "Max open positions reached (" + positions.total() + "/" + globalCap + ")");
        }
        int instrumentCap = policy.positionCap(context.instrument());
        int open = positions.countFor(context.instrument());
        if (instrumentCap > 0 && open >= instrumentCap) {
            return GuardDecision.reject(name(), "Max open positions for " + context.instrument()
                    + " reached (" + open + "/" + instrumentCap + ")");
        }
        return GuardDecision.allow(name(), positions.degraded() ? "Position census unavailable" : "Within position caps");
    }
}
