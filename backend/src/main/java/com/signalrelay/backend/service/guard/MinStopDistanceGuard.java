package com.signalrelay.backend.service.guard;

import com.signalrelay.backend.model.RiskPolicy;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

@Component
@Order(50)
public class MinStopDistanceGuard implements AdmissionGuard {

    @Override
    public String name() {
        return "min_stop_distance";
    }

    @Override
    public GuardDecision evaluate(GuardContext context, RiskPolicy policy) {
        BigDecimal minimum = policy.minStop(context.instrument()).orElse(null);
        if (minimum == null || context.stopDistance() == null) {
            return GuardDecision.allow(name(), "No minimum stop distance applies");
        }
        if (context.stopDistance().abs().compareTo(minimum) < 0) {
            return GuardDecision.reject(name(), "Stop distance " + context.stopDistance().toPlainString()
                    + " below minimum " + minimum.toPlainString());
        }
        return GuardDecision.allow(name(), "Stop distance ok");
    }
}
