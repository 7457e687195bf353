package com.signalrelay.backend.service.guard;

import com.signalrelay.backend.model.RiskPolicy;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(10)
public class KillSwitchGuard implements AdmissionGuard {

    @Override
    public String name() {
        return "kill_switch";
    }

    @Override
    public GuardDecision evaluate(GuardContext context, RiskPolicy policy) {
        if (!context.tradingEnabled()) {
            return GuardDecision.skip(name(), "Trading disabled");
        }
        return GuardDecision.allow(name(), "Trading enabled");
    }
}
