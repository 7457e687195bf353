package com.signalrelay.backend.service.guard;

import com.signalrelay.backend.model.RiskPolicy;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(60)
public class AllowListGuard implements AdmissionGuard {

    @Override
    public String name() {
        return "allowlist";
    }

    @Override
    public GuardDecision evaluate(GuardContext context, RiskPolicy policy) {
        if (!policy.allowlist().contains(context.instrument())) {
            return GuardDecision.reject(name(), "Symbol " + context.instrument() + " not allowed");
        }
        return GuardDecision.allow(name(), "Symbol allowed");
    }
}
