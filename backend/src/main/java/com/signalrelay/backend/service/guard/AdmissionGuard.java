package com.signalrelay.backend.service.guard;

import com.signalrelay.backend.model.RiskPolicy;

public interface AdmissionGuard {

    String name();

    GuardDecision evaluate(GuardContext context, RiskPolicy policy);
}
