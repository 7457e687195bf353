package com.signalrelay.backend.service.guard;

import com.signalrelay.backend.model.RiskPolicy;
import com.signalrelay.backend.service.DailyLossService.DailyLossStatus;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
@Order(30)
public class DailyLossGuard implements AdmissionGuard {

    @Override
    public String name() {
        return "daily_loss_stop";
    }

    @Override
    public GuardDecision evaluate(GuardContext context, RiskPolicy policy) {
        DailyLossStatus status = context.dailyLoss();
        if (status == null || !status.enabled()) {
            return GuardDecision.allow(name(), "Daily loss stop disabled");
        }
        if (!status.ok()) {
            return GuardDecision.reject(name(), String.format(Locale.ROOT, "Daily loss stop hit: drawdown %.4f%% >= %.4f%%",
                    status.drawdownPct(), status.limitPct()));
        }
        return GuardDecision.allow(name(), status.note());
    }
}
