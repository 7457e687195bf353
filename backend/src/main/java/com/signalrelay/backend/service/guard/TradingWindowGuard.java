package com.signalrelay.backend.service.guard;

import com.signalrelay.backend.model.RiskPolicy;
import com.signalrelay.backend.service.TradingWindowService;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(20)
@RequiredArgsConstructor
public class TradingWindowGuard implements AdmissionGuard {

    private final TradingWindowService tradingWindowService;

    @Override
    public String name() {
        return "trading_window";
    }

    @Override
    public GuardDecision evaluate(GuardContext context, RiskPolicy policy) {
        TradingWindowService.WindowDecision decision = tradingWindowService.evaluate(context.now());
        return decision.allowed()
                ? GuardDecision.allow(name(), decision.reason())
                : GuardDecision.skip(name(), decision.reason());
    }
}
