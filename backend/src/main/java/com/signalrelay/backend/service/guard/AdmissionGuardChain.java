package com.signalrelay.backend.service.guard;

import com.signalrelay.backend.model.RiskPolicy;
import com.signalrelay.backend.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the guards in {@link org.springframework.core.annotation.Order} sequence and stops at the first veto.
 */
@Slf4j
@Service
public class AdmissionGuardChain {

    private final List<AdmissionGuard> guards;
    private final RiskPolicy riskPolicy;
    private final MetricsService metricsService;

    public AdmissionGuardChain(List<AdmissionGuard> guards, RiskPolicy riskPolicy, MetricsService metricsService) {
        this.guards = List.copyOf(guards);
        this.riskPolicy = riskPolicy;
        this.metricsService = metricsService;
        log.info("Admission guards: {}", this.guards.stream().map(AdmissionGuard::name).toList());
    }

    public record ChainResult(List<GuardDecision> decisions, GuardDecision veto) {
        public boolean admitted() {
            return veto == null;
        }

        public Optional<GuardDecision> vetoDecision() {
            return Optional.ofNullable(veto);
        }
    }

    public ChainResult evaluate(GuardContext context) {
        List<GuardDecision> decisions = new ArrayList<>();
        for (AdmissionGuard guard : guards) {
            GuardDecision decision = guard.evaluate(context, riskPolicy);
            decisions.add(decision);
            if (!decision.allowed()) {
                log.info("Signal for {} vetoed by {}: {}", context.instrument(), decision.guard(), decision.reason());
                metricsService.recordVeto(decision.guard());
                return new ChainResult(List.copyOf(decisions), decision);
            }
        }
        return new ChainResult(List.copyOf(decisions), null);
    }
}
