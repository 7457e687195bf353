package com.signalrelay.backend.service;

import com.signalrelay.backend.model.SignalStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private Counter signalsReceivedCounter;
    private Counter duplicatesCounter;

    @PostConstruct
    void init() {
        signalsReceivedCounter = Counter.builder("signals_received_total").register(meterRegistry);
        duplicatesCounter = Counter.builder("signals_duplicate_total").register(meterRegistry);
    }

    public void recordReceived() {
        if (signalsReceivedCounter != null) {
            signalsReceivedCounter.increment();
        }
    }

    public void recordDuplicate() {
        if (duplicatesCounter != null) {
            duplicatesCounter.increment();
        }
    }

    public void recordOutcome(SignalStatus status) {
        Counter.builder("signal_outcomes_total")
                .tag("status", status.wireName())
                .register(meterRegistry)
                .increment();
    }

    public void recordVeto(String guard) {
        Counter.builder("guard_vetoes_total")
                .tag("guard", guard)
                .register(meterRegistry)
                .increment();
    }

    public void recordDegraded(String oracle) {
        Counter.builder("oracle_degraded_total")
                .tag("oracle", oracle)
                .register(meterRegistry)
                .increment();
    }

    public void recordDownstreamFailure(String target) {
        Counter.builder("downstream_failures_total")
                .tag("target", target)
                .register(meterRegistry)
                .increment();
    }
}
