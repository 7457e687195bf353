package com.signalrelay.backend.service.execution;

import com.signalrelay.backend.model.SignalStatus;

import java.util.List;
import java.util.Optional;

public record AggregateOutcome(SignalStatus status, List<TargetOutcome> outcomes) {

    public AggregateOutcome {
        outcomes = List.copyOf(outcomes);
    }

    public Optional<TargetOutcome> outcomeFor(String target) {
        return outcomes.stream().filter(outcome -> outcome.target().equals(target)).findFirst();
    }
}
