package com.signalrelay.backend.service.execution;

import com.signalrelay.backend.model.SignalStatus;

import java.util.List;

/**
 * ok when every target succeeded, error when none did, partial otherwise.
 */
public final class OutcomeAggregator {

    private OutcomeAggregator() {
    }

    public static SignalStatus reduce(List<TargetOutcome> outcomes) {
        long succeeded = outcomes.stream().filter(TargetOutcome::success).count();
        if (succeeded == outcomes.size()) {
            return SignalStatus.OK;
        }
        if (succeeded == 0) {
            return SignalStatus.ERROR;
        }
        return SignalStatus.PARTIAL;
    }

    public static AggregateOutcome aggregate(List<TargetOutcome> outcomes) {
        return new AggregateOutcome(reduce(outcomes), outcomes);
    }
}
