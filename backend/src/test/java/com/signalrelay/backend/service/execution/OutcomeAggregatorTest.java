package com.signalrelay.backend.service.execution;

import com.signalrelay.backend.model.SignalStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OutcomeAggregatorTest {

    private static final TargetOutcome BROKER_OK = TargetOutcome.success("oanda", 201, "placed");
    private static final TargetOutcome BROKER_DOWN = TargetOutcome.failure("oanda", 503, "down");
    private static final TargetOutcome RELAY_OK = TargetOutcome.success("duplikium", 200, "ok");
    private static final TargetOutcome RELAY_DOWN = TargetOutcome.failure("duplikium", 500, "boom");

    @Test
    void okOnlyWhenAllSucceed() {
        assertThat(OutcomeAggregator.reduce(List.of(BROKER_OK, RELAY_OK))).isEqualTo(SignalStatus.OK);
    }

    @Test
    void partialWhenMixed() {
        assertThat(OutcomeAggregator.reduce(List.of(BROKER_OK, RELAY_DOWN))).isEqualTo(SignalStatus.PARTIAL);
        assertThat(OutcomeAggregator.reduce(List.of(BROKER_DOWN, RELAY_OK))).isEqualTo(SignalStatus.PARTIAL);
    }

    @Test
    void errorWhenAllFail() {
        assertThat(OutcomeAggregator.reduce(List.of(BROKER_DOWN, RELAY_DOWN))).isEqualTo(SignalStatus.ERROR);
    }

    @Test
    void noopsCountAsSuccess() {
        assertThat(OutcomeAggregator.reduce(List.of(TargetOutcome.noop("oanda", "dry"), TargetOutcome.noop("duplikium", "dry"))))
                .isEqualTo(SignalStatus.OK);
    }
}
