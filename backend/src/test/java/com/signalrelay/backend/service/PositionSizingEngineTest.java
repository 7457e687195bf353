package com.signalrelay.backend.service;

import com.signalrelay.backend.model.RiskPolicy;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class PositionSizingEngineTest {

    private static RiskPolicy policy(Map<String, Integer> unitCaps, Map<String, Double> riskCaps) {
        return new RiskPolicy(0.50, 300000, 0, 0, 0, unitCaps, riskCaps, Map.of(), Map.of(), Set.of("US30_USD"));
    }

    private final PositionSizingEngine engine = new PositionSizingEngine(policy(Map.of(), Map.of()));

    @Test
    void sizesUs30ExampleToThreeUnits() {
        PositionSizingEngine.SizingResult result = engine.size("US30_USD", new BigDecimal("1000000"), 0.05,
                new BigDecimal("39250"), new BigDecimal("39100"));

        assertThat(result.units()).isEqualTo(3);
        assertThat(result.appliedRiskPct()).isEqualTo(0.05);
        assertThat(result.riskBased()).isTrue();
    }

    @Test
    void appliedRiskIsCappedGloballyAndPerInstrument() {
        PositionSizingEngine capped = new PositionSizingEngine(policy(Map.of(), Map.of("XAU_USD", 0.1)));

        assertThat(capped.appliedRiskPct("US30_USD", 2.0)).isEqualTo(0.50);
        assertThat(capped.appliedRiskPct("XAU_USD", 0.3)).isEqualTo(0.1);
        assertThat(capped.appliedRiskPct("US30_USD", -1.0)).isZero();
    }

    @Test
    void withoutStopFallsBackToOneUnit() {
        assertThat(engine.size("US30_USD", new BigDecimal("1000000"), 0.05, new BigDecimal("39250"), null).units())
                .isEqualTo(1);
        assertThat(engine.size("US30_USD", new BigDecimal("1000000"), 0.05, new BigDecimal("39250"), new BigDecimal("39250")).riskBased())
                .isFalse();
    }

    @Test
    void underflowStillPlacesOneUnit() {
        PositionSizingEngine.SizingResult result = engine.size("US30_USD", new BigDecimal("1000"), 0.01,
                new BigDecimal("39250"), new BigDecimal("38250"));

        assertThat(result.units()).isEqualTo(1);
    }

    @Test
    void neverExceedsGlobalOrInstrumentCap() {
        PositionSizingEngine capped = new PositionSizingEngine(policy(Map.of("EUR_USD", 100000), Map.of()));

        int fx = capped.size("EUR_USD", new BigDecimal("100000000"), 0.5, new BigDecimal("1.1000"), new BigDecimal("1.0999")).units();
        int other = capped.size("GBP_USD", new BigDecimal("100000000"), 0.5, new BigDecimal("1.3000"), new BigDecimal("1.2999")).units();

        assertThat(fx).isEqualTo(100000);
        assertThat(other).isEqualTo(300000);
    }

    @Test
    void roundsDown() {
        // 10000 * 0.5% = 50 risk over a 0.0030 stop = 16666.66 units
        int units = engine.size("EUR_USD", new BigDecimal("10000"), 0.5, new BigDecimal("1.1000"), new BigDecimal("1.0970")).units();

        assertThat(units).isEqualTo(16666);
    }

    @Test
    void monotonicInBalanceAndStopDistance() {
        BigDecimal entry = new BigDecimal("39250");
        int previous = 0;
        for (int balance = 10000; balance <= 2000000; balance += 70000) {
            int units = engine.size("US30_USD", BigDecimal.valueOf(balance), 0.25, entry, new BigDecimal("39150")).units();
            assertThat(units).isGreaterThanOrEqualTo(previous);
            previous = units;
        }
        previous = Integer.MAX_VALUE;
        for (int stop = 5; stop <= 1000; stop += 35) {
            int units = engine.size("US30_USD", new BigDecimal("1000000"), 0.25, entry, entry.subtract(BigDecimal.valueOf(stop))).units();
            assertThat(units).isLessThanOrEqualTo(previous);
            previous = units;
        }
        int wider = engine.size("EUR_USD", new BigDecimal("1000000"), 0.5, new BigDecimal("1.1"),
                new BigDecimal("1.1").subtract(new BigDecimal("1E-7"))).units();
        int tiny = engine.size("EUR_USD", new BigDecimal("1000000"), 0.5, new BigDecimal("1.1"),
                new BigDecimal("1.1").subtract(new BigDecimal("1E-16"))).units();
        assertThat(wider).isEqualTo(300000);
        assertThat(tiny).isGreaterThanOrEqualTo(wider);
    }

    @Test
    void hugeQuotientIsClampedToMaxUnits() {
        PositionSizingEngine.SizingResult result = engine.size("EUR_USD", new BigDecimal("1000000000"), 0.5,
                new BigDecimal("1.1"), new BigDecimal("1.1").subtract(new BigDecimal("1E-30")));

        assertThat(result.units()).isEqualTo(300000);
        assertThat(result.riskBased()).isTrue();
    }
}
