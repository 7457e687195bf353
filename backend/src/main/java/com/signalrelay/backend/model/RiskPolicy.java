package com.signalrelay.backend.model;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable sizing and admission limits. All per-instrument maps are keyed by canonical id.
 */
public record RiskPolicy(
        double maxRiskPct,
        int maxUnits,
        double dailyLossStopPct,
        int maxOpenPositions,
        int maxOpenPerInstrument,
        Map<String, Integer> unitCaps,
        Map<String, Double> riskCaps,
        Map<String, BigDecimal> minStopDistance,
        Map<String, Integer> positionCaps,
        Set<String> allowlist
) {
    public RiskPolicy {
        unitCaps = Map.copyOf(unitCaps);
        riskCaps = Map.copyOf(riskCaps);
        minStopDistance = Map.copyOf(minStopDistance);
        positionCaps = Map.copyOf(positionCaps);
        allowlist = Set.copyOf(allowlist);
    }

    public Optional<Integer> unitCap(String instrument) {
        return Optional.ofNullable(unitCaps.get(instrument));
    }

    public Optional<Double> riskCap(String instrument) {
        return Optional.ofNullable(riskCaps.get(instrument));
    }

    public Optional<BigDecimal> minStop(String instrument) {
        return Optional.ofNullable(minStopDistance.get(instrument));
    }

    /**
     * Per-instrument open position cap; the explicit override wins over the shared default. 0 means unlimited.
     */
    public int positionCap(String instrument) {
        return positionCaps.getOrDefault(instrument, maxOpenPerInstrument);
    }
}
