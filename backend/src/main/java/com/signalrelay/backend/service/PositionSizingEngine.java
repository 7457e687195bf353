package com.signalrelay.backend.service;

import com.signalrelay.backend.model.RiskPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Risk-based order sizing: {@code units = floor(balance * risk% / |entry - stop|)}, clamped to
 * {@code [1, maxUnits]} and then to the instrument unit cap. Always rounds down so the risk budget is
 * never exceeded; without a usable stop the order falls back to a single unit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositionSizingEngine {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final RiskPolicy riskPolicy;

    public record SizingResult(int units, double appliedRiskPct, boolean riskBased) {}

    public double appliedRiskPct(String instrument, double requestedRiskPct) {
        double applied = Math.min(requestedRiskPct, riskPolicy.maxRiskPct());
        Double instrumentCap = riskPolicy.riskCap(instrument).orElse(null);
        if (instrumentCap != null) {
            applied = Math.min(applied, instrumentCap);
        }
        return Math.max(0.0, applied);
    }

    public SizingResult size(String instrument,
                             BigDecimal balance,
                             double requestedRiskPct,
                             BigDecimal entryPrice,
                             BigDecimal stopPrice) {
        double applied = appliedRiskPct(instrument, requestedRiskPct);
        if (stopPrice == null || entryPrice == null || stopPrice.compareTo(entryPrice) == 0) {
            int units = applyInstrumentCap(instrument, clamp(1));
            log.info("Sizing {}: no usable stop, nominal size {}", instrument, units);
            return new SizingResult(units, applied, false);
        }
        BigDecimal priceDelta = entryPrice.subtract(stopPrice).abs();
        BigDecimal riskAmount = balance.multiply(BigDecimal.valueOf(applied)).divide(HUNDRED);
        // capped before narrowing; a tiny stop can push the quotient past Long.MAX_VALUE
        long raw = riskAmount.divide(priceDelta, 0, RoundingMode.FLOOR)
                .min(BigDecimal.valueOf(riskPolicy.maxUnits()))
                .longValue();
        int units = applyInstrumentCap(instrument, clamp(raw));
        log.info("Sizing {}: balance={} risk={}% delta={} raw={} units={}",
                instrument, balance, applied, priceDelta, raw, units);
        return new SizingResult(units, applied, true);
    }

    private int clamp(long units) {
        return (int) Math.max(1, Math.min(units, riskPolicy.maxUnits()));
    }

    private int applyInstrumentCap(String instrument, int units) {
        return riskPolicy.unitCap(instrument)
                .map(cap -> Math.max(1, Math.min(units, cap)))
                .orElse(units);
    }
}
