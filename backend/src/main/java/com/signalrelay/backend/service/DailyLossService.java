package com.signalrelay.backend.service;

import com.signalrelay.backend.config.TradingProperties;
import com.signalrelay.backend.model.RiskPolicy;
import com.signalrelay.backend.service.oracle.BalanceReading;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Tracks drawdown against the first balance sample of the current local trading day.
 * <p>
 * The baseline is the first equity sample recorded on or after local midnight. When today has no sample
 * yet, the current balance becomes today's baseline; yesterday's samples are never reused. Fallback
 * balances are not trusted as a baseline, so the stop is not evaluated while the balance oracle is degraded.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DailyLossService {

    static final String START_OF_DAY_SOURCE = "start_of_day";

    private final RiskPolicy riskPolicy;
    private final TradingProperties tradingProperties;
    private final EquityCurveService equityCurveService;

    public record DailyLossStatus(
            boolean enabled,
            boolean ok,
            LocalDate tradingDay,
            BigDecimal startBalance,
            BigDecimal currentBalance,
            double drawdownPct,
            double limitPct,
            String note
    ) {
        static DailyLossStatus disabled() {
            return new DailyLossStatus(false, true, null, null, null, 0.0, 0.0, "Daily loss stop disabled");
        }
    }

    public DailyLossStatus evaluate(BalanceReading balance, Instant now) {
        double limit = riskPolicy.dailyLossStopPct();
        if (limit <= 0) {
            return DailyLossStatus.disabled();
        }
        ZoneId zone = ZoneId.of(tradingProperties.getTimezone());
        LocalDate today = now.atZone(zone).toLocalDate();
        BigDecimal current = balance.amount();
        if (balance.degraded()) {
            return new DailyLossStatus(true, true, today, null, current, 0.0, limit,
                    "Balance unavailable, daily loss stop not evaluated");
        }
        BigDecimal start;
        try {
            Optional<BigDecimal> recorded = equityCurveService.firstSince(today.atStartOfDay(zone).toInstant());
            if (recorded.isEmpty()) {
                equityCurveService.record(current, START_OF_DAY_SOURCE);
                log.info("Start-of-day balance for {} set to {}", today, current);
                return new DailyLossStatus(true, true, today, current, current, 0.0, limit, "Start of day recorded");
            }
            start = recorded.get();
        } catch (RuntimeException e) {
            log.warn("Equity series unreadable, daily loss stop not evaluated: {}", e.getMessage());
            return new DailyLossStatus(true, true, today, null, current, 0.0, limit, "Equity series unavailable");
        }
        if (start.signum() <= 0) {
            return new DailyLossStatus(true, true, today, start, current, 0.0, limit, "Non-positive start balance");
        }
        double drawdown = start.subtract(current)
                .multiply(BigDecimal.valueOf(100))
                .divide(start, 4, RoundingMode.HALF_UP)
                .max(BigDecimal.ZERO)
                .doubleValue();
        boolean ok = drawdown < limit;
        return new DailyLossStatus(true, ok, today, start, current, drawdown, limit,
                ok ? "Within daily loss limit" : "Daily loss stop hit");
    }
}
