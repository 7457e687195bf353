package com.signalrelay.backend.service.guard;

import com.signalrelay.backend.config.TradingProperties;
import com.signalrelay.backend.model.Side;
import com.signalrelay.backend.service.DailyLossService;
import com.signalrelay.backend.service.EquityCurveService;
import com.signalrelay.backend.service.oracle.BalanceOracle;
import com.signalrelay.backend.service.oracle.BalanceReading;
import com.signalrelay.backend.service.oracle.PositionCensus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Reads the oracles once per signal. Fresh broker balances are appended to the equity series.
 */
@Component
@RequiredArgsConstructor
public class GuardContextAssembler {

    static final String NAV_SOURCE = "nav";

    private final BalanceOracle balanceOracle;
    private final PositionCensus positionCensus;
    private final DailyLossService dailyLossService;
    private final EquityCurveService equityCurveService;
    private final TradingProperties tradingProperties;

    public GuardContext assemble(String instrument, Side side, BigDecimal stopDistance, Instant now) {
        BalanceReading balance = balanceOracle.currentBalance();
        DailyLossService.DailyLossStatus dailyLoss = dailyLossService.evaluate(balance, now);
        if (!balance.degraded() && "live".equals(balance.source())) {
            equityCurveService.record(balance.amount(), NAV_SOURCE);
        }
        return new GuardContext(
                instrument,
                side,
                stopDistance,
                now,
                tradingProperties.isEnabled(),
                balance,
                dailyLoss,
                positionCensus.openPositions()
        );
    }
}
