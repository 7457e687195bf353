package com.signalrelay.backend.service.guard;

import com.signalrelay.backend.model.Side;
import com.signalrelay.backend.service.DailyLossService.DailyLossStatus;
import com.signalrelay.backend.service.oracle.BalanceReading;
import com.signalrelay.backend.service.oracle.PositionCensusReading;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Everything the guards look at for one signal, gathered up front so each guard stays a pure check.
 *
 * @param stopDistance stop distance converted to price units, null when the signal carries no stop
 */
public record GuardContext(
        String instrument,
        Side side,
        BigDecimal stopDistance,
        Instant now,
        boolean tradingEnabled,
        BalanceReading balance,
        DailyLossStatus dailyLoss,
        PositionCensusReading positions
) {}
