package com.signalrelay.backend.service.oracle;

import java.math.BigDecimal;

/**
 * Account equity as seen by the gateway. {@code degraded} is true when the upstream could not be read
 * and {@code amount} is the configured fallback.
 */
public record BalanceReading(BigDecimal amount, boolean degraded, String source) {

    public static BalanceReading live(BigDecimal amount) {
        return new BalanceReading(amount, false, "live");
    }

    public static BalanceReading cached(BigDecimal amount) {
        return new BalanceReading(amount, false, "cache");
    }

    public static BalanceReading fallback(BigDecimal amount) {
        return new BalanceReading(amount, true, "fallback");
    }
}
