package com.signalrelay.backend.service.oracle;

public interface BalanceOracle {

    /**
     * Never throws; upstream trouble is reported through {@link BalanceReading#degraded()}.
     */
    BalanceReading currentBalance();
}
