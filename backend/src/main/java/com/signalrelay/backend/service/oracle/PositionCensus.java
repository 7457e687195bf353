package com.signalrelay.backend.service.oracle;

public interface PositionCensus {

    /**
     * Never throws; fails open to zero counts with {@link PositionCensusReading#degraded()} set.
     */
    PositionCensusReading openPositions();
}
