package com.signalrelay.backend.service.oracle;

import java.util.Map;

/**
 * Open position counts, globally and per canonical instrument. A degraded reading carries zero counts.
 */
public record PositionCensusReading(int total, Map<String, Integer> perInstrument, boolean degraded) {

    public PositionCensusReading {
        perInstrument = Map.copyOf(perInstrument);
    }

    public static PositionCensusReading empty(boolean degraded) {
        return new PositionCensusReading(0, Map.of(), degraded);
    }

    public int countFor(String instrument) {
        return perInstrument.getOrDefault(instrument, 0);
    }
}
