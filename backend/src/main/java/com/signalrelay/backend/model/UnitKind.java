package com.signalrelay.backend.model;

import java.util.Locale;

public enum UnitKind {
    PIPS,
    POINTS,
    PRICE;

    /**
     * Unknown or missing unit labels degrade to {@link #POINTS}.
     */
    public static UnitKind parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return POINTS;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "pips", "pip" -> PIPS;
            case "price" -> PRICE;
            default -> POINTS;
        };
    }
}
