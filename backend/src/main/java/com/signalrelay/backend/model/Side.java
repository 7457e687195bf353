package com.signalrelay.backend.model;

import java.util.Locale;
import java.util.Optional;

public enum Side {
    BUY,
    SELL;

    /**
     * Reads a side out of free-form alert text such as {@code BUY_SIGNAL}; BUY wins when both appear.
     */
    public static Optional<Side> fromAlertText(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String upper = text.toUpperCase(Locale.ROOT);
        if (upper.contains("BUY")) {
            return Optional.of(BUY);
        }
        if (upper.contains("SELL")) {
            return Optional.of(SELL);
        }
        return Optional.empty();
    }

    public int sign() {
        return this == BUY ? 1 : -1;
    }
}
