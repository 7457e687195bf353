package com.signalrelay.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SignalStatus {
    OK,
    PARTIAL,
    ERROR,
    SKIPPED,
    IGNORED,
    REJECTED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
