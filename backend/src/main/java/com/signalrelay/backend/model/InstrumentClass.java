package com.signalrelay.backend.model;

public enum InstrumentClass {
    FX,
    METAL,
    INDEX,
    OTHER
}
