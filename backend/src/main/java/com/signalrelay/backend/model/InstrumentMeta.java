package com.signalrelay.backend.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Static reference data for one tradable instrument. Loaded at startup and never mutated.
 *
 * @param id      canonical broker id, e.g. {@code US30_USD}
 * @param kind    instrument class, drives pip/point conversion
 * @param pip     pip size, meaningful for FX
 * @param point   point size, meaningful for indices and metals
 * @param aliases alert-side tokens that resolve to {@code id}
 */
public record InstrumentMeta(
        String id,
        InstrumentClass kind,
        BigDecimal pip,
        BigDecimal point,
        List<String> aliases
) {
    public InstrumentMeta {
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        kind = kind == null ? InstrumentClass.OTHER : kind;
    }
}
