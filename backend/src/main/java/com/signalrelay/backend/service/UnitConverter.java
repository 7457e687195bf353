package com.signalrelay.backend.service;

import com.signalrelay.backend.model.InstrumentClass;
import com.signalrelay.backend.model.InstrumentMeta;
import com.signalrelay.backend.model.UnitKind;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Turns pip/point/price distances into price deltas. Mislabelled units degrade to the closest
 * sensible size instead of failing.
 */
@Service
@RequiredArgsConstructor
public class UnitConverter {

    static final BigDecimal DEFAULT_PIP = new BigDecimal("0.0001");
    static final BigDecimal DEFAULT_POINT = BigDecimal.ONE;

    private final InstrumentCatalog catalog;

    public BigDecimal toPriceDelta(String canonicalId, BigDecimal quantity, UnitKind unitKind) {
        if (quantity == null) {
            return BigDecimal.ZERO;
        }
        UnitKind unit = unitKind == null ? UnitKind.POINTS : unitKind;
        if (unit == UnitKind.PRICE) {
            return quantity;
        }
        Optional<InstrumentMeta> meta = catalog.find(canonicalId);
        InstrumentClass kind = meta.map(InstrumentMeta::kind).orElse(InstrumentClass.OTHER);
        BigDecimal pip = kind == InstrumentClass.FX ? meta.map(InstrumentMeta::pip).orElse(null) : null;
        if (pip == null) {
            // pips sent for a non-fx instrument use the generic fx pip
            pip = DEFAULT_PIP;
        }
        if (unit == UnitKind.PIPS) {
            return quantity.multiply(pip);
        }
        if (kind == InstrumentClass.INDEX || kind == InstrumentClass.METAL) {
            BigDecimal point = meta.map(InstrumentMeta::point).orElse(DEFAULT_POINT);
            return quantity.multiply(point == null ? DEFAULT_POINT : point);
        }
        // points sent for an fx pair
        return quantity.multiply(pip);
    }
}
