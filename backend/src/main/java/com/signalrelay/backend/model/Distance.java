package com.signalrelay.backend.model;

import java.math.BigDecimal;

/**
 * A stop or target distance as sent by the alert, before conversion to price units.
 */
public record Distance(BigDecimal value, UnitKind unit) {
}
