package com.signalrelay.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "risk")
@Data
@Validated
public class RiskProperties {

    @PositiveOrZero
    private double maxRiskPct = 0.50;

    @Min(1)
    private int maxUnits = 300000;

    @Positive
    private double fallbackBalance = 1_000_000.0;

    /**
     * Percent of start-of-day balance; 0 disables the daily loss stop.
     */
    @PositiveOrZero
    private double dailyLossStopPct = 0.0;

    @Min(0)
    private int maxOpenPositions = 0;

    @Min(0)
    private int maxOpenPerInstrument = 0;

    // Per-instrument maps, JSON object or "SYMBOL:value" comma form.
    private String symbolUnitCaps = "";
    private String symbolRiskCaps = "";
    private String minStopDistance = "";
    private String instrumentPositionCaps = "";
}
