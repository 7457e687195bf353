package com.signalrelay.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "trading")
@Data
@Validated
public class TradingProperties {

    /**
     * Global kill switch. When false every signal is logged and skipped.
     */
    private boolean enabled = true;

    /**
     * Simulate both downstream targets instead of transmitting.
     */
    private boolean dryRun = true;

    @NotBlank
    private String timezone = "America/Halifax";

    /**
     * Optional window such as {@code MON-FRI 09:30-16:00} or {@code 09:30-16:00}. Blank disables it.
     */
    private String window = "";

    private List<String> allowlist = new ArrayList<>(List.of("US30", "NAS100", "XAUUSD", "EURUSD"));

    @Min(1)
    private long idempotencyTtlSeconds = 90;

    @PositiveOrZero
    private double defaultRiskPct = 0.05;
}
