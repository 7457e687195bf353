package com.signalrelay.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "broker.oanda")
@Data
@Validated
public class OandaProperties {

    @NotBlank
    private String baseUrl = "https://api-fxpractice.oanda.com";

    private String accountId = "";

    private String token = "";

    private boolean forward = true;

    @Min(1)
    private int connectTimeoutMs = 5000;

    @Min(1)
    private int readTimeoutMs = 10000;

    @Min(0)
    private long balanceCacheSeconds = 15;

    @Min(0)
    private long positionCacheSeconds = 5;

    public boolean hasCredentials() {
        return token != null && !token.isBlank() && accountId != null && !accountId.isBlank();
    }
}
