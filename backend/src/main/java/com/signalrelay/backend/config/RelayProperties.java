package com.signalrelay.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "relay.duplikium")
@Data
@Validated
public class RelayProperties {

    private String baseUrl = "";

    private String user = "";

    private String token = "";

    private AuthStyle authStyle = AuthStyle.HEADERS;

    @NotBlank
    private String ordersPath = "/orders";

    @NotBlank
    private String masterSource = "OANDA_MASTER";

    @NotBlank
    private String clientOrderTag = "tv_v1";

    private boolean forward = true;

    @Min(1)
    private int connectTimeoutMs = 5000;

    @Min(1)
    private int readTimeoutMs = 12000;

    public String ordersUrl() {
        String base = baseUrl == null ? "" : baseUrl.replaceAll("/+$", "");
        return base + ordersPath;
    }

    public enum AuthStyle {
        HEADERS,
        TOKEN,
        BEARER,
        BASIC
    }
}
