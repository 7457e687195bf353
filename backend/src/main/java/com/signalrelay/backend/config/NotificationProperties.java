package com.signalrelay.backend.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "notification.discord")
@Data
@Validated
public class NotificationProperties {

    private boolean enabled = true;

    private String webhookUrl = "";

    @Min(1)
    private int timeoutMs = 8000;

    public boolean isActive() {
        return enabled && webhookUrl != null && !webhookUrl.isBlank();
    }
}
