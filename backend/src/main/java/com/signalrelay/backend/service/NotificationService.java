package com.signalrelay.backend.service;

import com.signalrelay.backend.config.NotificationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Posts signal outcomes to a Discord channel as embeds. Runs off the request thread and never throws.
 */
@Slf4j
@Service
public class NotificationService {

    public static final int GREEN = 0x2ecc71;
    public static final int ORANGE = 0xf39c12;
    public static final int RED = 0xe74c3c;
    public static final int AMBER = 0xe67e22;
    public static final int YELLOW = 0xf1c40f;
    public static final int GREY = 0x95a5a6;

    private final RestTemplate restTemplate;
    private final NotificationProperties properties;
    private final Clock clock;

    public NotificationService(@Qualifier("discordRestTemplate") RestTemplate restTemplate,
                               NotificationProperties properties,
                               Clock clock) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    @Async("notificationExecutor")
    public void publish(String title, Map<String, ?> fields, int color) {
        send(title, fields, color);
    }

    boolean send(String title, Map<String, ?> fields, int color) {
        if (!properties.isActive()) {
            log.debug("Discord disabled, skipping '{}'", title);
            return false;
        }
        try {
            restTemplate.postForEntity(properties.getWebhookUrl(), payload(title, fields, color), String.class);
            return true;
        } catch (RestClientException e) {
            log.warn("Discord notification '{}' failed: {}", title, e.getMessage());
            return false;
        }
    }

    Map<String, Object> payload(String title, Map<String, ?> fields, int color) {
        List<Map<String, Object>> embedFields = new ArrayList<>();
        fields.forEach((name, value) -> {
            Map<String, Object> field = new LinkedHashMap<>();
            field.put("name", name);
            field.put("value", String.valueOf(value));
            field.put("inline", true);
            embedFields.add(field);
        });
        Map<String, Object> embed = new LinkedHashMap<>();
        embed.put("title", title);
        embed.put("color", color);
        embed.put("fields", embedFields);
        embed.put("timestamp", Instant.now(clock).toString());
        return Map.of("embeds", List.of(embed));
    }
}
