package com.signalrelay.backend.service;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.signalrelay.backend.config.NotificationProperties;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.anyUrl;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThat;

class NotificationServiceTest {

    private static final WireMockServer wireMock = new WireMockServer(0);

    private final NotificationProperties properties = new NotificationProperties();
    private NotificationService service;

    @BeforeAll
    static void startWireMock() {
        wireMock.start();
    }

    @AfterAll
    static void stopWireMock() {
        wireMock.stop();
    }

    @BeforeEach
    void setUp() {
        wireMock.resetAll();
        properties.setEnabled(true);
        properties.setWebhookUrl("http://localhost:" + wireMock.port() + "/api/webhooks/1/abc");
        service = new NotificationService(new RestTemplate(), properties,
                Clock.fixed(Instant.parse("2024-03-04T15:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void postsEmbedWithInlineFields() {
        wireMock.stubFor(post(urlEqualTo("/api/webhooks/1/abc")).willReturn(aResponse().withStatus(204)));
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("status", "ok");
        fields.put("units", 3);
        fields.put("sl", null);

        boolean sent = service.send("New Signal", fields, NotificationService.GREEN);

        assertThat(sent).isTrue();
        wireMock.verify(postRequestedFor(urlEqualTo("/api/webhooks/1/abc"))
                .withRequestBody(matchingJsonPath("$.embeds[0].title", equalTo("New Signal")))
                .withRequestBody(matchingJsonPath("$.embeds[0].color", equalTo(String.valueOf(0x2ecc71))))
                .withRequestBody(matchingJsonPath("$.embeds[0].fields[1].value", equalTo("3")))
                .withRequestBody(matchingJsonPath("$.embeds[0].fields[2].value", equalTo("null")))
                .withRequestBody(matchingJsonPath("$.embeds[0].timestamp", equalTo("2024-03-04T15:00:00Z"))));
    }

    @Test
    void failuresAreSwallowed() {
        wireMock.stubFor(post(urlEqualTo("/api/webhooks/1/abc")).willReturn(aResponse().withStatus(500)));

        assertThat(service.send("Execution Error", Map.of("status", "error"), NotificationService.RED)).isFalse();
    }

    @Test
    void disabledChannelSendsNothing() {
        properties.setWebhookUrl("");

        assertThat(service.send("New Signal", Map.of(), NotificationService.GREEN)).isFalse();
        wireMock.verify(0, postRequestedFor(anyUrl()));
    }
}
