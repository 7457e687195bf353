package com.signalrelay.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalrelay.backend.config.OandaProperties;
import com.signalrelay.backend.exception.DownstreamException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.function.Supplier;

/**
 * Thin v20 REST client shared by the balance oracle, the position census and order placement.
 */
@Slf4j
@Service
public class OandaHttpClient {

    static final String TARGET = "oanda";

    private final RestTemplate restTemplate;
    private final CircuitBreaker circuitBreaker;
    private final OandaProperties properties;
    private final MeterRegistry meterRegistry;
    private final ObjectMapper objectMapper;

    public OandaHttpClient(@Qualifier("oandaRestTemplate") RestTemplate restTemplate,
                           @Qualifier("oandaCircuitBreaker") CircuitBreaker circuitBreaker,
                           OandaProperties properties,
                           MeterRegistry meterRegistry,
                           ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.circuitBreaker = circuitBreaker;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    void init() {
        Gauge.builder("downstream_circuit_state", circuitBreaker, breaker -> mapState(breaker.getState()))
                .tag("target", TARGET)
                .register(meterRegistry);
    }

    public JsonNode get(String path) {
        return execute(HttpMethod.GET, path, null);
    }

    public JsonNode post(String path, Object body) {
        return execute(HttpMethod.POST, path, body);
    }

    public String accountPath(String suffix) {
        return "/v3/accounts/" + properties.getAccountId() + suffix;
    }

    private JsonNode execute(HttpMethod method, String path, Object body) {
        if (!properties.hasCredentials()) {
            throw new DownstreamException(TARGET, 401, "Missing OANDA credentials");
        }
        Supplier<JsonNode> call = () -> doRequest(method, path, body);
        try {
            return CircuitBreaker.decorateSupplier(circuitBreaker, call).get();
        } catch (CallNotPermittedException e) {
            throw new DownstreamException(TARGET, 503, "OANDA circuit breaker open", e);
        }
    }

    private JsonNode doRequest(HttpMethod method, String path, Object body) {
        String url = properties.getBaseUrl().replaceAll("/+$", "") + path;
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(properties.getToken());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (body != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        try {
            ResponseEntity<String> response = restTemplate.exchange(url, method, new HttpEntity<>(body, headers), String.class);
            String payload = response.getBody();
            return payload == null || payload.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(payload);
        } catch (HttpStatusCodeException e) {
            log.warn("OANDA {} {} failed with {}", method, path, e.getStatusCode().value());
            throw new DownstreamException(TARGET, e.getStatusCode().value(),
                    "OANDA error (" + e.getStatusCode().value() + "): " + e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            log.warn("OANDA {} {} network error: {}", method, path, e.getMessage());
            throw new DownstreamException(TARGET, 500, "OANDA unreachable: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new DownstreamException(TARGET, 502, "OANDA returned unreadable JSON", e);
        }
    }

    private int mapState(CircuitBreaker.State state) {
        return switch (state) {
            case CLOSED -> 0;
            case OPEN -> 1;
            case HALF_OPEN -> 2;
            default -> 3;
        };
    }
}
