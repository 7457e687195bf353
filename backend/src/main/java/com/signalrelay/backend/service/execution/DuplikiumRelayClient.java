package com.signalrelay.backend.service.execution;

import com.signalrelay.backend.config.RelayProperties;
import com.signalrelay.backend.config.TradingProperties;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Forwards the master order to the Duplikium copy-trade relay, which scales it to the follower accounts.
 */
@Slf4j
@Component
@Order(2)
public class DuplikiumRelayClient implements ExecutionTarget {

    public static final String NAME = "duplikium";

    private final RestTemplate restTemplate;
    private final CircuitBreaker circuitBreaker;
    private final RelayProperties relayProperties;
    private final TradingProperties tradingProperties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public DuplikiumRelayClient(@Qualifier("relayRestTemplate") RestTemplate restTemplate,
                                @Qualifier("relayCircuitBreaker") CircuitBreaker circuitBreaker,
                                RelayProperties relayProperties,
                                TradingProperties tradingProperties,
                                MeterRegistry meterRegistry,
                                Clock clock) {
        this.restTemplate = restTemplate;
        this.circuitBreaker = circuitBreaker;
        this.relayProperties = relayProperties;
        this.tradingProperties = tradingProperties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @PostConstruct
    void init() {
        Gauge.builder("downstream_circuit_state", circuitBreaker, breaker -> breaker.getState() == CircuitBreaker.State.CLOSED ? 0 : 1)
                .tag("target", NAME)
                .register(meterRegistry);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public TargetOutcome submit(OrderTicket ticket) {
        if (tradingProperties.isDryRun() || !relayProperties.isForward() || !tradingProperties.isEnabled()) {
            return TargetOutcome.noop(NAME, "Duplikium not called (dry run / forwarding disabled / trading disabled)");
        }
        if (relayProperties.getBaseUrl() == null || relayProperties.getBaseUrl().isBlank()) {
            return TargetOutcome.failure(NAME, 400, "Duplikium base URL not set");
        }
        Map<String, Object> payload = payload(ticket);
        try {
            ResponseEntity<String> response = circuitBreaker.executeSupplier(() -> restTemplate.exchange(
                    relayProperties.ordersUrl(), HttpMethod.POST, new HttpEntity<>(payload, headers()), String.class));
            int status = response.getStatusCode().value();
            log.info("Duplikium accepted {} ({}) with {}", ticket.orderId(), payload.get("clientOrderId"), status);
            return TargetOutcome.success(NAME, status, response.getBody() == null ? "" : response.getBody());
        } catch (CallNotPermittedException e) {
            return TargetOutcome.failure(NAME, 503, "Duplikium circuit breaker open");
        } catch (HttpStatusCodeException e) {
            log.warn("Duplikium rejected {} with {}", ticket.orderId(), e.getStatusCode().value());
            return TargetOutcome.failure(NAME, e.getStatusCode().value(), e.getResponseBodyAsString());
        } catch (RestClientException e) {
            log.warn("Duplikium unreachable for {}: {}", ticket.orderId(), e.getMessage());
            return TargetOutcome.failure(NAME, 500, e.getMessage());
        }
    }

    Map<String, Object> payload(OrderTicket ticket) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("source", relayProperties.getMasterSource());
        payload.put("symbol", ticket.instrument());
        payload.put("side", ticket.side().name());
        payload.put("orderType", "MARKET");
        payload.put("units", ticket.units());
        payload.put("entryPrice", ticket.entryPrice());
        payload.put("slPrice", ticket.stopPrice());
        payload.put("tpPrice", ticket.targetPrice());
        payload.put("clientOrderId", relayProperties.getClientOrderTag() + "-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8));
        payload.put("comment", "TV->" + relayProperties.getMasterSource() + " " + Instant.now(clock));
        return payload;
    }

    HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        switch (relayProperties.getAuthStyle()) {
            case BEARER -> headers.setBearerAuth(relayProperties.getToken());
            case BASIC -> headers.setBasicAuth(relayProperties.getUser(), relayProperties.getToken());
            case HEADERS, TOKEN -> {
                headers.set("X-Auth-Username", relayProperties.getUser());
                headers.set("X-Auth-Token", relayProperties.getToken());
            }
        }
        return headers;
    }
}
