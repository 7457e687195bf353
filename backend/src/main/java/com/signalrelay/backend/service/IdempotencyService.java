package com.signalrelay.backend.service;

import com.signalrelay.backend.config.TradingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers order ids for a trailing window so a resent alert is not executed twice. State lives in
 * memory only and is lost on restart.
 */
@Slf4j
@Service
public class IdempotencyService {

    private final Map<String, Instant> firstSeen = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public IdempotencyService(TradingProperties properties, Clock clock) {
        this.clock = clock;
        this.ttl = Duration.ofSeconds(properties.getIdempotencyTtlSeconds());
    }

    /**
     * Returns true when {@code orderId} was already seen within the window. Blank ids are never duplicates.
     */
    public boolean seen(String orderId) {
        Instant now = clock.instant();
        purgeExpired(now);
        if (orderId == null || orderId.isBlank()) {
            return false;
        }
        Instant previous = firstSeen.putIfAbsent(orderId, now);
        if (previous != null) {
            log.info("Duplicate order id {} first seen at {}", orderId, previous);
            return true;
        }
        return false;
    }

    int size() {
        return firstSeen.size();
    }

    private void purgeExpired(Instant now) {
        firstSeen.entrySet().removeIf(entry -> Duration.between(entry.getValue(), now).compareTo(ttl) > 0);
    }
}
