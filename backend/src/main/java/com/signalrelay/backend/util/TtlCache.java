package com.signalrelay.backend.util;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Single value cache with a fixed time to live. Reads and writes are serialized; loading happens
 * outside the lock so a slow upstream never holds other callers.
 */
public final class TtlCache<T> {

    private final Clock clock;
    private final Duration ttl;

    private T value;
    private Instant storedAt;

    public TtlCache(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    public synchronized Optional<T> getIfFresh() {
        if (value == null || storedAt == null) {
            return Optional.empty();
        }
        if (Duration.between(storedAt, clock.instant()).compareTo(ttl) >= 0) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    public synchronized void put(T newValue) {
        this.value = newValue;
        this.storedAt = clock.instant();
    }

    public synchronized void invalidate() {
        this.value = null;
        this.storedAt = null;
    }
}
