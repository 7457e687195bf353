package com.signalrelay.backend.service;

import com.signalrelay.backend.config.TradingProperties;
import com.signalrelay.backend.util.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class IdempotencyServiceTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-04T14:00:00Z"));

    private IdempotencyService service() {
        TradingProperties properties = new TradingProperties();
        properties.setIdempotencyTtlSeconds(90);
        return new IdempotencyService(properties, clock);
    }

    @Test
    void secondSightingWithinTtlIsDuplicate() {
        IdempotencyService service = service();

        assertThat(service.seen("tv-1")).isFalse();
        assertThat(service.seen("tv-1")).isTrue();
    }

    @Test
    void idIsForgottenAfterTtl() {
        IdempotencyService service = service();
        service.seen("tv-1");
        service.seen("tv-1");

        clock.advance(Duration.ofSeconds(91));

        assertThat(service.seen("tv-1")).isFalse();
        assertThat(service.seen("tv-1")).isTrue();
    }

    @Test
    void duplicateDoesNotExtendTheWindow() {
        IdempotencyService service = service();
        service.seen("tv-1");
        clock.advance(Duration.ofSeconds(60));
        assertThat(service.seen("tv-1")).isTrue();

        clock.advance(Duration.ofSeconds(31));

        assertThat(service.seen("tv-1")).isFalse();
    }

    @Test
    void blankIdsAreNeverDuplicates() {
        IdempotencyService service = service();

        assertThat(service.seen("")).isFalse();
        assertThat(service.seen("")).isFalse();
        assertThat(service.seen(null)).isFalse();
        assertThat(service.size()).isZero();
    }

    @Test
    void expiredEntriesArePurged() {
        IdempotencyService service = service();
        service.seen("a");
        service.seen("b");
        clock.advance(Duration.ofSeconds(120));

        service.seen("c");

        assertThat(service.size()).isEqualTo(1);
    }

    @Test
    void concurrentSightingsAdmitExactlyOnce() throws Exception {
        IdempotencyService service = service();
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Callable<Boolean>> calls = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                calls.add(() -> {
                    start.await();
                    return service.seen("same-id");
                });
            }
            List<Future<Boolean>> futures = new ArrayList<>();
            for (Callable<Boolean> call : calls) {
                futures.add(pool.submit(call));
            }
            start.countDown();
            int admitted = 0;
            for (Future<Boolean> future : futures) {
                if (!future.get()) {
                    admitted++;
                }
            }
            assertThat(admitted).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
