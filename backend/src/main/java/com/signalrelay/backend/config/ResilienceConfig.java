package com.signalrelay.backend.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Circuit breakers only. Order placement is never retried: a blind resend risks a duplicate fill.
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public CircuitBreaker oandaCircuitBreaker(
            @Value("${resilience.oanda.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${resilience.oanda.wait-open-seconds:30}") long waitOpenSeconds,
            @Value("${resilience.oanda.sliding-window-size:20}") int slidingWindowSize
    ) {
        return CircuitBreaker.of("oanda", config(failureRateThreshold, waitOpenSeconds, slidingWindowSize));
    }

    @Bean
    public CircuitBreaker relayCircuitBreaker(
            @Value("${resilience.relay.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${resilience.relay.wait-open-seconds:30}") long waitOpenSeconds,
            @Value("${resilience.relay.sliding-window-size:20}") int slidingWindowSize
    ) {
        return CircuitBreaker.of("relay", config(failureRateThreshold, waitOpenSeconds, slidingWindowSize));
    }

    private static CircuitBreakerConfig config(float failureRateThreshold, long waitOpenSeconds, int slidingWindowSize) {
        return CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(Duration.ofSeconds(waitOpenSeconds))
                .slidingWindowSize(slidingWindowSize)
                .minimumNumberOfCalls(slidingWindowSize)
                .build();
    }
}
