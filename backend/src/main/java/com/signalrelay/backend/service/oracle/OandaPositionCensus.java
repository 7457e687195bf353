package com.signalrelay.backend.service.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import com.signalrelay.backend.config.OandaProperties;
import com.signalrelay.backend.service.MetricsService;
import com.signalrelay.backend.service.OandaHttpClient;
import com.signalrelay.backend.util.TtlCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Counts open trades on the broker account. Fails open: an unreadable census reports zero positions
 * so the concurrency guard never freezes the gateway during an outage.
 */
@Slf4j
@Service
public class OandaPositionCensus implements PositionCensus {

    private final OandaHttpClient client;
    private final MetricsService metricsService;
    private final TtlCache<PositionCensusReading> cache;

    public OandaPositionCensus(OandaHttpClient client,
                               OandaProperties properties,
                               MetricsService metricsService,
                               Clock clock) {
        this.client = client;
        this.metricsService = metricsService;
        this.cache = new TtlCache<>(clock, Duration.ofSeconds(properties.getPositionCacheSeconds()));
    }

    @Override
    public PositionCensusReading openPositions() {
        Optional<PositionCensusReading> cached = cache.getIfFresh();
        if (cached.isPresent()) {
            return cached.get();
        }
        try {
            PositionCensusReading reading = fetch();
            cache.put(reading);
            return reading;
        } catch (RuntimeException e) {
            log.warn("Position census unavailable, assuming no open positions: {}", e.getMessage());
            metricsService.recordDegraded("positions");
            return PositionCensusReading.empty(true);
        }
    }

    private PositionCensusReading fetch() {
        JsonNode trades = client.get(client.accountPath("/openTrades")).path("trades");
        Map<String, Integer> perInstrument = new HashMap<>();
        int total = 0;
        for (JsonNode trade : trades) {
            String instrument = trade.path("instrument").asText("");
            if (instrument.isBlank()) {
                continue;
            }
            perInstrument.merge(instrument, 1, Integer::sum);
            total++;
        }
        return new PositionCensusReading(total, perInstrument, false);
    }
}
