package com.signalrelay.backend.service.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import com.signalrelay.backend.config.OandaProperties;
import com.signalrelay.backend.config.RiskProperties;
import com.signalrelay.backend.service.MetricsService;
import com.signalrelay.backend.service.OandaHttpClient;
import com.signalrelay.backend.util.TtlCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Account NAV from the broker's account summary, cached briefly. Any failure yields the configured
 * fallback balance; fallbacks are not cached so the next call retries the upstream.
 */
@Slf4j
@Service
public class OandaBalanceOracle implements BalanceOracle {

    private final OandaHttpClient client;
    private final MetricsService metricsService;
    private final BigDecimal fallbackBalance;
    private final TtlCache<BigDecimal> cache;

    public OandaBalanceOracle(OandaHttpClient client,
                              OandaProperties oandaProperties,
                              RiskProperties riskProperties,
                              MetricsService metricsService,
                              Clock clock) {
        this.client = client;
        this.metricsService = metricsService;
        this.fallbackBalance = BigDecimal.valueOf(riskProperties.getFallbackBalance());
        this.cache = new TtlCache<>(clock, Duration.ofSeconds(oandaProperties.getBalanceCacheSeconds()));
    }

    @Override
    public BalanceReading currentBalance() {
        Optional<BigDecimal> cached = cache.getIfFresh();
        if (cached.isPresent()) {
            return BalanceReading.cached(cached.get());
        }
        try {
            BigDecimal balance = fetch();
            cache.put(balance);
            return BalanceReading.live(balance);
        } catch (RuntimeException e) {
            log.warn("Balance unavailable, using fallback {}: {}", fallbackBalance, e.getMessage());
            metricsService.recordDegraded("balance");
            return BalanceReading.fallback(fallbackBalance);
        }
    }

    private BigDecimal fetch() {
        JsonNode account = client.get(client.accountPath("/summary")).path("account");
        JsonNode value = account.hasNonNull("NAV") ? account.get("NAV") : account.get("balance");
        if (value == null || value.isNull()) {
            throw new IllegalStateException("Account summary has no NAV or balance");
        }
        BigDecimal balance = new BigDecimal(value.asText());
        if (balance.signum() <= 0) {
            throw new IllegalStateException("Non-positive balance " + balance);
        }
        return balance;
    }
}
