package com.signalrelay.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalrelay.backend.model.RiskPolicy;
import com.signalrelay.backend.service.InstrumentCatalog;
import com.signalrelay.backend.service.SymbolResolver;
import com.signalrelay.backend.util.SymbolMapParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

@Slf4j
@Configuration
public class GatewayConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public InstrumentCatalog instrumentCatalog(
            @Value("${instruments.source:classpath:instruments.json}") Resource source,
            ObjectMapper objectMapper
    ) {
        return InstrumentCatalog.load(source, objectMapper);
    }

    @Bean
    public RiskPolicy riskPolicy(RiskProperties risk, TradingProperties trading, SymbolResolver resolver) {
        Set<String> allowlist = new LinkedHashSet<>();
        for (String symbol : trading.getAllowlist()) {
            if (symbol != null && !symbol.isBlank()) {
                allowlist.add(resolver.resolve(symbol));
            }
        }
        RiskPolicy policy = new RiskPolicy(
                risk.getMaxRiskPct(),
                risk.getMaxUnits(),
                risk.getDailyLossStopPct(),
                risk.getMaxOpenPositions(),
                risk.getMaxOpenPerInstrument(),
                canonical(risk.getSymbolUnitCaps(), resolver, BigDecimal::intValue),
                canonical(risk.getSymbolRiskCaps(), resolver, BigDecimal::doubleValue),
                canonical(risk.getMinStopDistance(), resolver, Function.identity()),
                canonical(risk.getInstrumentPositionCaps(), resolver, BigDecimal::intValue),
                allowlist
        );
        log.info("Risk policy: maxRiskPct={} maxUnits={} dailyLossStopPct={} allowlist={} unitCaps={} riskCaps={} minStop={}",
                policy.maxRiskPct(), policy.maxUnits(), policy.dailyLossStopPct(), policy.allowlist(),
                policy.unitCaps(), policy.riskCaps(), policy.minStopDistance());
        return policy;
    }

    private static <T> Map<String, T> canonical(String raw, SymbolResolver resolver, Function<BigDecimal, T> mapper) {
        Map<String, T> result = new LinkedHashMap<>();
        SymbolMapParser.parse(raw).forEach((symbol, value) -> result.put(resolver.resolve(symbol), mapper.apply(value)));
        return result;
    }
}
