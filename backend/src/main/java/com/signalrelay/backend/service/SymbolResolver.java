package com.signalrelay.backend.service;

import com.signalrelay.backend.model.InstrumentMeta;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps alert tickers such as {@code OANDA:US30USD} or {@code us30.cash} to canonical instrument ids.
 * Unknown tokens come back normalized but otherwise unchanged; the allow-list decides whether they trade.
 */
@Slf4j
@Service
public class SymbolResolver {

    private final Map<String, String> aliasTable;

    public SymbolResolver(InstrumentCatalog catalog) {
        Map<String, String> table = new HashMap<>();
        for (InstrumentMeta instrument : catalog.all()) {
            register(table, instrument.id(), instrument.id());
            for (String alias : instrument.aliases()) {
                register(table, alias, instrument.id());
            }
        }
        this.aliasTable = Map.copyOf(table);
    }

    public String resolve(String rawToken) {
        String normalized = normalize(rawToken);
        return aliasTable.getOrDefault(normalized, normalized);
    }

    public boolean isKnown(String rawToken) {
        return aliasTable.containsKey(normalize(rawToken));
    }

    public static String normalize(String rawToken) {
        if (rawToken == null) {
            return "";
        }
        return rawToken.trim().toUpperCase(Locale.ROOT).replaceAll("[:./\\-\\s]", "");
    }

    private static void register(Map<String, String> table, String alias, String canonicalId) {
        String key = normalize(alias);
        String previous = table.putIfAbsent(key, canonicalId);
        if (previous != null && !previous.equals(canonicalId)) {
            log.warn("Alias {} already mapped to {}, ignoring mapping to {}", alias, previous, canonicalId);
        }
    }
}
