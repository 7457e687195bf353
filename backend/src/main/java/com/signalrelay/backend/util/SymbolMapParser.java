package com.signalrelay.backend.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Parses per-symbol settings given either as a JSON object ({@code {"US30": 5}}) or as
 * {@code US30:5, XAUUSD:5000}. Keys are upper-cased; entries that do not parse are dropped.
 */
@Slf4j
public final class SymbolMapParser {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private SymbolMapParser() {
    }

    public static Map<String, BigDecimal> parse(String raw) {
        Map<String, BigDecimal> result = new LinkedHashMap<>();
        if (raw == null || raw.isBlank()) {
            return result;
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith("{")) {
            try {
                Map<String, Object> json = OBJECT_MAPPER.readValue(trimmed, new TypeReference<Map<String, Object>>() {});
                json.forEach((key, value) -> put(result, key, value == null ? null : value.toString()));
                return result;
            } catch (Exception e) {
                log.warn("Symbol map is not valid JSON, trying SYMBOL:value form: {}", e.getMessage());
            }
        }
        for (String part : trimmed.split(",")) {
            int idx = part.lastIndexOf(':');
            if (idx < 0) {
                continue;
            }
            put(result, part.substring(0, idx), part.substring(idx + 1));
        }
        return result;
    }

    private static void put(Map<String, BigDecimal> target, String key, String value) {
        if (key == null || key.isBlank() || value == null) {
            return;
        }
        try {
            target.put(key.trim().toUpperCase(Locale.ROOT), new BigDecimal(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Ignoring symbol map entry {}={}", key, value);
        }
    }
}
