package com.signalrelay.backend.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalrelay.backend.model.InstrumentMeta;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only instrument reference data keyed by canonical id.
 */
@Slf4j
public class InstrumentCatalog {

    private final Map<String, InstrumentMeta> byId;

    public InstrumentCatalog(List<InstrumentMeta> instruments) {
        Map<String, InstrumentMeta> map = new LinkedHashMap<>();
        for (InstrumentMeta instrument : instruments) {
            if (instrument.id() == null || instrument.id().isBlank()) {
                log.warn("Skipping instrument without id: {}", instrument);
                continue;
            }
            map.put(instrument.id(), instrument);
        }
        this.byId = Map.copyOf(map);
    }

    public static InstrumentCatalog load(Resource resource, ObjectMapper objectMapper) {
        try (InputStream in = resource.getInputStream()) {
            List<InstrumentMeta> instruments = objectMapper.readValue(in, new TypeReference<List<InstrumentMeta>>() {});
            log.info("Loaded {} instruments from {}", instruments.size(), resource.getDescription());
            return new InstrumentCatalog(instruments);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to load instrument metadata from " + resource.getDescription(), e);
        }
    }

    public Optional<InstrumentMeta> find(String canonicalId) {
        if (canonicalId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byId.get(canonicalId));
    }

    public Collection<InstrumentMeta> all() {
        return byId.values();
    }
}
