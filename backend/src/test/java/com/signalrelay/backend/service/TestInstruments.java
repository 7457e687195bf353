package com.signalrelay.backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.ClassPathResource;

public final class TestInstruments {

    private TestInstruments() {
    }

    public static InstrumentCatalog catalog() {
        return InstrumentCatalog.load(new ClassPathResource("instruments.json"), new ObjectMapper());
    }
}
