package com.finplan.dispatch.cli;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link ScenarioDocument}s from JSON.
 */
@Component
public class ScenarioLoader {

    private final ObjectMapper objectMapper;

    public ScenarioLoader() {
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ScenarioDocument load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    public ScenarioDocument load(InputStream in) throws IOException {
        return objectMapper.readValue(in, ScenarioDocument.class);
    }
}
