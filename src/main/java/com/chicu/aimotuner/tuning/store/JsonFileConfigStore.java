package com.chicu.aimotuner.tuning.store;

import com.chicu.aimotuner.tuning.TuningResult;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class JsonFileConfigStore implements ConfigStore {

    private static final String BEST_CONFIG = "best_config";

    private final ObjectMapper mapper;

    @Override
    public void save(Path location, TuningResult result) {
        if (location == null) throw new IllegalArgumentException("ConfigStore: location is null");
        if (result == null) throw new IllegalArgumentException("ConfigStore: result is null");

        try {
            Path parent = location.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writer()
                    .with(SerializationFeature.INDENT_OUTPUT)
                    .writeValue(location.toFile(), result);

            log.info("💾 Best config saved to {} (score={}, trials={})",
                    location, result.bestScore(), result.trialCount());

        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write tuning result to " + location, e);
        }
    }

    @Override
    public Map<String, Object> loadBestConfig(Path location) {
        if (location == null || !Files.exists(location)) {
            log.debug("No saved tuning result at {}", location);
            return new LinkedHashMap<>();
        }

        try {
            JsonNode root = mapper.readTree(location.toFile());
            JsonNode best = (root == null) ? null : root.get(BEST_CONFIG);
            if (best == null || !best.isObject()) {
                return new LinkedHashMap<>();
            }
            return mapper.convertValue(best, new TypeReference<LinkedHashMap<String, Object>>() {});

        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read tuning result from " + location, e);
        }
    }
}
