package com.chicu.aimotuner.tuning.store;

import com.chicu.aimotuner.tuning.TuningResult;
import com.chicu.aimotuner.tuning.study.StopReason;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileConfigStoreTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final JsonFileConfigStore store = new JsonFileConfigStore(mapper);

    @TempDir
    Path dir;

    @Test
    void save_shouldWriteSnakeCaseDocument_andLoadBestConfigBack() throws IOException {
        Path file = dir.resolve("best_config.json");
        TuningResult result = sampleResult();

        store.save(file, result);

        JsonNode root = mapper.readTree(file.toFile());
        assertEquals(0.788889, root.get("best_score").asDouble(), 1e-9);
        assertEquals(12, root.get("n_trials").asInt());
        assertEquals(9, root.get("n_complete").asInt());
        assertEquals(2, root.get("n_pruned").asInt());
        assertEquals(1, root.get("n_failed").asInt());
        assertEquals("full", root.get("mode").asText());
        assertEquals("MAX_TRIALS", root.get("stop_reason").asText());
        assertEquals("2026-01-01 10:00:00", root.get("timestamp").asText());
        assertEquals("trial #3: Solver failed on problem p1: OOM", root.get("solver_errors").get(0).asText());

        Map<String, Object> loaded = store.loadBestConfig(file);
        assertEquals(result.bestConfig(), loaded);
        assertEquals(List.of("k", "temperature", "max_new_tokens", "prompt_style", "selection_strategy", "top_p"),
                List.copyOf(loaded.keySet()), "порядок ключей сохраняется");
    }

    @Test
    void save_shouldCreateMissingDirectories_andOverwrite() {
        Path file = dir.resolve("nested").resolve("deeper").resolve("best.json");

        store.save(file, sampleResult());
        assertTrue(Files.exists(file));

        Map<String, Object> other = new LinkedHashMap<>();
        other.put("k", 4);
        store.save(file, TuningResult.builder()
                .bestConfig(other)
                .bestScore(0.1)
                .trialCount(1)
                .completeTrials(1)
                .mode("quick")
                .stopReason(StopReason.TIMEOUT)
                .timestamp("2026-01-02 00:00:00")
                .build());

        assertEquals(Map.of("k", 4), store.loadBestConfig(file));
    }

    @Test
    void loadBestConfig_missingFile_shouldReturnEmptyMap() {
        assertTrue(store.loadBestConfig(dir.resolve("nothing.json")).isEmpty());
    }

    @Test
    void loadBestConfig_withoutBestConfigField_shouldReturnEmptyMap() throws IOException {
        Path file = dir.resolve("partial.json");
        Files.writeString(file, "{\"best_score\": 0.5}");

        assertTrue(store.loadBestConfig(file).isEmpty());
    }

    @Test
    void loadBestConfig_corruptFile_shouldThrowUncheckedIo() throws IOException {
        Path file = dir.resolve("corrupt.json");
        Files.writeString(file, "{ not json");

        assertThrows(UncheckedIOException.class, () -> store.loadBestConfig(file));
    }

    private static TuningResult sampleResult() {
        Map<String, Object> best = new LinkedHashMap<>();
        best.put("k", 8);
        best.put("temperature", 0.5);
        best.put("max_new_tokens", 2048);
        best.put("prompt_style", "strict_final");
        best.put("selection_strategy", "consensus");
        best.put("top_p", 0.9);

        return TuningResult.builder()
                .bestConfig(best)
                .bestScore(0.788889)
                .trialCount(12)
                .completeTrials(9)
                .prunedTrials(2)
                .failedTrials(1)
                .solverErrors(List.of("trial #3: Solver failed on problem p1: OOM"))
                .mode("full")
                .stopReason(StopReason.MAX_TRIALS)
                .timestamp("2026-01-01 10:00:00")
                .build();
    }
}
