package com.chicu.aimotuner.tuning.eval;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON-массив {@code [{"id": "...", "problem": "...", "answer": 123}, ...]}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonProblemSetLoader {

    private final ObjectMapper mapper;

    public ProblemSet load(Path path) {
        if (path == null) throw new IllegalArgumentException("Problems path is null");

        JsonNode root;
        try {
            root = mapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read problems from " + path, e);
        }

        if (root == null || !root.isArray()) {
            throw new IllegalArgumentException("Problems file must be a JSON array: " + path);
        }

        List<Problem> out = new ArrayList<>(root.size());
        for (JsonNode n : root) {
            JsonNode answer = n.get("answer");
            if (answer == null || !answer.isIntegralNumber() || !answer.canConvertToLong()) {
                throw new IllegalArgumentException("Problem " + n.path("id").asText() + ": answer is not an integer");
            }
            out.add(Problem.builder()
                    .id(n.path("id").asText())
                    .problem(n.path("problem").asText())
                    .answer(answer.asLong())
                    .build());
        }

        log.info("📚 Loaded {} problems from {}", out.size(), path);
        return ProblemSet.of(out);
    }
}
