package com.chicu.aimotuner.tuning.space;

import com.chicu.aimotuner.tuning.TunerProperties;
import com.chicu.aimotuner.tuning.TuningCandidate;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SearchSpaceTest {

    private final SearchSpace space = SearchSpace.fromProperties(new TunerProperties.Space());

    @Test
    void fromProperties_shouldDeclareSolverParamsInOrder() {
        assertEquals(List.of("k", "temperature", "max_new_tokens", "prompt_style", "selection_strategy", "top_p"),
                space.names());

        ParamSpec tokens = space.get(SearchSpace.MAX_NEW_TOKENS);
        assertEquals(ParamKind.INT, tokens.kind());
        assertEquals(512, tokens.step());
        assertEquals(7, tokens.gridSize(), "1024..4096 с шагом 512 = 7 точек");

        assertEquals(List.of("majority_vote", "verifier_weighted", "consensus"),
                space.get(SearchSpace.SELECTION_STRATEGY).choices());
    }

    @Test
    void drawInt_shouldAcceptGridValues_andCoerceToInteger() {
        assertEquals(1536, space.draw(SearchSpace.MAX_NEW_TOKENS, 1536));
        assertEquals(4, space.draw(SearchSpace.K, 4.0));
        assertEquals(16, space.draw(SearchSpace.K, "16"));
        assertInstanceOf(Integer.class, space.draw(SearchSpace.K, 8L));
    }

    @Test
    void drawInt_shouldRejectOffGridOutOfRangeAndFractional() {
        assertThrows(InvalidParameterException.class, () -> space.draw(SearchSpace.MAX_NEW_TOKENS, 1500));
        assertThrows(InvalidParameterException.class, () -> space.draw(SearchSpace.MAX_NEW_TOKENS, 4608));
        assertThrows(InvalidParameterException.class, () -> space.draw(SearchSpace.K, 3));
        assertThrows(InvalidParameterException.class, () -> space.draw(SearchSpace.K, 4.5));
        assertThrows(InvalidParameterException.class, () -> space.draw(SearchSpace.K, "many"));
        assertThrows(InvalidParameterException.class, () -> space.draw(SearchSpace.K, null));
    }

    @Test
    void drawFloat_shouldCheckBounds() {
        assertEquals(0.5, (Double) space.draw(SearchSpace.TEMPERATURE, 0.5), 1e-12);
        assertEquals(1.0, (Double) space.draw(SearchSpace.TOP_P, 1.0), 1e-12);
        assertEquals(0.7, (Double) space.draw(SearchSpace.TEMPERATURE, "0.7"), 1e-12);

        assertThrows(InvalidParameterException.class, () -> space.draw(SearchSpace.TEMPERATURE, 1.2));
        assertThrows(InvalidParameterException.class, () -> space.draw(SearchSpace.TOP_P, 0.79));
        assertThrows(InvalidParameterException.class, () -> space.draw(SearchSpace.TOP_P, Double.NaN));
    }

    @Test
    void drawCategory_shouldReturnDeclaredChoiceOnly() {
        assertEquals("tir", space.draw(SearchSpace.PROMPT_STYLE, "tir"));

        InvalidParameterException e = assertThrows(InvalidParameterException.class,
                () -> space.draw(SearchSpace.PROMPT_STYLE, "chain_of_thought"));
        assertEquals("prompt_style", e.getParamName());
        assertEquals("chain_of_thought", e.getRejectedValue());
    }

    @Test
    void draw_shouldRejectUnknownParam() {
        assertThrows(IllegalArgumentException.class, () -> space.draw("beam_width", 2));
    }

    @Test
    void candidate_shouldRequireEveryDeclaredParamExactlyOnce() {
        Map<String, Object> raw = validRaw();

        TuningCandidate c = space.candidate(raw);
        assertEquals(8, c.intParam("k"));
        assertEquals("consensus", c.stringParam("selection_strategy"));
        assertTrue(space.contains(c));

        Map<String, Object> missing = new LinkedHashMap<>(raw);
        missing.remove("top_p");
        assertThrows(InvalidParameterException.class, () -> space.candidate(missing));

        Map<String, Object> extra = new LinkedHashMap<>(raw);
        extra.put("beam_width", 2);
        assertThrows(InvalidParameterException.class, () -> space.candidate(extra));
    }

    @Test
    void candidate_shouldBeImmutable() {
        TuningCandidate c = space.candidate(validRaw());
        assertThrows(UnsupportedOperationException.class, () -> c.params().put("k", 9));
    }

    @Test
    void of_shouldRejectDuplicateNames() {
        assertThrows(IllegalArgumentException.class, () -> SearchSpace.of(List.of(
                ParamSpec.intRange("k", 1, 2),
                ParamSpec.floatRange("k", 0.0, 1.0)
        )));
        assertThrows(IllegalArgumentException.class, () -> SearchSpace.of(List.of()));
    }

    private static Map<String, Object> validRaw() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("k", 8);
        raw.put("temperature", 0.5);
        raw.put("max_new_tokens", 2048);
        raw.put("prompt_style", "strict_final");
        raw.put("selection_strategy", "consensus");
        raw.put("top_p", 0.9);
        return raw;
    }
}
