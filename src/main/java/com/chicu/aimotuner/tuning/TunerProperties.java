package com.chicu.aimotuner.tuning;

import com.chicu.aimotuner.tuning.sampler.SamplerType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "aimo.tuning")
public class TunerProperties {

    /**
     * Режим QUICK: меньше trial'ов, короче таймаут.
     */
    private int quickTrials = 10;
    private Duration quickTimeout = Duration.ofMinutes(30);

    /**
     * Режим FULL.
     */
    private int fullTrials = 30;
    private Duration fullTimeout = Duration.ofHours(1);

    private long defaultSeed = 42L;

    /**
     * Куда пишем лучший конфиг (JSON).
     */
    private String configSavePath = "work/best_config.json";

    private Space space = new Space();
    private Sampler sampler = new Sampler();
    private Pruner pruner = new Pruner();
    private Score score = new Score();
    private Runner runner = new Runner();

    /**
     * Готовые конфиги "на всякий случай": используются, пока тюнинг ещё ни разу не сохранил результат.
     */
    private Map<String, Map<String, Object>> presets = defaultPresets();

    @Data
    public static class Space {
        private int kMin = 4;
        private int kMax = 16;

        private double temperatureMin = 0.3;
        private double temperatureMax = 1.0;

        private int maxTokensMin = 1024;
        private int maxTokensMax = 4096;
        private int maxTokensStep = 512;

        private double topPMin = 0.8;
        private double topPMax = 1.0;

        private List<String> promptStyles = new ArrayList<>(List.of("strict_final", "tir"));

        private List<String> selectionStrategies = new ArrayList<>(List.of(
                "majority_vote", "verifier_weighted", "consensus"
        ));
    }

    @Data
    public static class Sampler {
        private SamplerType type = SamplerType.TPE;

        /**
         * Сколько COMPLETE trial'ов нужно до включения TPE.
         * 0 = по числу параметров в пространстве.
         */
        private int startupTrials = 0;

        /**
         * Доля "хороших" trial'ов.
         */
        private double gamma = 0.25;

        private int candidates = 24;

        /**
         * Вес априорной (равномерной) компоненты и сглаживание категорий.
         */
        private double priorWeight = 1.0;
    }

    @Data
    public static class Pruner {
        private boolean enabled = true;
        private int startupTrials = 3;
        private int warmupSteps = 2;
    }

    @Data
    public static class Score {
        private double timeBudgetPerProblem = 180.0;
        private double timePenaltyWeight = 0.1;

        /**
         * 1.0 = линейный штраф, как было изначально.
         */
        private double penaltyExponent = 1.0;

        /**
         * null = без потолка.
         */
        private Double penaltyCap;
    }

    @Data
    public static class Runner {
        private boolean enabled = false;
        private TuningMode mode = TuningMode.QUICK;
        private String problemsPath = "reference.json";
        private Long seed;
    }

    private static Map<String, Map<String, Object>> defaultPresets() {
        Map<String, Map<String, Object>> out = new LinkedHashMap<>();

        out.put("conservative", preset(8, 0.5, 2048, "strict_final", "consensus", 0.9));
        out.put("exploratory", preset(12, 0.8, 3072, "strict_final", "verifier_weighted", 0.95));
        out.put("fast", preset(4, 0.3, 1024, "tir", "majority_vote", 0.9));

        return out;
    }

    private static Map<String, Object> preset(int k,
                                              double temperature,
                                              int maxNewTokens,
                                              String promptStyle,
                                              String selectionStrategy,
                                              double topP) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("k", k);
        p.put("temperature", temperature);
        p.put("max_new_tokens", maxNewTokens);
        p.put("prompt_style", promptStyle);
        p.put("selection_strategy", selectionStrategy);
        p.put("top_p", topP);
        return p;
    }
}
