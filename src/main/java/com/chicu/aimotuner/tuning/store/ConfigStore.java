package com.chicu.aimotuner.tuning.store;

import com.chicu.aimotuner.tuning.TuningResult;

import java.nio.file.Path;
import java.util.Map;

public interface ConfigStore {

    void save(Path location, TuningResult result);

    /**
     * best_config из сохранённого результата; пустая map, если ничего ещё не сохраняли.
     */
    Map<String, Object> loadBestConfig(Path location);
}
