package com.chicu.aimotuner.tuning.space;

/**
 * Как интерпретировать значение параметра в пространстве тюнинга.
 */
public enum ParamKind {
    INT,
    FLOAT,
    CATEGORICAL
}
