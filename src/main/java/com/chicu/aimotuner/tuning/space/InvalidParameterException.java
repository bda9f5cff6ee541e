package com.chicu.aimotuner.tuning.space;

import lombok.Getter;

/**
 * Предложенное значение вне домена параметра (границы / шаг / категории).
 */
@Getter
public class InvalidParameterException extends RuntimeException {

    private final String paramName;
    private final transient Object rejectedValue;

    public InvalidParameterException(String paramName, Object rejectedValue, String message) {
        super("Invalid value for '" + paramName + "': " + rejectedValue + " (" + message + ")");
        this.paramName = paramName;
        this.rejectedValue = rejectedValue;
    }
}
