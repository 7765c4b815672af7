package com.neuroassist.stroke.exception;

import lombok.Getter;

/**
 * Malformed input. Raised before any classification work, never retried by the engine.
 */
@Getter
public class ValidationException extends StrokeAssessmentException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    @Override
    public String kind() {
        return "VALIDATION_ERROR";
    }
}
