package com.neuroassist.stroke.exception;

/**
 * The image-analysis capability timed out or failed. The engine never falls back to the
 * Siriraj score when this is raised.
 */
public class ClassificationUnavailableException extends StrokeAssessmentException {

    public ClassificationUnavailableException(String message) {
        super(message);
    }

    public ClassificationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() {
        return "CLASSIFICATION_UNAVAILABLE";
    }
}
