package com.neuroassist.stroke.exception;

import java.util.Optional;

/**
 * Base type of every failure the diagnosis engine reports to its caller.
 * <p>
 * Subclasses identify the failure kind; {@link #kind()} gives the stable name that the
 * REST layer reports so that callers can tell the kinds apart without parsing messages.
 * </p>
 */
public abstract class StrokeAssessmentException extends RuntimeException {

    protected StrokeAssessmentException(String message) {
        super(message);
    }

    protected StrokeAssessmentException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String kind();

    /**
     * Walks the cause chain of a failure raised while running the workflow graph and returns
     * the engine exception that started it, if there is one.
     */
    public static Optional<StrokeAssessmentException> findIn(Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof StrokeAssessmentException assessmentException) {
                return Optional.of(assessmentException);
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return Optional.empty();
    }
}
