package com.neuroassist.stroke.model;

import java.io.Serializable;

/**
 * The engine's verdict for one assessment. Produced once, never mutated.
 */
public record DiagnosisResult(
        StrokeType strokeType,
        double confidence,
        boolean thrombolyticEligible,
        MethodUsed methodUsed,
        String actionProtocol
) implements Serializable {

    public DiagnosisResult {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must lie in [0,1], got " + confidence);
        }
        if (thrombolyticEligible && strokeType != StrokeType.ISCHEMIC) {
            throw new IllegalArgumentException("only an ischemic stroke can be thrombolytic-eligible");
        }
    }
}
