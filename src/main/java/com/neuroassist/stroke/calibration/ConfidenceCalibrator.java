package com.neuroassist.stroke.calibration;

import com.neuroassist.stroke.model.ClassificationOutcome;
import com.neuroassist.stroke.model.ClassificationOutcome.ImageClassification;
import com.neuroassist.stroke.model.ClassificationOutcome.ScoreClassification;
import com.neuroassist.stroke.model.ClarityBand;
import com.neuroassist.stroke.model.MagnitudeBand;
import org.springframework.stereotype.Component;

/**
 * Maps the evidence strength of a classification onto a confidence in [0,1].
 */
@Component
public class ConfidenceCalibrator {

    public double calibrate(ClassificationOutcome outcome) {
        return band(outcome).midpoint();
    }

    public ConfidenceBand band(ClassificationOutcome outcome) {
        if (outcome instanceof ScoreClassification score) {
            return forMagnitude(score.magnitudeBand());
        }
        if (outcome instanceof ImageClassification image) {
            return forClarity(image.clarityBand());
        }
        throw new IllegalArgumentException("Unknown classification outcome: " + outcome);
    }

    ConfidenceBand forMagnitude(MagnitudeBand magnitude) {
        return switch (magnitude) {
            case STRONG -> ConfidenceBand.SIRIRAJ_STRONG;
            case MODERATE -> ConfidenceBand.SIRIRAJ_MODERATE;
            case WEAK -> ConfidenceBand.SIRIRAJ_WEAK;
        };
    }

    ConfidenceBand forClarity(ClarityBand clarity) {
        return switch (clarity) {
            case HIGH -> ConfidenceBand.IMAGE_HIGH_CLARITY;
            case MEDIUM -> ConfidenceBand.IMAGE_MEDIUM_CLARITY;
            case LOW -> ConfidenceBand.IMAGE_LOW_CLARITY;
        };
    }
}
