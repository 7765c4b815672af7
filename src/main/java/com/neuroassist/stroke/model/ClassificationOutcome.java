package com.neuroassist.stroke.model;

import java.io.Serializable;
import java.math.BigDecimal;

/**
 * Result of whichever classification strategy ran. Exactly one of the two variants is
 * produced per evaluation; everything downstream consumes this shape.
 */
public sealed interface ClassificationOutcome extends Serializable
        permits ClassificationOutcome.ImageClassification, ClassificationOutcome.ScoreClassification {

    StrokeType strokeType();

    MethodUsed methodUsed();

    record ImageClassification(StrokeType strokeType, ClarityBand clarityBand) implements ClassificationOutcome {

        @Override
        public MethodUsed methodUsed() {
            return MethodUsed.IMAGE_ANALYSIS;
        }
    }

    record ScoreClassification(BigDecimal score, StrokeType strokeType, MagnitudeBand magnitudeBand)
            implements ClassificationOutcome {

        @Override
        public MethodUsed methodUsed() {
            return MethodUsed.SIRIRAJ_SCORE;
        }
    }
}
