package com.neuroassist.stroke.scoring;

import com.neuroassist.stroke.model.MagnitudeBand;
import com.neuroassist.stroke.model.StrokeType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Reads a Siriraj score. Above 1 is hemorrhagic, below -1 ischemic, and the closed interval
 * [-1, 1] is uncertain.
 */
@Component
public class ScoreInterpreter {

    private static final BigDecimal UPPER_THRESHOLD = BigDecimal.ONE;
    private static final BigDecimal LOWER_THRESHOLD = BigDecimal.ONE.negate();
    private static final BigDecimal STRONG_MAGNITUDE = new BigDecimal("2");
    private static final BigDecimal MODERATE_MAGNITUDE = BigDecimal.ONE;

    public ScoreInterpretation interpret(BigDecimal score) {
        return new ScoreInterpretation(strokeType(score), magnitude(score));
    }

    public ScoreInterpretation interpret(double score) {
        return interpret(BigDecimal.valueOf(score));
    }

    private StrokeType strokeType(BigDecimal score) {
        if (score.compareTo(UPPER_THRESHOLD) > 0) {
            return StrokeType.HEMORRHAGIC;
        }
        if (score.compareTo(LOWER_THRESHOLD) < 0) {
            return StrokeType.ISCHEMIC;
        }
        return StrokeType.UNCERTAIN;
    }

    private MagnitudeBand magnitude(BigDecimal score) {
        BigDecimal abs = score.abs();
        if (abs.compareTo(STRONG_MAGNITUDE) > 0) {
            return MagnitudeBand.STRONG;
        }
        if (abs.compareTo(MODERATE_MAGNITUDE) > 0) {
            return MagnitudeBand.MODERATE;
        }
        return MagnitudeBand.WEAK;
    }
}
