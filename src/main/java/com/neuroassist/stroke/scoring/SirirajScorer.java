package com.neuroassist.stroke.scoring;

import com.neuroassist.stroke.model.PatientAssessment;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Siriraj stroke score:
 * <pre>
 * score = 2.5*LOC + 2*vomiting + 2*headache + 0.1*diastolicBP - 3*atheromaMarkers - 12
 * </pre>
 * where atheromaMarkers is 1 if any of hypertension, diabetes or smoking is in the history.
 * <p>
 * Evaluated in decimal arithmetic so that a score sitting exactly on an interpretation
 * threshold (for example a diastolic pressure of 130 giving exactly 1.0) is not nudged across
 * it by binary rounding.
 * </p>
 */
@Component
public class SirirajScorer {

    static final BigDecimal LOC_WEIGHT = new BigDecimal("2.5");
    static final BigDecimal VOMITING_WEIGHT = new BigDecimal("2");
    static final BigDecimal HEADACHE_WEIGHT = new BigDecimal("2");
    static final BigDecimal DIASTOLIC_WEIGHT = new BigDecimal("0.1");
    static final BigDecimal ATHEROMA_WEIGHT = new BigDecimal("3");
    static final BigDecimal CONSTANT = new BigDecimal("12");

    /**
     * @param assessment an assessment carrying diastolic pressure, level of consciousness,
     *                   vomiting and headache (guaranteed for any assessment routed to the score)
     */
    public BigDecimal score(PatientAssessment assessment) {
        BigDecimal loc = BigDecimal.valueOf(assessment.levelOfConsciousness().sirirajPoints());
        BigDecimal vomiting = Boolean.TRUE.equals(assessment.vomiting()) ? BigDecimal.ONE : BigDecimal.ZERO;
        BigDecimal headache = Boolean.TRUE.equals(assessment.headache()) ? BigDecimal.ONE : BigDecimal.ZERO;
        BigDecimal atheroma = assessment.hasAtheromaRiskFactor() ? BigDecimal.ONE : BigDecimal.ZERO;
        BigDecimal diastolic = BigDecimal.valueOf(assessment.diastolicBloodPressure());

        return LOC_WEIGHT.multiply(loc)
                .add(VOMITING_WEIGHT.multiply(vomiting))
                .add(HEADACHE_WEIGHT.multiply(headache))
                .add(DIASTOLIC_WEIGHT.multiply(diastolic))
                .subtract(ATHEROMA_WEIGHT.multiply(atheroma))
                .subtract(CONSTANT);
    }
}
