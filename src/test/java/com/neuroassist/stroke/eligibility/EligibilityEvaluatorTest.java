package com.neuroassist.stroke.eligibility;

import com.neuroassist.stroke.model.StrokeType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EligibilityEvaluatorTest {

    private final EligibilityEvaluator evaluator = new EligibilityEvaluator();

    @Test
    void ischemicInsideWindowIsEligible() {
        assertThat(evaluator.eligible(StrokeType.ISCHEMIC, 0)).isTrue();
        assertThat(evaluator.eligible(StrokeType.ISCHEMIC, 269)).isTrue();
        assertThat(evaluator.eligible(StrokeType.ISCHEMIC, 269.99)).isTrue();
    }

    @Test
    void windowClosesAtExactly270Minutes() {
        assertThat(evaluator.eligible(StrokeType.ISCHEMIC, 270)).isFalse();
        assertThat(evaluator.eligible(StrokeType.ISCHEMIC, 600)).isFalse();
    }

    @Test
    void nonIschemicIsNeverEligible() {
        assertThat(evaluator.eligible(StrokeType.HEMORRHAGIC, 10)).isFalse();
        assertThat(evaluator.eligible(StrokeType.UNCERTAIN, 10)).isFalse();
    }
}
