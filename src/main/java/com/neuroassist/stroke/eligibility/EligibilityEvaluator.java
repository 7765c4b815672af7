package com.neuroassist.stroke.eligibility;

import com.neuroassist.stroke.model.StrokeType;
import org.springframework.stereotype.Component;

/**
 * Thrombolysis is offered only for an ischemic stroke strictly inside the 270-minute (4.5 h)
 * window. Blood pressure and history play no part in this decision.
 */
@Component
public class EligibilityEvaluator {

    public static final double TREATMENT_WINDOW_MINUTES = 270;

    public boolean eligible(StrokeType strokeType, double timeSinceOnsetMinutes) {
        return strokeType == StrokeType.ISCHEMIC && timeSinceOnsetMinutes < TREATMENT_WINDOW_MINUTES;
    }
}
