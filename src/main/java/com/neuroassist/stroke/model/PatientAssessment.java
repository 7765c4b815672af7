package com.neuroassist.stroke.model;

import com.neuroassist.stroke.exception.ValidationException;
import lombok.Builder;

import java.io.Serializable;

/**
 * One bedside assessment, immutable once built.
 * <p>
 * {@code diastolicBloodPressure}, {@code levelOfConsciousness}, {@code vomiting} and
 * {@code headache} are nullable: they are only mandatory when no {@code ctScanImage} is
 * present, which {@link com.neuroassist.stroke.validation.AssessmentValidator} enforces.
 * {@code systolicBloodPressure} is always optional.
 * </p>
 */
@Builder(toBuilder = true)
public record PatientAssessment(
        double timeSinceOnsetMinutes,
        boolean faceDroop,
        boolean speechSlurred,
        ArmWeakness armWeakness,
        Double systolicBloodPressure,
        Double diastolicBloodPressure,
        boolean historyHypertension,
        boolean historyDiabetes,
        boolean historySmoking,
        LevelOfConsciousness levelOfConsciousness,
        Boolean vomiting,
        Boolean headache,
        CtScanImage ctScanImage
) implements Serializable {

    public PatientAssessment {
        requireNonNegative("timeSinceOnsetMinutes", timeSinceOnsetMinutes);
        if (armWeakness == null) {
            throw new ValidationException("armWeakness", "You need to select an arm weakness option.");
        }
        if (systolicBloodPressure != null) {
            requireNonNegative("systolicBloodPressure", systolicBloodPressure);
        }
        if (diastolicBloodPressure != null) {
            requireNonNegative("diastolicBloodPressure", diastolicBloodPressure);
        }
    }

    public boolean hasCtScanImage() {
        return ctScanImage != null;
    }

    /** Any of hypertension, diabetes or smoking in the history. */
    public boolean hasAtheromaRiskFactor() {
        return historyHypertension || historyDiabetes || historySmoking;
    }

    private static void requireNonNegative(String field, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
            throw new ValidationException(field, "'" + field + "' must be a non-negative number, got " + value);
        }
    }
}
