package com.neuroassist.stroke.validation;

import com.neuroassist.stroke.exception.MissingDataException;
import com.neuroassist.stroke.exception.ValidationException;
import com.neuroassist.stroke.model.ArmWeakness;
import com.neuroassist.stroke.model.CtScanImage;
import com.neuroassist.stroke.model.LevelOfConsciousness;
import com.neuroassist.stroke.model.PatientAssessment;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a raw patient-data record (as posted by the intake form) into a {@link PatientAssessment}.
 * <p>
 * Booleans default to {@code false} when omitted and {@code systolicBloodPressure} may stay
 * absent; nothing else is defaulted. Without a CT image the Siriraj inputs become mandatory and
 * their absence is a {@link MissingDataException}.
 * </p>
 */
@Component
public class AssessmentValidator {

    public static final String TIME_SINCE_ONSET = "timeSinceOnsetMinutes";
    public static final String FACE_DROOP = "faceDroop";
    public static final String SPEECH_SLURRED = "speechSlurred";
    public static final String ARM_WEAKNESS = "armWeakness";
    public static final String SYSTOLIC_BP = "systolicBloodPressure";
    public static final String DIASTOLIC_BP = "diastolicBloodPressure";
    public static final String HISTORY_HYPERTENSION = "historyHypertension";
    public static final String HISTORY_DIABETES = "historyDiabetes";
    public static final String HISTORY_SMOKING = "historySmoking";
    public static final String LEVEL_OF_CONSCIOUSNESS = "levelOfConsciousness";
    public static final String VOMITING = "vomiting";
    public static final String HEADACHE = "headache";
    public static final String CT_SCAN_IMAGE = "ctScanImage";

    private static final Pattern DATA_URI = Pattern.compile("^data:([\\w.+-]+/[\\w.+-]+);base64,(.*)$", Pattern.DOTALL);

    public PatientAssessment validate(Map<String, Object> raw) {
        if (raw == null) {
            throw new ValidationException(null, "Patient data record is missing");
        }
        CtScanImage image = readImage(raw.get(CT_SCAN_IMAGE));
        boolean sirirajInputsRequired = image == null;

        Double timeSinceOnset = readNumber(raw, TIME_SINCE_ONSET)
                .orElseThrow(() -> new ValidationException(TIME_SINCE_ONSET, "Time since onset is required."));
        ArmWeakness armWeakness = readLabel(raw, ARM_WEAKNESS, ArmWeakness::fromLabel)
                .orElseThrow(() -> new ValidationException(ARM_WEAKNESS, "You need to select an arm weakness option."));

        Double diastolic = readNumber(raw, DIASTOLIC_BP).orElse(null);
        LevelOfConsciousness loc = readLabel(raw, LEVEL_OF_CONSCIOUSNESS, LevelOfConsciousness::fromLabel).orElse(null);
        Boolean vomiting = readBoolean(raw, VOMITING).orElse(null);
        Boolean headache = readBoolean(raw, HEADACHE).orElse(null);

        PatientAssessment assessment = PatientAssessment.builder()
                .timeSinceOnsetMinutes(timeSinceOnset)
                .faceDroop(readBoolean(raw, FACE_DROOP).orElse(false))
                .speechSlurred(readBoolean(raw, SPEECH_SLURRED).orElse(false))
                .armWeakness(armWeakness)
                .systolicBloodPressure(readNumber(raw, SYSTOLIC_BP).orElse(null))
                .diastolicBloodPressure(diastolic)
                .historyHypertension(readBoolean(raw, HISTORY_HYPERTENSION).orElse(false))
                .historyDiabetes(readBoolean(raw, HISTORY_DIABETES).orElse(false))
                .historySmoking(readBoolean(raw, HISTORY_SMOKING).orElse(false))
                .levelOfConsciousness(loc)
                .vomiting(vomiting == null && !sirirajInputsRequired ? Boolean.FALSE : vomiting)
                .headache(headache == null && !sirirajInputsRequired ? Boolean.FALSE : headache)
                .ctScanImage(image)
                .build();
        return requireComplete(assessment);
    }

    /**
     * Checks the inputs the Siriraj score needs are present when no CT image was supplied.
     * Applied to every assessment entering the engine, including ones built in code.
     */
    public PatientAssessment requireComplete(PatientAssessment assessment) {
        if (assessment == null) {
            throw new ValidationException(null, "Patient assessment is missing");
        }
        if (assessment.hasCtScanImage()) {
            return assessment;
        }
        if (assessment.diastolicBloodPressure() == null) {
            throw new MissingDataException(DIASTOLIC_BP);
        }
        if (assessment.levelOfConsciousness() == null) {
            throw new MissingDataException(LEVEL_OF_CONSCIOUSNESS);
        }
        if (assessment.vomiting() == null) {
            throw new MissingDataException(VOMITING);
        }
        if (assessment.headache() == null) {
            throw new MissingDataException(HEADACHE);
        }
        return assessment;
    }

    private Optional<Double> readNumber(Map<String, Object> raw, String field) {
        Object value = raw.get(field);
        if (isAbsent(value)) {
            return Optional.empty();
        }
        double number;
        if (value instanceof Number n) {
            number = n.doubleValue();
        } else if (value instanceof String s) {
            try {
                number = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new ValidationException(field, "Please enter a valid number for '" + field + "'.");
            }
        } else {
            throw new ValidationException(field, "Please enter a valid number for '" + field + "'.");
        }
        if (Double.isNaN(number) || Double.isInfinite(number) || number < 0) {
            throw new ValidationException(field, "'" + field + "' must be a non-negative number.");
        }
        return Optional.of(number);
    }

    private Optional<Boolean> readBoolean(Map<String, Object> raw, String field) {
        Object value = raw.get(field);
        if (isAbsent(value)) {
            return Optional.empty();
        }
        if (value instanceof Boolean b) {
            return Optional.of(b);
        }
        if (value instanceof String s) {
            if ("true".equalsIgnoreCase(s.trim())) {
                return Optional.of(Boolean.TRUE);
            }
            if ("false".equalsIgnoreCase(s.trim())) {
                return Optional.of(Boolean.FALSE);
            }
        }
        throw new ValidationException(field, "'" + field + "' must be true or false.");
    }

    private <E extends Enum<E>> Optional<E> readLabel(Map<String, Object> raw, String field,
                                                       Function<String, Optional<E>> lookup) {
        Object value = raw.get(field);
        if (isAbsent(value)) {
            return Optional.empty();
        }
        Optional<E> parsed = lookup.apply(value.toString().trim());
        if (parsed.isEmpty()) {
            throw new ValidationException(field, "'" + value + "' is not a valid value for '" + field + "'.");
        }
        return parsed;
    }

    private CtScanImage readImage(Object value) {
        if (isAbsent(value)) {
            return null;
        }
        if (value instanceof CtScanImage image) {
            return image;
        }
        String reference = value.toString().trim();
        Matcher dataUri = DATA_URI.matcher(reference);
        if (dataUri.matches()) {
            byte[] bytes;
            try {
                bytes = Base64.getMimeDecoder().decode(dataUri.group(2));
            } catch (IllegalArgumentException e) {
                throw new ValidationException(CT_SCAN_IMAGE, "CT scan image is not valid base64 data.");
            }
            return CtScanImage.inline(bytes, dataUri.group(1));
        }
        try {
            return CtScanImage.remote(URI.create(reference));
        } catch (IllegalArgumentException e) {
            throw new ValidationException(CT_SCAN_IMAGE, "CT scan image must be a data URI or an http(s) URL.");
        }
    }

    private static boolean isAbsent(Object value) {
        return value == null || (value instanceof String s && s.isBlank());
    }
}
