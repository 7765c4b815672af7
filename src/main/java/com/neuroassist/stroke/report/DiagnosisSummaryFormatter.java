package com.neuroassist.stroke.report;

import com.neuroassist.stroke.model.DiagnosisResult;
import org.springframework.stereotype.Component;

/**
 * Plain-text summary of a diagnosis for sharing or copying into notes.
 */
@Component
public class DiagnosisSummaryFormatter {

    public String format(DiagnosisResult result) {
        long confidencePercent = Math.round(result.confidence() * 100);
        return "NeuroAssist Stroke Diagnosis Summary:\n\n"
                + "- Predicted Stroke Type: " + result.strokeType().label() + "\n"
                + "- Confidence: " + confidencePercent + "%\n"
                + "- Method: " + result.methodUsed().label() + "\n"
                + "- tPA Eligible: " + (result.thrombolyticEligible() ? "Yes" : "No") + "\n"
                + "- Recommended Action:\n" + result.actionProtocol();
    }
}
