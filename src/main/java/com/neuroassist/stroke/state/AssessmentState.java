package com.neuroassist.stroke.state;

import com.neuroassist.stroke.model.ClassificationOutcome;
import com.neuroassist.stroke.model.DiagnosisResult;
import com.neuroassist.stroke.model.PatientAssessment;
import org.bsc.langgraph4j.state.AgentState;

import java.time.Duration;
import java.util.Map;

public class AssessmentState extends AgentState {

    public static final String ASSESSMENT = "assessment";
    public static final String IMAGE_TIMEOUT = "imageTimeout";
    public static final String STAGE = "stage";
    public static final String OUTCOME = "outcome";
    public static final String CONFIDENCE = "confidence";
    public static final String ELIGIBLE = "thrombolyticEligible";
    public static final String DIAGNOSIS = "diagnosis";

    public AssessmentState(Map<String, Object> initData) {
        super(initData);
    }

    public PatientAssessment getAssessment() { return (PatientAssessment) this.data().get(ASSESSMENT); }
    public Duration getImageTimeout() { return (Duration) this.data().get(IMAGE_TIMEOUT); }
    public EngineStage getStage() { return (EngineStage) this.data().get(STAGE); }
    public ClassificationOutcome getOutcome() { return (ClassificationOutcome) this.data().get(OUTCOME); }
    public double getConfidence() { return (Double) this.data().get(CONFIDENCE); }
    public boolean isThrombolyticEligible() { return (Boolean) this.data().get(ELIGIBLE); }
    public DiagnosisResult getDiagnosis() { return (DiagnosisResult) this.data().get(DIAGNOSIS); }

    public static Map<String, Object> initial(PatientAssessment assessment, Duration imageTimeout) {
        return Map.of(
                ASSESSMENT, assessment,
                IMAGE_TIMEOUT, imageTimeout,
                STAGE, EngineStage.INTAKE
        );
    }
}
