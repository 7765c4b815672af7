package com.neuroassist.stroke.nodes;

import com.neuroassist.stroke.calibration.ConfidenceCalibrator;
import com.neuroassist.stroke.state.AssessmentState;
import com.neuroassist.stroke.state.EngineStage;
import lombok.RequiredArgsConstructor;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
@RequiredArgsConstructor
public class CalibrateConfidenceNode implements AsyncNodeAction<AssessmentState> {

    private final ConfidenceCalibrator calibrator;

    @Override
    public CompletableFuture<Map<String, Object>> apply(AssessmentState state) {
        return CompletableFuture.completedFuture(Map.of(
                AssessmentState.CONFIDENCE, calibrator.calibrate(state.getOutcome()),
                AssessmentState.STAGE, EngineStage.CALIBRATED
        ));
    }
}
