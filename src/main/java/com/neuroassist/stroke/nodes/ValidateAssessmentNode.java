package com.neuroassist.stroke.nodes;

import com.neuroassist.stroke.exception.ValidationException;
import com.neuroassist.stroke.state.AssessmentState;
import com.neuroassist.stroke.state.EngineStage;
import com.neuroassist.stroke.validation.AssessmentValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Slf4j
@Component
@RequiredArgsConstructor
public class ValidateAssessmentNode implements AsyncNodeAction<AssessmentState> {

    private final AssessmentValidator validator;

    @Override
    public CompletableFuture<Map<String, Object>> apply(AssessmentState state) {
        try {
            validator.requireComplete(state.getAssessment());
        } catch (ValidationException e) {
            return CompletableFuture.failedFuture(e);
        }
        log.debug("Assessment validated, CT image present: {}", state.getAssessment().hasCtScanImage());
        return CompletableFuture.completedFuture(Map.of(AssessmentState.STAGE, EngineStage.VALIDATED));
    }
}
