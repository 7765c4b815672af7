package com.neuroassist.stroke.nodes;

import com.neuroassist.stroke.eligibility.EligibilityEvaluator;
import com.neuroassist.stroke.state.AssessmentState;
import com.neuroassist.stroke.state.EngineStage;
import lombok.RequiredArgsConstructor;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
@RequiredArgsConstructor
public class EligibilityNode implements AsyncNodeAction<AssessmentState> {

    private final EligibilityEvaluator evaluator;

    @Override
    public CompletableFuture<Map<String, Object>> apply(AssessmentState state) {
        boolean eligible = evaluator.eligible(
                state.getOutcome().strokeType(),
                state.getAssessment().timeSinceOnsetMinutes());

        return CompletableFuture.completedFuture(Map.of(
                AssessmentState.ELIGIBLE, eligible,
                AssessmentState.STAGE, EngineStage.ELIGIBILITY_DETERMINED
        ));
    }
}
