package com.neuroassist.stroke.nodes;

import com.neuroassist.stroke.model.ClassificationOutcome;
import com.neuroassist.stroke.model.DiagnosisResult;
import com.neuroassist.stroke.protocol.ProtocolTextSelector;
import com.neuroassist.stroke.state.AssessmentState;
import com.neuroassist.stroke.state.EngineStage;
import lombok.RequiredArgsConstructor;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Last step: picks the protocol text and assembles the {@link DiagnosisResult}.
 */
@Component
@RequiredArgsConstructor
public class ProtocolSelectionNode implements AsyncNodeAction<AssessmentState> {

    private final ProtocolTextSelector selector;

    @Override
    public CompletableFuture<Map<String, Object>> apply(AssessmentState state) {
        ClassificationOutcome outcome = state.getOutcome();
        boolean eligible = state.isThrombolyticEligible();

        DiagnosisResult result = new DiagnosisResult(
                outcome.strokeType(),
                state.getConfidence(),
                eligible,
                outcome.methodUsed(),
                selector.selectProtocol(outcome.strokeType(), eligible));

        return CompletableFuture.completedFuture(Map.of(
                AssessmentState.DIAGNOSIS, result,
                AssessmentState.STAGE, EngineStage.DONE
        ));
    }
}
