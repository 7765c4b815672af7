package com.neuroassist.stroke.nodes;

import com.neuroassist.stroke.model.ClassificationOutcome.ScoreClassification;
import com.neuroassist.stroke.scoring.ScoreInterpretation;
import com.neuroassist.stroke.scoring.ScoreInterpreter;
import com.neuroassist.stroke.scoring.SirirajScorer;
import com.neuroassist.stroke.state.AssessmentState;
import com.neuroassist.stroke.state.EngineStage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Slf4j
@Component
@RequiredArgsConstructor
public class SirirajScoreNode implements AsyncNodeAction<AssessmentState> {

    private final SirirajScorer scorer;
    private final ScoreInterpreter interpreter;

    @Override
    public CompletableFuture<Map<String, Object>> apply(AssessmentState state) {
        BigDecimal score = scorer.score(state.getAssessment());
        ScoreInterpretation interpretation = interpreter.interpret(score);
        log.debug("Siriraj score {} read as {} ({})", score, interpretation.strokeType(), interpretation.magnitudeBand());

        return CompletableFuture.completedFuture(Map.of(
                AssessmentState.OUTCOME, new ScoreClassification(score, interpretation.strokeType(), interpretation.magnitudeBand()),
                AssessmentState.STAGE, EngineStage.CLASSIFIED
        ));
    }
}
