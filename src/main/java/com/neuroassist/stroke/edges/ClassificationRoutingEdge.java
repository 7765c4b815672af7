package com.neuroassist.stroke.edges;

import com.neuroassist.stroke.state.AssessmentState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Either/or choice of classification strategy: the image path whenever a CT image is present,
 * the Siriraj score otherwise. The two never both run.
 */
@Component
public class ClassificationRoutingEdge implements AsyncEdgeAction<AssessmentState> {

    public static final String IMAGE = "image";
    public static final String SCORE = "score";

    @Override
    public CompletableFuture<String> apply(AssessmentState state) {
        return CompletableFuture.completedFuture(state.getAssessment().hasCtScanImage() ? IMAGE : SCORE);
    }
}
