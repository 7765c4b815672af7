package com.neuroassist.stroke.nodes;

import com.neuroassist.stroke.exception.ClassificationUnavailableException;
import com.neuroassist.stroke.imaging.ImageAnalysisCapability;
import com.neuroassist.stroke.imaging.ImageAnalysisVerdict;
import com.neuroassist.stroke.model.ClassificationOutcome.ImageClassification;
import com.neuroassist.stroke.model.PatientAssessment;
import com.neuroassist.stroke.state.AssessmentState;
import com.neuroassist.stroke.state.EngineStage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The only suspension point of an evaluation. The capability's verdict is taken as-is; a
 * timeout or failure ends the evaluation with {@link ClassificationUnavailableException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImageAnalysisNode implements AsyncNodeAction<AssessmentState> {

    private final ImageAnalysisCapability capability;

    @Override
    public CompletableFuture<Map<String, Object>> apply(AssessmentState state) {
        PatientAssessment assessment = state.getAssessment();
        Duration timeout = state.getImageTimeout();

        CompletableFuture<ImageAnalysisVerdict> call;
        try {
            call = capability.analyze(assessment.ctScanImage(), assessment);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        if (call == null) {
            call = CompletableFuture.failedFuture(new IllegalStateException("Image analysis returned no result"));
        }

        return call
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((verdict, error) -> {
                    if (error != null) {
                        throw new CompletionException(unavailable(error, timeout));
                    }
                    if (verdict == null || verdict.strokeType() == null || verdict.clarityBand() == null) {
                        throw new CompletionException(
                                new ClassificationUnavailableException("Image analysis returned an incomplete verdict: " + verdict));
                    }
                    log.debug("Image analysis verdict {} with {} clarity", verdict.strokeType(), verdict.clarityBand());
                    Map<String, Object> update = Map.of(
                            AssessmentState.OUTCOME, new ImageClassification(verdict.strokeType(), verdict.clarityBand()),
                            AssessmentState.STAGE, EngineStage.CLASSIFIED);
                    return update;
                });
    }

    private static ClassificationUnavailableException unavailable(Throwable error, Duration timeout) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof ClassificationUnavailableException unavailable) {
            return unavailable;
        }
        if (cause instanceof TimeoutException) {
            return new ClassificationUnavailableException("Image analysis timed out after " + timeout.toMillis() + " ms", cause);
        }
        return new ClassificationUnavailableException("Image analysis failed: " + cause.getMessage(), cause);
    }
}
