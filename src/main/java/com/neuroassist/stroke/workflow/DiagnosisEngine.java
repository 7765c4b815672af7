package com.neuroassist.stroke.workflow;

import com.neuroassist.stroke.exception.ClassificationUnavailableException;
import com.neuroassist.stroke.exception.StrokeAssessmentException;
import com.neuroassist.stroke.exception.ValidationException;
import com.neuroassist.stroke.model.DiagnosisResult;
import com.neuroassist.stroke.model.PatientAssessment;
import com.neuroassist.stroke.state.AssessmentState;
import com.neuroassist.stroke.state.EngineStage;
import com.neuroassist.stroke.validation.AssessmentValidator;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point for evaluating stroke assessments.
 * <p>
 * A facade over the compiled {@link StrokeWorkflowGraph}: it tags each evaluation with an
 * assessment id (thread id for the graph, {@code assessmentId} in the MDC), runs the graph
 * to completion and hands back the {@link DiagnosisResult}.
 * </p>
 *
 * <h3>Failures</h3>
 * <ul>
 * <li>{@link ValidationException} (and its {@code MissingDataException} subtype) before any
 * classification work.</li>
 * <li>{@link ClassificationUnavailableException} when the image capability fails or exceeds
 * the timeout. No Siriraj fallback is attempted.</li>
 * <li>{@code ConfigurationException} when the thrombolytic regime is unusable.</li>
 * </ul>
 * The engine keeps no state between calls and may be shared by any number of threads.
 */
@Log4j2
public class DiagnosisEngine {

    public static final String ASSESSMENT_ID = "assessmentId";

    private final CompiledGraph<AssessmentState> workflow;
    private final AssessmentValidator validator;
    private final Duration defaultImageTimeout;

    public DiagnosisEngine(CompiledGraph<AssessmentState> workflow,
                           AssessmentValidator validator,
                           Duration defaultImageTimeout) {
        this.workflow = workflow;
        this.validator = validator;
        this.defaultImageTimeout = requirePositive(defaultImageTimeout);
    }

    /**
     * Validates a raw patient-data record and evaluates it with the default image timeout.
     */
    public DiagnosisResult evaluate(Map<String, Object> raw) {
        PatientAssessment assessment;
        try {
            assessment = validator.validate(raw);
        } catch (ValidationException e) {
            log.warn("Assessment {}: {} on '{}': {}", EngineStage.REJECTED, e.kind(), e.getField(), e.getMessage());
            throw e;
        }
        return evaluate(assessment, defaultImageTimeout);
    }

    public DiagnosisResult evaluate(PatientAssessment assessment) {
        return evaluate(assessment, defaultImageTimeout);
    }

    /**
     * @param imageTimeout upper bound on the image-analysis call; unused on the Siriraj path
     */
    public DiagnosisResult evaluate(PatientAssessment assessment, Duration imageTimeout) {
        if (assessment == null) {
            throw new ValidationException(null, "Patient assessment is missing");
        }
        requirePositive(imageTimeout);

        String assessmentId = UUID.randomUUID().toString();
        MDC.put(ASSESSMENT_ID, assessmentId);
        try {
            log.info("Evaluating assessment {} (CT image: {})", assessmentId, assessment.hasCtScanImage());

            RunnableConfig config = RunnableConfig.builder()
                    .threadId(assessmentId)
                    .build();

            AssessmentState finalState;
            try {
                finalState = workflow.invoke(AssessmentState.initial(assessment, imageTimeout), config)
                        .orElseThrow(() -> new IllegalStateException("Workflow returned no state for " + assessmentId));
            } catch (RuntimeException e) {
                StrokeAssessmentException failure = StrokeAssessmentException.findIn(e).orElseThrow(() -> e);
                log.warn("Assessment {} {}: {} - {}", assessmentId, terminalStage(failure), failure.kind(), failure.getMessage());
                throw failure;
            }

            if (finalState.getStage() != EngineStage.DONE) {
                throw new IllegalStateException("Workflow for " + assessmentId + " ended at stage " + finalState.getStage());
            }
            DiagnosisResult result = finalState.getDiagnosis();
            log.info("Assessment {} done: {} via {}, confidence {}, thrombolytic eligible {}",
                    assessmentId, result.strokeType(), result.methodUsed(), result.confidence(), result.thrombolyticEligible());
            return result;
        } finally {
            MDC.remove(ASSESSMENT_ID);
        }
    }

    public Duration defaultImageTimeout() {
        return defaultImageTimeout;
    }

    private static EngineStage terminalStage(StrokeAssessmentException failure) {
        return failure instanceof ValidationException ? EngineStage.REJECTED : EngineStage.FAILED;
    }

    private static Duration requirePositive(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Image analysis timeout must be positive, got " + timeout);
        }
        return timeout;
    }
}
