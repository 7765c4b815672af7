package com.neuroassist.stroke.workflow;

import com.neuroassist.stroke.TestAssessments;
import com.neuroassist.stroke.calibration.ConfidenceCalibrator;
import com.neuroassist.stroke.edges.ClassificationRoutingEdge;
import com.neuroassist.stroke.eligibility.EligibilityEvaluator;
import com.neuroassist.stroke.exception.ClassificationUnavailableException;
import com.neuroassist.stroke.exception.MissingDataException;
import com.neuroassist.stroke.exception.ValidationException;
import com.neuroassist.stroke.imaging.ImageAnalysisCapability;
import com.neuroassist.stroke.imaging.ImageAnalysisVerdict;
import com.neuroassist.stroke.imaging.UnavailableImageAnalysisCapability;
import com.neuroassist.stroke.model.ClarityBand;
import com.neuroassist.stroke.model.DiagnosisResult;
import com.neuroassist.stroke.model.MethodUsed;
import com.neuroassist.stroke.model.PatientAssessment;
import com.neuroassist.stroke.model.StrokeType;
import com.neuroassist.stroke.nodes.CalibrateConfidenceNode;
import com.neuroassist.stroke.nodes.EligibilityNode;
import com.neuroassist.stroke.nodes.ImageAnalysisNode;
import com.neuroassist.stroke.nodes.ProtocolSelectionNode;
import com.neuroassist.stroke.nodes.SirirajScoreNode;
import com.neuroassist.stroke.nodes.ValidateAssessmentNode;
import com.neuroassist.stroke.protocol.ProtocolTextSelector;
import com.neuroassist.stroke.protocol.ThrombolyticAgentConfig;
import com.neuroassist.stroke.scoring.ScoreInterpreter;
import com.neuroassist.stroke.scoring.SirirajScorer;
import com.neuroassist.stroke.validation.AssessmentValidator;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiagnosisEngineTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final ProtocolTextSelector protocols = new ProtocolTextSelector(ThrombolyticAgentConfig.ALTEPLASE);

    private DiagnosisEngine engineWith(ImageAnalysisCapability capability) {
        AssessmentValidator validator = new AssessmentValidator();
        try {
            CompiledGraph<com.neuroassist.stroke.state.AssessmentState> graph = new StrokeWorkflowGraph(
                    new ValidateAssessmentNode(validator),
                    new ImageAnalysisNode(capability),
                    new SirirajScoreNode(new SirirajScorer(), new ScoreInterpreter()),
                    new CalibrateConfidenceNode(new ConfidenceCalibrator()),
                    new EligibilityNode(new EligibilityEvaluator()),
                    new ProtocolSelectionNode(protocols),
                    new ClassificationRoutingEdge()
            ).build();
            return new DiagnosisEngine(graph, validator, TIMEOUT);
        } catch (GraphStateException e) {
            throw new IllegalStateException(e);
        }
    }

    private static ImageAnalysisCapability answering(StrokeType type, ClarityBand clarity) {
        return (image, context) -> CompletableFuture.completedFuture(new ImageAnalysisVerdict(type, clarity));
    }

    private static ImageAnalysisCapability mustNotBeCalled() {
        return (image, context) -> {
            throw new AssertionError("image analysis must not run for this assessment");
        };
    }

    // =========================================================================
    //  Siriraj path
    // =========================================================================

    @Nested
    @DisplayName("Siriraj path")
    class SirirajPath {

        private final DiagnosisEngine engine = engineWith(mustNotBeCalled());

        @Test
        void strongPositiveScoreIsHemorrhagic() {
            DiagnosisResult result = engine.evaluate(TestAssessments.hemorrhagicBySiriraj());

            assertThat(result.strokeType()).isEqualTo(StrokeType.HEMORRHAGIC);
            assertThat(result.methodUsed()).isEqualTo(MethodUsed.SIRIRAJ_SCORE);
            assertThat(result.confidence()).isEqualTo(0.90);
            assertThat(result.thrombolyticEligible()).isFalse();
            assertThat(result.actionProtocol()).isEqualTo(protocols.selectProtocol(StrokeType.HEMORRHAGIC, false));
        }

        @Test
        void ischemicInsideTheWindowIsEligible() {
            DiagnosisResult result = engine.evaluate(TestAssessments.ischemicBySiriraj(269));

            assertThat(result.strokeType()).isEqualTo(StrokeType.ISCHEMIC);
            assertThat(result.confidence()).isEqualTo(0.90);
            assertThat(result.thrombolyticEligible()).isTrue();
            assertThat(result.actionProtocol()).isEqualTo(protocols.selectProtocol(StrokeType.ISCHEMIC, true));
        }

        @Test
        void ischemicAtTheWindowEdgeIsNotEligible() {
            DiagnosisResult result = engine.evaluate(TestAssessments.ischemicBySiriraj(270));

            assertThat(result.strokeType()).isEqualTo(StrokeType.ISCHEMIC);
            assertThat(result.thrombolyticEligible()).isFalse();
            assertThat(result.actionProtocol()).isEqualTo(protocols.selectProtocol(StrokeType.ISCHEMIC, false));
        }

        @Test
        void scoreOfExactlyOneIsUncertainWithWeakConfidence() {
            DiagnosisResult result = engine.evaluate(TestAssessments.uncertainBySiriraj());

            assertThat(result.strokeType()).isEqualTo(StrokeType.UNCERTAIN);
            assertThat(result.confidence()).isEqualTo(0.495);
            assertThat(result.thrombolyticEligible()).isFalse();
            assertThat(result.actionProtocol()).isEqualTo(protocols.selectProtocol(StrokeType.UNCERTAIN, false));
        }

        @Test
        void rawRecordIsValidatedThenEvaluated() {
            Map<String, Object> raw = new HashMap<>();
            raw.put("timeSinceOnsetMinutes", "100");
            raw.put("armWeakness", "Right");
            raw.put("diastolicBloodPressure", 80);
            raw.put("levelOfConsciousness", "Conscious");
            raw.put("vomiting", false);
            raw.put("headache", false);

            assertThat(engine.evaluate(raw)).isEqualTo(engine.evaluate(TestAssessments.ischemicBySiriraj(100)
                    .toBuilder().faceDroop(false).build()));
        }

        @Test
        void repeatedEvaluationIsIdentical() {
            PatientAssessment assessment = TestAssessments.hemorrhagicBySiriraj();

            assertThat(engine.evaluate(assessment)).isEqualTo(engine.evaluate(assessment));
        }
    }

    // =========================================================================
    //  Image path
    // =========================================================================

    @Nested
    @DisplayName("image path")
    class ImagePath {

        @Test
        void imageVerdictIsUsedAsIs() {
            DiagnosisResult result = engineWith(answering(StrokeType.ISCHEMIC, ClarityBand.HIGH))
                    .evaluate(TestAssessments.withCtImage(120));

            assertThat(result.strokeType()).isEqualTo(StrokeType.ISCHEMIC);
            assertThat(result.methodUsed()).isEqualTo(MethodUsed.IMAGE_ANALYSIS);
            assertThat(result.confidence()).isEqualTo(0.90);
            assertThat(result.thrombolyticEligible()).isTrue();
        }

        @Test
        void imageVerdictOverridesContradictingSirirajInputs() {
            PatientAssessment assessment = TestAssessments.hemorrhagicBySiriraj().toBuilder()
                    .ctScanImage(TestAssessments.withCtImage(90).ctScanImage())
                    .build();

            DiagnosisResult result = engineWith(answering(StrokeType.ISCHEMIC, ClarityBand.MEDIUM)).evaluate(assessment);

            assertThat(result.strokeType()).isEqualTo(StrokeType.ISCHEMIC);
            assertThat(result.methodUsed()).isEqualTo(MethodUsed.IMAGE_ANALYSIS);
            assertThat(result.confidence()).isEqualTo(0.645);
        }

        @Test
        void lowClarityUncertainVerdict() {
            DiagnosisResult result = engineWith(answering(StrokeType.UNCERTAIN, ClarityBand.LOW))
                    .evaluate(TestAssessments.withCtImage(30));

            assertThat(result.strokeType()).isEqualTo(StrokeType.UNCERTAIN);
            assertThat(result.confidence()).isEqualTo(0.25);
            assertThat(result.thrombolyticEligible()).isFalse();
        }

        @Test
        void sirirajInputsAreNotRequiredWithAnImage() {
            AtomicInteger calls = new AtomicInteger();
            ImageAnalysisCapability counting = (image, context) -> {
                calls.incrementAndGet();
                return CompletableFuture.completedFuture(new ImageAnalysisVerdict(StrokeType.HEMORRHAGIC, ClarityBand.HIGH));
            };

            DiagnosisResult result = engineWith(counting).evaluate(TestAssessments.withCtImage(30));

            assertThat(result.strokeType()).isEqualTo(StrokeType.HEMORRHAGIC);
            assertThat(calls).hasValue(1);
        }
    }

    // =========================================================================
    //  Failures
    // =========================================================================

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        void capabilityThatNeverAnswersTimesOut() {
            DiagnosisEngine engine = engineWith((image, context) -> new CompletableFuture<>());

            assertThatThrownBy(() -> engine.evaluate(TestAssessments.withCtImage(60), Duration.ofMillis(50)))
                    .isInstanceOf(ClassificationUnavailableException.class)
                    .hasMessageContaining("timed out")
                    .hasCauseInstanceOf(TimeoutException.class);
        }

        @Test
        void failedFutureIsClassificationUnavailable() {
            DiagnosisEngine engine = engineWith((image, context) ->
                    CompletableFuture.failedFuture(new IllegalStateException("model overloaded")));

            assertThatThrownBy(() -> engine.evaluate(TestAssessments.withCtImage(60)))
                    .isInstanceOf(ClassificationUnavailableException.class)
                    .hasMessageContaining("model overloaded");
        }

        @Test
        void synchronousThrowIsClassificationUnavailable() {
            DiagnosisEngine engine = engineWith((image, context) -> {
                throw new IllegalArgumentException("bad image");
            });

            assertThatThrownBy(() -> engine.evaluate(TestAssessments.withCtImage(60)))
                    .isInstanceOf(ClassificationUnavailableException.class)
                    .hasMessageContaining("bad image");
        }

        @Test
        void missingCapabilityIsClassificationUnavailable() {
            DiagnosisEngine engine = engineWith(new UnavailableImageAnalysisCapability());

            assertThatThrownBy(() -> engine.evaluate(TestAssessments.withCtImage(60)))
                    .isInstanceOf(ClassificationUnavailableException.class)
                    .hasMessage("No image-analysis capability is configured");
        }

        @Test
        void missingSirirajInputIsRejectedBeforeClassification() {
            DiagnosisEngine engine = engineWith(mustNotBeCalled());
            PatientAssessment incomplete = TestAssessments.ischemicBySiriraj(60).toBuilder().headache(null).build();

            assertThatThrownBy(() -> engine.evaluate(incomplete))
                    .isInstanceOf(MissingDataException.class)
                    .hasMessageContaining("headache");
        }

        @Test
        void invalidRawRecordIsRejected() {
            DiagnosisEngine engine = engineWith(mustNotBeCalled());

            assertThatThrownBy(() -> engine.evaluate(Map.of("armWeakness", "Left")))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        void nonPositiveTimeoutIsRefused() {
            DiagnosisEngine engine = engineWith(mustNotBeCalled());

            assertThatThrownBy(() -> engine.evaluate(TestAssessments.withCtImage(60), Duration.ZERO))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    // =========================================================================
    //  Engine-wide properties
    // =========================================================================

    @Test
    void everyResultKeepsEligibilityConsistentWithTypeAndWindow() {
        DiagnosisEngine engine = engineWith(answering(StrokeType.ISCHEMIC, ClarityBand.LOW));
        List<PatientAssessment> assessments = new ArrayList<>();
        for (int minutes = 0; minutes <= 600; minutes += 45) {
            assessments.add(TestAssessments.ischemicBySiriraj(minutes));
            assessments.add(TestAssessments.hemorrhagicBySiriraj().toBuilder().timeSinceOnsetMinutes(minutes).build());
            assessments.add(TestAssessments.uncertainBySiriraj().toBuilder().timeSinceOnsetMinutes(minutes).build());
            assessments.add(TestAssessments.withCtImage(minutes));
        }

        for (PatientAssessment assessment : assessments) {
            DiagnosisResult result = engine.evaluate(assessment);

            assertThat(result.confidence()).isBetween(0.0, 1.0);
            assertThat(result.thrombolyticEligible()).isEqualTo(
                    result.strokeType() == StrokeType.ISCHEMIC && assessment.timeSinceOnsetMinutes() < 270);
            assertThat(result.methodUsed()).isEqualTo(
                    assessment.hasCtScanImage() ? MethodUsed.IMAGE_ANALYSIS : MethodUsed.SIRIRAJ_SCORE);
            assertThat(result.actionProtocol())
                    .isEqualTo(protocols.selectProtocol(result.strokeType(), result.thrombolyticEligible()));
        }
    }

    @Test
    void concurrentEvaluationsDoNotInterfere() throws Exception {
        DiagnosisEngine engine = engineWith(answering(StrokeType.HEMORRHAGIC, ClarityBand.MEDIUM));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<DiagnosisResult>> sirirajRuns = new ArrayList<>();
            List<Future<DiagnosisResult>> imageRuns = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                sirirajRuns.add(pool.submit(() -> engine.evaluate(TestAssessments.ischemicBySiriraj(100))));
                imageRuns.add(pool.submit(() -> engine.evaluate(TestAssessments.withCtImage(100))));
            }

            for (Future<DiagnosisResult> run : sirirajRuns) {
                assertThat(run.get().strokeType()).isEqualTo(StrokeType.ISCHEMIC);
                assertThat(run.get().thrombolyticEligible()).isTrue();
            }
            for (Future<DiagnosisResult> run : imageRuns) {
                assertThat(run.get().strokeType()).isEqualTo(StrokeType.HEMORRHAGIC);
                assertThat(run.get().confidence()).isEqualTo(0.645);
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
