package com.neuroassist.stroke.workflow;

import com.neuroassist.stroke.edges.ClassificationRoutingEdge;
import com.neuroassist.stroke.nodes.CalibrateConfidenceNode;
import com.neuroassist.stroke.nodes.EligibilityNode;
import com.neuroassist.stroke.nodes.ImageAnalysisNode;
import com.neuroassist.stroke.nodes.ProtocolSelectionNode;
import com.neuroassist.stroke.nodes.SirirajScoreNode;
import com.neuroassist.stroke.nodes.ValidateAssessmentNode;
import com.neuroassist.stroke.state.AssessmentState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * Wires the evaluation pipeline:
 * <pre>
 * START -> validate -> (image present?) -> image_analysis | siriraj_score
 *       -> calibrate -> eligibility -> protocol -> END
 * </pre>
 * Compiled without a checkpoint saver: nothing about an evaluation outlives it.
 */
@Component
public class StrokeWorkflowGraph {

    public static final String VALIDATE = "validate";
    public static final String IMAGE_ANALYSIS = "image_analysis";
    public static final String SIRIRAJ_SCORE = "siriraj_score";
    public static final String CALIBRATE = "calibrate";
    public static final String ELIGIBILITY = "eligibility";
    public static final String PROTOCOL = "protocol";

    private final ValidateAssessmentNode validateNode;
    private final ImageAnalysisNode imageAnalysisNode;
    private final SirirajScoreNode sirirajScoreNode;
    private final CalibrateConfidenceNode calibrateNode;
    private final EligibilityNode eligibilityNode;
    private final ProtocolSelectionNode protocolNode;
    private final ClassificationRoutingEdge routingEdge;

    public StrokeWorkflowGraph(
            ValidateAssessmentNode validateNode,
            ImageAnalysisNode imageAnalysisNode,
            SirirajScoreNode sirirajScoreNode,
            CalibrateConfidenceNode calibrateNode,
            EligibilityNode eligibilityNode,
            ProtocolSelectionNode protocolNode,
            ClassificationRoutingEdge routingEdge) {
        this.validateNode = validateNode;
        this.imageAnalysisNode = imageAnalysisNode;
        this.sirirajScoreNode = sirirajScoreNode;
        this.calibrateNode = calibrateNode;
        this.eligibilityNode = eligibilityNode;
        this.protocolNode = protocolNode;
        this.routingEdge = routingEdge;
    }

    @Bean("strokeAssessmentWorkflow")
    public CompiledGraph<AssessmentState> build() throws GraphStateException {

        StateGraph<AssessmentState> workflow = new StateGraph<>(AssessmentState::new);

        workflow.addNode(VALIDATE, validateNode);
        workflow.addNode(IMAGE_ANALYSIS, imageAnalysisNode);
        workflow.addNode(SIRIRAJ_SCORE, sirirajScoreNode);
        workflow.addNode(CALIBRATE, calibrateNode);
        workflow.addNode(ELIGIBILITY, eligibilityNode);
        workflow.addNode(PROTOCOL, protocolNode);

        workflow.addEdge(START, VALIDATE);

        workflow.addConditionalEdges(
                VALIDATE,
                routingEdge,
                Map.of(
                        ClassificationRoutingEdge.IMAGE, IMAGE_ANALYSIS,
                        ClassificationRoutingEdge.SCORE, SIRIRAJ_SCORE
                )
        );

        workflow.addEdge(IMAGE_ANALYSIS, CALIBRATE);
        workflow.addEdge(SIRIRAJ_SCORE, CALIBRATE);
        workflow.addEdge(CALIBRATE, ELIGIBILITY);
        workflow.addEdge(ELIGIBILITY, PROTOCOL);
        workflow.addEdge(PROTOCOL, END);

        return workflow.compile();
    }
}
