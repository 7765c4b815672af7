package com.neuroassist.stroke.config;

import com.neuroassist.stroke.protocol.ProtocolTextSelector;
import com.neuroassist.stroke.state.AssessmentState;
import com.neuroassist.stroke.validation.AssessmentValidator;
import com.neuroassist.stroke.workflow.DiagnosisEngine;
import org.bsc.langgraph4j.CompiledGraph;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfig {

    @Bean
    public ProtocolTextSelector protocolTextSelector(NeuroAssistProperties properties) {
        return new ProtocolTextSelector(properties.getThrombolytic().resolve());
    }

    @Bean
    public DiagnosisEngine diagnosisEngine(CompiledGraph<AssessmentState> strokeAssessmentWorkflow,
                                           AssessmentValidator validator,
                                           NeuroAssistProperties properties) {
        return new DiagnosisEngine(strokeAssessmentWorkflow, validator, properties.getImageAnalysis().getTimeout());
    }
}
