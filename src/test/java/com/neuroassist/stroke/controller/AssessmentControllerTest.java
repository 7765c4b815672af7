package com.neuroassist.stroke.controller;

import com.neuroassist.stroke.exception.ClassificationUnavailableException;
import com.neuroassist.stroke.exception.ConfigurationException;
import com.neuroassist.stroke.exception.MissingDataException;
import com.neuroassist.stroke.model.DiagnosisResult;
import com.neuroassist.stroke.model.MethodUsed;
import com.neuroassist.stroke.model.StrokeType;
import com.neuroassist.stroke.protocol.ProtocolTextSelector;
import com.neuroassist.stroke.protocol.ThrombolyticAgentConfig;
import com.neuroassist.stroke.report.DiagnosisSummaryFormatter;
import com.neuroassist.stroke.workflow.DiagnosisEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Map;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AssessmentControllerTest {

    private static final String BODY = """
            {"timeSinceOnsetMinutes": 90, "armWeakness": "Left", "diastolicBloodPressure": 100,
             "levelOfConsciousness": "Comatose", "vomiting": true, "headache": true, "historyHypertension": true}
            """;

    @Mock
    private DiagnosisEngine engine;

    private final ProtocolTextSelector protocols = new ProtocolTextSelector(ThrombolyticAgentConfig.ALTEPLASE);

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        AssessmentController controller = new AssessmentController(engine, new DiagnosisSummaryFormatter(), protocols);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new AssessmentExceptionHandler())
                .build();
    }

    private DiagnosisResult hemorrhagic() {
        return new DiagnosisResult(StrokeType.HEMORRHAGIC, 0.90, false, MethodUsed.SIRIRAJ_SCORE,
                protocols.selectProtocol(StrokeType.HEMORRHAGIC, false));
    }

    @Test
    void returnsDiagnosisAsJson() throws Exception {
        when(engine.evaluate(anyMap())).thenReturn(hemorrhagic());

        mockMvc.perform(post("/assessments").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.strokeType").value("Hemorrhagic"))
                .andExpect(jsonPath("$.confidence").value(0.90))
                .andExpect(jsonPath("$.thrombolyticEligible").value(false))
                .andExpect(jsonPath("$.methodUsed").value("SirirajScore"))
                .andExpect(jsonPath("$.actionProtocol", startsWith("SUSPECTED HEMORRHAGIC STROKE")));
    }

    @Test
    void returnsPlainTextSummary() throws Exception {
        when(engine.evaluate(anyMap())).thenReturn(hemorrhagic());

        mockMvc.perform(post("/assessments/summary").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(content().string(startsWith(
                        "NeuroAssist Stroke Diagnosis Summary:\n\n- Predicted Stroke Type: Hemorrhagic\n- Confidence: 90%")));
    }

    @Test
    void listsCanonicalProtocols() throws Exception {
        mockMvc.perform(get("/assessments/protocols"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.Hemorrhagic").value(protocols.selectProtocol(StrokeType.HEMORRHAGIC, false)))
                .andExpect(jsonPath("$.IschemicEligible", startsWith("ACUTE ISCHEMIC STROKE - ELIGIBLE")))
                .andExpect(jsonPath("$.IschemicNotEligible", startsWith("ACUTE ISCHEMIC STROKE - NOT ELIGIBLE")))
                .andExpect(jsonPath("$.Uncertain", startsWith("STROKE TYPE UNCERTAIN")));
    }

    @Test
    void missingDataIsBadRequestNamingTheField() throws Exception {
        when(engine.evaluate(anyMap())).thenThrow(new MissingDataException("vomiting"));

        mockMvc.perform(post("/assessments").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("MISSING_DATA"))
                .andExpect(jsonPath("$.field").value("vomiting"));
    }

    @Test
    void unavailableClassificationIsServiceUnavailable() throws Exception {
        when(engine.evaluate(anyMap())).thenThrow(new ClassificationUnavailableException("Image analysis timed out after 30000 ms"));

        mockMvc.perform(post("/assessments").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.kind").value("CLASSIFICATION_UNAVAILABLE"))
                .andExpect(jsonPath("$.message").value("Image analysis timed out after 30000 ms"))
                .andExpect(jsonPath("$.field").doesNotExist());
    }

    @Test
    void configurationErrorIsServerError() throws Exception {
        when(engine.evaluate(anyMap())).thenThrow(new ConfigurationException("No thrombolytic agent configured"));

        mockMvc.perform(post("/assessments").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.kind").value("CONFIGURATION_ERROR"));
    }
}
