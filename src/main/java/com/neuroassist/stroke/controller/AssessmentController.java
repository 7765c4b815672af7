package com.neuroassist.stroke.controller;

import com.neuroassist.stroke.model.DiagnosisResult;
import com.neuroassist.stroke.protocol.ProtocolTextSelector;
import com.neuroassist.stroke.report.DiagnosisSummaryFormatter;
import com.neuroassist.stroke.workflow.DiagnosisEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/assessments")
@RequiredArgsConstructor
public class AssessmentController {

    private final DiagnosisEngine engine;
    private final DiagnosisSummaryFormatter summaryFormatter;
    private final ProtocolTextSelector protocolTextSelector;

    @PostMapping
    public DiagnosisResult evaluate(@RequestBody Map<String, Object> patientData) {
        return engine.evaluate(patientData);
    }

    @PostMapping(value = "/summary", produces = MediaType.TEXT_PLAIN_VALUE)
    public String summary(@RequestBody Map<String, Object> patientData) {
        return summaryFormatter.format(engine.evaluate(patientData));
    }

    @GetMapping("/protocols")
    public Map<String, String> protocols() {
        return protocolTextSelector.canonicalProtocols();
    }
}
