package com.neuroassist.stroke.exception;

public class ConfigurationException extends StrokeAssessmentException {

    public ConfigurationException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "CONFIGURATION_ERROR";
    }
}
