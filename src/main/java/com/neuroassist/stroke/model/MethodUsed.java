package com.neuroassist.stroke.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MethodUsed {
    IMAGE_ANALYSIS("ImageAnalysis"),
    SIRIRAJ_SCORE("SirirajScore");

    private final String label;

    MethodUsed(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
