package com.neuroassist.stroke.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * How unambiguous the image-analysis capability judged its own verdict.
 */
public enum ClarityBand {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String label;

    ClarityBand(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<ClarityBand> fromLabel(String label) {
        return Arrays.stream(values()).filter(v -> v.label.equalsIgnoreCase(label)).findFirst();
    }
}
