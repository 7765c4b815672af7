package com.neuroassist.stroke.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum ArmWeakness {
    NONE("None"),
    LEFT("Left"),
    RIGHT("Right"),
    BOTH("Both");

    private final String label;

    ArmWeakness(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<ArmWeakness> fromLabel(String label) {
        return Arrays.stream(values()).filter(v -> v.label.equals(label)).findFirst();
    }
}
