package com.neuroassist.stroke.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum StrokeType {
    ISCHEMIC("Ischemic"),
    HEMORRHAGIC("Hemorrhagic"),
    UNCERTAIN("Uncertain");

    private final String label;

    StrokeType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<StrokeType> fromLabel(String label) {
        return Arrays.stream(values()).filter(v -> v.label.equalsIgnoreCase(label)).findFirst();
    }
}
