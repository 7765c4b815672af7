package com.neuroassist.stroke.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Bedside level of consciousness with its Siriraj weight.
 */
public enum LevelOfConsciousness {
    CONSCIOUS("Conscious", 0),
    DROWSY("Drowsy", 1),
    COMATOSE("Comatose", 2);

    private final String label;
    private final int sirirajPoints;

    LevelOfConsciousness(String label, int sirirajPoints) {
        this.label = label;
        this.sirirajPoints = sirirajPoints;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public int sirirajPoints() {
        return sirirajPoints;
    }

    public static Optional<LevelOfConsciousness> fromLabel(String label) {
        return Arrays.stream(values()).filter(v -> v.label.equals(label)).findFirst();
    }
}
