package com.neuroassist.stroke.calibration;

/**
 * Fixed confidence bands. Each band reports its midpoint so that repeated evaluations of the
 * same evidence always give the same number. The low-clarity image band is [0, 0.50) and
 * reports 0.25.
 */
public enum ConfidenceBand {
    SIRIRAJ_STRONG(0.85, 0.95, 0.90),
    SIRIRAJ_MODERATE(0.60, 0.84, 0.72),
    SIRIRAJ_WEAK(0.40, 0.59, 0.495),
    IMAGE_HIGH_CLARITY(0.80, 1.00, 0.90),
    IMAGE_MEDIUM_CLARITY(0.50, 0.79, 0.645),
    IMAGE_LOW_CLARITY(0.00, 0.50, 0.25);

    private final double lower;
    private final double upper;
    private final double midpoint;

    ConfidenceBand(double lower, double upper, double midpoint) {
        this.lower = lower;
        this.upper = upper;
        this.midpoint = midpoint;
    }

    public double lower() {
        return lower;
    }

    public double upper() {
        return upper;
    }

    public double midpoint() {
        return midpoint;
    }
}
