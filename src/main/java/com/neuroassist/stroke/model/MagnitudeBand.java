package com.neuroassist.stroke.model;

/**
 * Distance of a Siriraj score from zero: strong above 2, moderate above 1, weak otherwise.
 */
public enum MagnitudeBand {
    STRONG,
    MODERATE,
    WEAK
}
