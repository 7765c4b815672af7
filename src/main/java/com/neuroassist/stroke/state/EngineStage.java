package com.neuroassist.stroke.state;

/**
 * Progress of one evaluation. REJECTED and FAILED are terminal and only ever reported in
 * logs, since the evaluation ends with an exception rather than a state.
 */
public enum EngineStage {
    INTAKE,
    VALIDATED,
    CLASSIFIED,
    CALIBRATED,
    ELIGIBILITY_DETERMINED,
    DONE,
    REJECTED,
    FAILED
}
