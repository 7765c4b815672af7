package com.neuroassist.stroke.scoring;

import com.neuroassist.stroke.model.MagnitudeBand;
import com.neuroassist.stroke.model.StrokeType;

public record ScoreInterpretation(StrokeType strokeType, MagnitudeBand magnitudeBand) {
}
