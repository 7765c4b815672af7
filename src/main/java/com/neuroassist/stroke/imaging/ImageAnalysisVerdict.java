package com.neuroassist.stroke.imaging;

import com.neuroassist.stroke.model.ClarityBand;
import com.neuroassist.stroke.model.StrokeType;

public record ImageAnalysisVerdict(StrokeType strokeType, ClarityBand clarityBand) {
}
