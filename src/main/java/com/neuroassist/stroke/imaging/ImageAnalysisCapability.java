package com.neuroassist.stroke.imaging;

import com.neuroassist.stroke.model.CtScanImage;
import com.neuroassist.stroke.model.PatientAssessment;

import java.util.concurrent.CompletableFuture;

/**
 * Out-of-process CT image classifier. The engine consumes its verdict as-is and never inspects
 * the image itself.
 * <p>
 * Implementations complete the future exceptionally on failure. Bounding the call in time is
 * the engine's job, not the implementation's.
 * </p>
 */
public interface ImageAnalysisCapability {

    CompletableFuture<ImageAnalysisVerdict> analyze(CtScanImage image, PatientAssessment clinicalContext);
}
