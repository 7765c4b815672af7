package com.neuroassist.stroke.imaging;

import com.neuroassist.stroke.exception.ClassificationUnavailableException;
import com.neuroassist.stroke.model.CtScanImage;
import com.neuroassist.stroke.model.PatientAssessment;

import java.util.concurrent.CompletableFuture;

/**
 * Stands in when no image model is configured, so that image-bearing assessments fail
 * visibly instead of being scored some other way.
 */
public class UnavailableImageAnalysisCapability implements ImageAnalysisCapability {

    @Override
    public CompletableFuture<ImageAnalysisVerdict> analyze(CtScanImage image, PatientAssessment clinicalContext) {
        return CompletableFuture.failedFuture(
                new ClassificationUnavailableException("No image-analysis capability is configured"));
    }
}
