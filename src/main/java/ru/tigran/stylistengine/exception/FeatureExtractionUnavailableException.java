package ru.tigran.stylistengine.exception;

import ru.tigran.stylistengine.feature.SourceFailure;

import java.util.List;

/**
 * Thrown when every feature source failed for one image.
 * Fatal for that image but retriable later (sources may recover).
 * HTTP status: 503 Service Unavailable
 */
public class FeatureExtractionUnavailableException extends ApplicationException {
    private final String imageHash;
    private final List<SourceFailure> failures;

    public FeatureExtractionUnavailableException(String imageHash, List<SourceFailure> failures) {
        super(ErrorCode.FEATURE_EXTRACTION_UNAVAILABLE,
                String.format("All feature sources failed for image %s: %s", imageHash, failures),
                true);
        this.imageHash = imageHash;
        this.failures = List.copyOf(failures);
    }

    public String getImageHash() {
        return imageHash;
    }

    public List<SourceFailure> getFailures() {
        return failures;
    }
}
