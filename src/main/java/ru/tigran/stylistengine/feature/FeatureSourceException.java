package ru.tigran.stylistengine.feature;

import ru.tigran.stylistengine.exception.ApplicationException;
import ru.tigran.stylistengine.exception.ErrorCode;

/**
 * Failure of a single feature source. Never leaves the extraction layer:
 * {@link FeatureExtractionService} converts it into a {@link SourceFailure}.
 */
public class FeatureSourceException extends ApplicationException {
    public FeatureSourceException(String message) {
        super(message, ErrorCode.FEATURE_SOURCE_ERROR.getCode(), true);
    }

    public FeatureSourceException(String message, Throwable cause) {
        super(message, ErrorCode.FEATURE_SOURCE_ERROR.getCode(), true, cause);
    }
}
