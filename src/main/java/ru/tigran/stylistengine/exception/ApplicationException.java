package ru.tigran.stylistengine.exception;

/**
 * Base of the engine's error taxonomy. Every subtype carries an {@link ErrorCode} value
 * for the response body and a retriable flag.
 *
 * Retriable: the same request may succeed later without changes (all feature sources down,
 * AI provider rate limited or its circuit breaker open).
 * Non-retriable: bad input, missing resource, malformed model output.
 */
public abstract class ApplicationException extends RuntimeException {
    private final String errorCode;
    private final boolean retriable;

    protected ApplicationException(String message, String errorCode) {
        this(message, errorCode, false);
    }

    protected ApplicationException(String message, String errorCode, boolean retriable) {
        super(message);
        this.errorCode = errorCode;
        this.retriable = retriable;
    }

    protected ApplicationException(String message, String errorCode, boolean retriable, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retriable = retriable;
    }

    protected ApplicationException(ErrorCode errorCode, String message, boolean retriable) {
        this(message, errorCode.getCode(), retriable);
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetriable() {
        return retriable;
    }
}
