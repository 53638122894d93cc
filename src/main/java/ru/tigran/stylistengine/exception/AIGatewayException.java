package ru.tigran.stylistengine.exception;

/**
 * Failure of the OpenRouter gateway: HTTP error, open circuit breaker, or a model answer
 * that is not the JSON shape asked for (vision features or outfit description).
 * HTTP status: 502 Bad Gateway
 *
 * Retriable for rate limiting, 5xx after the last retry and an open breaker;
 * non-retriable for 4xx and malformed answers.
 */
public class AIGatewayException extends ApplicationException {
    public AIGatewayException(String message, String errorCode) {
        super(message, errorCode);
    }

    public AIGatewayException(String message, String errorCode, boolean retriable) {
        super(message, errorCode, retriable);
    }

    public AIGatewayException(String message, String errorCode, Throwable cause) {
        super(message, errorCode, false, cause);
    }

    public AIGatewayException(String message, String errorCode, boolean retriable, Throwable cause) {
        super(message, errorCode, retriable, cause);
    }

    /**
     * The model answered with valid JSON of the wrong shape.
     */
    public static AIGatewayException invalidResponse(String message) {
        return new AIGatewayException(message, ErrorCode.INVALID_AI_RESPONSE.getCode(), false);
    }
}
