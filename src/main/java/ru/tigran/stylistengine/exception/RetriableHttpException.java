package ru.tigran.stylistengine.exception;

import java.util.Set;

/**
 * Transient HTTP failure of an upstream model endpoint, retried by the caller's backoff loop.
 * Never reaches the REST layer: after the last attempt it is wrapped into {@link AIGatewayException}.
 */
public class RetriableHttpException extends RuntimeException {
    private static final Set<Integer> RETRIABLE_STATUSES = Set.of(429, 502, 503, 504);

    private final int statusCode;

    public RetriableHttpException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * 429 and the gateway-style 5xx codes. Other 4xx/5xx are permanent for the request.
     */
    public static boolean isRetriableStatus(int statusCode) {
        return RETRIABLE_STATUSES.contains(statusCode);
    }
}
