package ru.tigran.stylistengine.exception;

/**
 * Body of every error response.
 */
public record ErrorResponse(String code, String message) {
}
