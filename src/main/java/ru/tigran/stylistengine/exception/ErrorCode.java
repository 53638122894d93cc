package ru.tigran.stylistengine.exception;

/**
 * Enum for application error codes.
 * Centralizes all error code definitions to avoid magic strings.
 * Each code has a default message for logging purposes.
 */
public enum ErrorCode {
    // Resource not found errors
    CLOTHING_ITEM_NOT_FOUND("CLOTHING_ITEM_NOT_FOUND", "Clothing item not found"),
    STYLE_PROFILE_NOT_FOUND("STYLE_PROFILE_NOT_FOUND", "Style profile not found"),
    OUTFIT_RECOMMENDATION_NOT_FOUND("OUTFIT_RECOMMENDATION_NOT_FOUND", "Outfit recommendation not found"),

    // Validation errors
    VALIDATION_ERROR("VALIDATION_ERROR", "Validation failed"),
    INCOMPLETE_QUIZ("INCOMPLETE_QUIZ", "Quiz submission is incomplete"),
    UNKNOWN_STYLE_CATEGORY("UNKNOWN_STYLE_CATEGORY", "Unknown style category"),
    EMPTY_IMAGE("EMPTY_IMAGE", "Image is empty"),
    EMPTY_OUTFIT_REQUEST("EMPTY_OUTFIT_REQUEST", "Outfit request has no roles"),

    // Feature extraction errors
    FEATURE_EXTRACTION_UNAVAILABLE("FEATURE_EXTRACTION_UNAVAILABLE", "No feature source available for image"),
    FEATURE_SOURCE_ERROR("FEATURE_SOURCE_ERROR", "Feature source call failed"),

    // AI service errors
    AI_SERVICE_ERROR("AI_SERVICE_ERROR", "AI service error"),
    INVALID_AI_RESPONSE("INVALID_AI_RESPONSE", "Invalid response from AI service"),
    INVALID_JSON_RESPONSE("INVALID_JSON_RESPONSE", "Failed to parse JSON response from AI"),

    // Internal server errors
    INTERNAL_SERVER_ERROR("INTERNAL_SERVER_ERROR", "An unexpected error occurred");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
