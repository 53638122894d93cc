package ru.tigran.stylistengine.exception;

/**
 * Thrown when a quiz selection carries a style category that is not configured.
 * Never absorbed silently: an ignored selection would skew the tally.
 * HTTP status: 400 Bad Request
 */
public class UnknownCategoryException extends ValidationException {
    private final String category;

    public UnknownCategoryException(String questionId, String category) {
        super(String.format("Unknown style category '%s' in selection for question '%s'", category, questionId),
                ErrorCode.UNKNOWN_STYLE_CATEGORY.getCode());
        this.category = category;
    }

    public String getCategory() {
        return category;
    }
}
