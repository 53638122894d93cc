package ru.tigran.stylistengine.exception;

/**
 * Caller input the engine cannot work with: empty image, outfit request without targets,
 * unknown outfit role. Quiz-specific cases have their own subclasses.
 * HTTP status: 400 Bad Request
 */
public class ValidationException extends ApplicationException {
    public ValidationException(String message, String errorCode) {
        super(message, errorCode);
    }

    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message, false);
    }

    public static ValidationException emptyImage() {
        return new ValidationException(ErrorCode.EMPTY_IMAGE, "Image must not be empty");
    }
}
