package ru.tigran.stylistengine.exception;

/**
 * Thrown when a quiz submission does not contain exactly one selection per question.
 * Caller input error, not retriable without correcting the submission.
 * HTTP status: 400 Bad Request
 */
public class IncompleteQuizException extends ValidationException {
    private final int expected;
    private final int actual;

    public IncompleteQuizException(int expected, int actual) {
        super(String.format("Expected %d quiz selections, got %d", expected, actual),
                ErrorCode.INCOMPLETE_QUIZ.getCode());
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
