package ru.tigran.stylistengine.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import ru.tigran.stylistengine.quiz.QuizSelection;

import java.util.List;

/**
 * Ответы на квиз. Количество ответов проверяется в StyleProfileBuilder
 * (IncompleteQuizException), здесь только структура.
 */
public record QuizSubmissionRequest(
        @NotNull(message = "Список ответов обязателен")
        List<@Valid @NotNull QuizSelection> selections
) {
}
