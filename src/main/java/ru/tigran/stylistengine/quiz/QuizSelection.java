package ru.tigran.stylistengine.quiz;

import jakarta.validation.constraints.NotBlank;

/**
 * One answer of the style quiz: the item picked for a question and the style category
 * that item is tagged with in the quiz catalog.
 */
public record QuizSelection(
        @NotBlank String questionId,
        String chosenItemId,
        @NotBlank String styleCategory
) {
}
