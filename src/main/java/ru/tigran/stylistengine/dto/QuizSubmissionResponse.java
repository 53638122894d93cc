package ru.tigran.stylistengine.dto;

import ru.tigran.stylistengine.quiz.QuizSelection;
import ru.tigran.stylistengine.quiz.StyleProfile;

import java.time.LocalDateTime;
import java.util.List;

public record QuizSubmissionResponse(
        Long id,
        List<QuizSelection> selections,
        StyleProfile profile,
        LocalDateTime submittedAt
) {
}
