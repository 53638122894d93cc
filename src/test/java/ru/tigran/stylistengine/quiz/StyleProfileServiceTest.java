package ru.tigran.stylistengine.quiz;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import ru.tigran.stylistengine.dto.QuizSubmissionResponse;
import ru.tigran.stylistengine.exception.ErrorCode;
import ru.tigran.stylistengine.exception.IncompleteQuizException;
import ru.tigran.stylistengine.exception.ResourceNotFoundException;
import ru.tigran.stylistengine.model.QuizSubmission;
import ru.tigran.stylistengine.repository.QuizSubmissionRepository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("StyleProfileService unit тесты")
class StyleProfileServiceTest {

    private static final Long USER_ID = 1L;

    @Mock
    private QuizSubmissionRepository quizSubmissionRepository;

    private MeterRegistry meterRegistry;
    private StyleProfileService service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        service = new StyleProfileService(
                new StyleProfileBuilder(new QuizProperties()),
                quizSubmissionRepository,
                meterRegistry
        );
    }

    private static List<QuizSelection> selections(String... categories) {
        return IntStream.range(0, categories.length)
                .mapToObj(i -> new QuizSelection("q" + i, "item" + i, categories[i]))
                .toList();
    }

    @Test
    @DisplayName("submit - профиль строится, прохождение сохраняется, метрика растет")
    void submitSavesSubmission() {
        when(quizSubmissionRepository.save(any(QuizSubmission.class))).thenAnswer(invocation -> {
            QuizSubmission submission = invocation.getArgument(0);
            submission.setId(5L);
            return submission;
        });

        QuizSubmissionResponse response = service.submit(USER_ID,
                selections("Edgy", "Edgy", "Edgy", "Streetwear", "Classic"));

        assertEquals(5L, response.id());
        assertEquals("Edgy", response.profile().primaryStyle());
        assertEquals("Streetwear", response.profile().secondaryStyle());
        assertEquals(1.0, meterRegistry.counter("quiz.profile.built").count());
        verify(quizSubmissionRepository).save(argThat(submission ->
                submission.getUserId().equals(USER_ID)
                        && "Edgy".equals(submission.getPrimaryStyle())
                        && submission.getSelections().size() == 5));
    }

    @Test
    @DisplayName("submit - неполный квиз не сохраняется")
    void incompleteQuizIsNotSaved() {
        assertThrows(IncompleteQuizException.class, () -> service.submit(USER_ID, selections("Edgy")));

        verifyNoInteractions(quizSubmissionRepository);
        assertEquals(0.0, meterRegistry.counter("quiz.profile.built").count());
    }

    @Test
    @DisplayName("getCurrentProfile - профиль последнего прохождения")
    void currentProfile() {
        QuizSubmission submission = new QuizSubmission();
        submission.setScores(Map.of("Classic", 3.0, "Edgy", 2.0));
        submission.setPrimaryStyle("Classic");
        submission.setSecondaryStyle("Edgy");
        submission.setConfidence(0.6);
        submission.setHybrid(false);
        submission.setStyleMessage("Classic with a hint of Edgy");
        when(quizSubmissionRepository.findFirstByUserIdOrderByIdDesc(USER_ID)).thenReturn(Optional.of(submission));

        StyleProfile profile = service.getCurrentProfile(USER_ID);

        assertEquals("Classic", profile.primaryStyle());
        assertEquals(0.6, profile.confidence(), 1e-9);
        assertFalse(profile.hybrid());
    }

    @Test
    @DisplayName("getCurrentProfile - квиз не пройден")
    void noProfile() {
        when(quizSubmissionRepository.findFirstByUserIdOrderByIdDesc(USER_ID)).thenReturn(Optional.empty());

        ResourceNotFoundException exception = assertThrows(ResourceNotFoundException.class,
                () -> service.getCurrentProfile(USER_ID));

        assertEquals(ErrorCode.STYLE_PROFILE_NOT_FOUND.getCode(), exception.getErrorCode());
        assertTrue(service.findCurrentProfile(USER_ID).isEmpty());
    }
}
