package ru.tigran.stylistengine.quiz;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.tigran.stylistengine.dto.QuizSubmissionResponse;
import ru.tigran.stylistengine.exception.ResourceNotFoundException;
import ru.tigran.stylistengine.model.QuizSubmission;
import ru.tigran.stylistengine.repository.QuizSubmissionRepository;

import java.util.List;
import java.util.Optional;

/**
 * Сервис прохождений квиза.
 * Каждое прохождение сохраняется отдельной записью; текущий профиль пользователя
 * это профиль последнего прохождения.
 */
@Slf4j
@Service
public class StyleProfileService {

    private final StyleProfileBuilder styleProfileBuilder;
    private final QuizSubmissionRepository quizSubmissionRepository;
    private final Counter profileBuiltCounter;

    public StyleProfileService(
            StyleProfileBuilder styleProfileBuilder,
            QuizSubmissionRepository quizSubmissionRepository,
            MeterRegistry meterRegistry
    ) {
        this.styleProfileBuilder = styleProfileBuilder;
        this.quizSubmissionRepository = quizSubmissionRepository;
        this.profileBuiltCounter = Counter.builder("quiz.profile.built")
                .description("Style profiles built from quiz submissions")
                .register(meterRegistry);
    }

    /**
     * Строит профиль и сохраняет прохождение в историю.
     *
     * @throws ru.tigran.stylistengine.exception.IncompleteQuizException если ответов не столько, сколько вопросов
     * @throws ru.tigran.stylistengine.exception.UnknownCategoryException если категория не из списка
     */
    @Transactional
    public QuizSubmissionResponse submit(Long userId, List<QuizSelection> selections) {
        StyleProfile profile = styleProfileBuilder.build(selections);

        QuizSubmission submission = new QuizSubmission();
        submission.setUserId(userId);
        submission.setSelections(List.copyOf(selections));
        submission.setScores(profile.scores());
        submission.setPrimaryStyle(profile.primaryStyle());
        submission.setSecondaryStyle(profile.secondaryStyle());
        submission.setConfidence(profile.confidence());
        submission.setHybrid(profile.hybrid());
        submission.setStyleMessage(profile.styleMessage());

        QuizSubmission saved = quizSubmissionRepository.save(submission);
        profileBuiltCounter.increment();
        log.info("Style profile for user {}: {} (confidence {}, hybrid {}), submission {}",
                userId, profile.styleMessage(), profile.confidence(), profile.hybrid(), saved.getId());

        return mapToResponse(saved);
    }

    @Transactional(readOnly = true)
    public StyleProfile getCurrentProfile(Long userId) {
        return findCurrentProfile(userId)
                .orElseThrow(() -> ResourceNotFoundException.styleProfile(userId));
    }

    @Transactional(readOnly = true)
    public Optional<StyleProfile> findCurrentProfile(Long userId) {
        return quizSubmissionRepository.findFirstByUserIdOrderByIdDesc(userId)
                .map(StyleProfileService::toProfile);
    }

    /**
     * История прохождений, последнее первым.
     */
    @Transactional(readOnly = true)
    public List<QuizSubmissionResponse> getHistory(Long userId) {
        return quizSubmissionRepository.findByUserIdOrderByIdDesc(userId).stream()
                .map(StyleProfileService::mapToResponse)
                .toList();
    }

    static StyleProfile toProfile(QuizSubmission submission) {
        return new StyleProfile(
                submission.getScores(),
                submission.getPrimaryStyle(),
                submission.getSecondaryStyle(),
                submission.getConfidence() == null ? 0.0 : submission.getConfidence(),
                Boolean.TRUE.equals(submission.getHybrid()),
                submission.getStyleMessage()
        );
    }

    private static QuizSubmissionResponse mapToResponse(QuizSubmission submission) {
        return new QuizSubmissionResponse(
                submission.getId(),
                submission.getSelections(),
                toProfile(submission),
                submission.getCreatedAt()
        );
    }
}
