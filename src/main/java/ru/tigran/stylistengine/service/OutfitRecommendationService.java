package ru.tigran.stylistengine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.tigran.stylistengine.dto.OutfitFeedbackRequest;
import ru.tigran.stylistengine.dto.OutfitHistoryResponse;
import ru.tigran.stylistengine.dto.OutfitMatchRequest;
import ru.tigran.stylistengine.dto.OutfitMatchResponse;
import ru.tigran.stylistengine.dto.OutfitRecommendationRequest;
import ru.tigran.stylistengine.dto.OutfitRecommendationResponse;
import ru.tigran.stylistengine.dto.RoleMatchResponse;
import ru.tigran.stylistengine.dto.RoleTargetRequest;
import ru.tigran.stylistengine.dto.SavedOutfitResponse;
import ru.tigran.stylistengine.exception.ErrorCode;
import ru.tigran.stylistengine.exception.ResourceNotFoundException;
import ru.tigran.stylistengine.exception.ValidationException;
import ru.tigran.stylistengine.matching.GarmentRecord;
import ru.tigran.stylistengine.matching.OutfitMatchResult;
import ru.tigran.stylistengine.matching.OutfitMatcher;
import ru.tigran.stylistengine.matching.OutfitRequestSpec;
import ru.tigran.stylistengine.matching.OutfitRole;
import ru.tigran.stylistengine.model.OutfitRecommendation;
import ru.tigran.stylistengine.quiz.StyleProfile;
import ru.tigran.stylistengine.quiz.StyleProfileService;
import ru.tigran.stylistengine.repository.OutfitRecommendationRepository;

import java.util.List;
import java.util.Map;

/**
 * Подбор образа из гардероба пользователя.
 *
 * Два входа:
 * 1. matchSpec: клиент присылает готовое описание образа по ролям
 * 2. recommend: описание генерирует модель по свободному тексту, затем оно матчится так же
 *
 * Профиль стиля подмешивается, если пользователь проходил квиз; без него style consistency нейтральна.
 * Каждый подбор сохраняется в историю, пользователь может оценить его и отметить как избранный.
 */
@Slf4j
@Service
public class OutfitRecommendationService {

    private static final int MAX_PAGE_SIZE = 100;
    private static final int MIN_RATING = 1;
    private static final int MAX_RATING = 5;

    private final ClosetService closetService;
    private final StyleProfileService styleProfileService;
    private final OutfitMatcher outfitMatcher;
    private final AIGatewayService aiGatewayService;
    private final OutfitSpecParser outfitSpecParser;
    private final OutfitRecommendationRepository outfitRecommendationRepository;

    public OutfitRecommendationService(
            ClosetService closetService,
            StyleProfileService styleProfileService,
            OutfitMatcher outfitMatcher,
            AIGatewayService aiGatewayService,
            OutfitSpecParser outfitSpecParser,
            OutfitRecommendationRepository outfitRecommendationRepository
    ) {
        this.closetService = closetService;
        this.styleProfileService = styleProfileService;
        this.outfitMatcher = outfitMatcher;
        this.aiGatewayService = aiGatewayService;
        this.outfitSpecParser = outfitSpecParser;
        this.outfitRecommendationRepository = outfitRecommendationRepository;
    }

    @Transactional
    public OutfitMatchResponse matchSpec(Long userId, OutfitMatchRequest request) {
        OutfitRequestSpec spec = toSpec(request);
        StyleProfile profile = currentProfile(userId);
        OutfitMatchResult result = match(userId, spec, profile);

        OutfitRecommendation saved = outfitRecommendationRepository.save(
                toEntity(userId, result, profile, null, null, null, null, null));
        return OutfitMatchResponse.from(saved.getId(), result);
    }

    /**
     * Генерирует описание образа и подбирает под него вещи.
     * Вызов модели идёт вне транзакции: он может занять десятки секунд.
     *
     * @throws ru.tigran.stylistengine.exception.AIGatewayException если модель недоступна или ответ не разобрать
     */
    public OutfitRecommendationResponse recommend(Long userId, OutfitRecommendationRequest request) {
        StyleProfile profile = currentProfile(userId);

        String systemPrompt = OutfitPromptBuilder.buildSystemPrompt();
        String userMessage = OutfitPromptBuilder.buildUserPrompt(
                request.prompt(), request.gender(), profile, request.weather(), request.occasion());

        log.debug("Generating outfit description for user {}", userId);
        String description = aiGatewayService.generateOutfitDescription(systemPrompt, userMessage);
        OutfitRequestSpec spec = outfitSpecParser.parse(description);

        OutfitMatchResult result = match(userId, spec, profile);
        String model = aiGatewayService.getConfiguredModel();

        OutfitRecommendation saved = outfitRecommendationRepository.save(toEntity(userId, result, profile,
                request.prompt(), description, model, request.occasion(), request.weather()));
        log.info("Outfit recommendation {} saved for user {}", saved.getId(), userId);
        return new OutfitRecommendationResponse(
                saved.getId(),
                spec,
                OutfitMatchResponse.from(saved.getId(), result),
                profile != null ? profile.primaryStyle() : null,
                model
        );
    }

    /**
     * История подборов, новые первыми. Фильтры со значением null не применяются.
     */
    @Transactional(readOnly = true)
    public OutfitHistoryResponse getHistory(Long userId, int page, int size,
                                            String occasion, String weather, Boolean favorite) {
        int safePage = Math.max(page, 0);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        Page<OutfitRecommendation> history = outfitRecommendationRepository.findHistory(
                userId, blankToNull(occasion), blankToNull(weather), favorite, PageRequest.of(safePage, safeSize));
        log.debug("Found {} saved outfits for user {} (page={}, size={})",
                history.getNumberOfElements(), userId, safePage, safeSize);
        return new OutfitHistoryResponse(
                history.getContent().stream().map(SavedOutfitResponse::from).toList(),
                safePage,
                safeSize,
                history.getTotalElements()
        );
    }

    /**
     * @throws ResourceNotFoundException если подбора нет или он принадлежит другому пользователю
     */
    @Transactional(readOnly = true)
    public SavedOutfitResponse getRecommendation(Long userId, Long recommendationId) {
        return SavedOutfitResponse.from(findOwned(userId, recommendationId));
    }

    /**
     * Сохраняет оценку 1..5 и комментарий; повторная оценка заменяет предыдущую.
     */
    @Transactional
    public SavedOutfitResponse submitFeedback(Long userId, Long recommendationId, OutfitFeedbackRequest request) {
        Integer rating = request.rating();
        if (rating == null || rating < MIN_RATING || rating > MAX_RATING) {
            throw new ValidationException(ErrorCode.VALIDATION_ERROR,
                    "Rating must be between " + MIN_RATING + " and " + MAX_RATING + ", got " + rating);
        }
        OutfitRecommendation recommendation = findOwned(userId, recommendationId);
        recommendation.setFeedbackScore(rating);
        recommendation.setFeedbackComments(blankToNull(request.comments()));
        if (request.favorite() != null) {
            recommendation.setFavorite(request.favorite());
        }
        OutfitRecommendation saved = outfitRecommendationRepository.save(recommendation);
        log.info("Feedback {} saved for outfit recommendation {} of user {}", rating, recommendationId, userId);
        return SavedOutfitResponse.from(saved);
    }

    private OutfitRecommendation findOwned(Long userId, Long recommendationId) {
        return outfitRecommendationRepository.findByUserIdAndId(userId, recommendationId)
                .orElseThrow(() -> ResourceNotFoundException.outfitRecommendation(recommendationId));
    }

    private static OutfitRecommendation toEntity(Long userId, OutfitMatchResult result, StyleProfile profile,
                                                 String prompt, String aiResponse, String model,
                                                 String occasion, String weather) {
        OutfitRecommendation recommendation = new OutfitRecommendation();
        recommendation.setUserId(userId);
        recommendation.setPrompt(prompt);
        recommendation.setAiResponse(aiResponse);
        recommendation.setAiModel(model);
        recommendation.setOccasion(blankToNull(occasion));
        recommendation.setWeather(blankToNull(weather));
        recommendation.setPrimaryStyle(profile != null ? profile.primaryStyle() : null);
        recommendation.setMatches(result.matches().stream().map(RoleMatchResponse::from).toList());
        recommendation.setMissingRoles(List.copyOf(result.missingRoles()));
        recommendation.setOverallQuality(result.overallQuality());
        recommendation.setComplete(result.isComplete());
        recommendation.setFavorite(false);
        return recommendation;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private OutfitMatchResult match(Long userId, OutfitRequestSpec spec, StyleProfile profile) {
        List<GarmentRecord> inventory = closetService.loadInventory(userId);
        OutfitMatchResult result = outfitMatcher.match(spec, inventory, profile);
        log.info("Outfit for user {}: quality {}, missing roles {}, inventory size {}",
                userId, result.overallQuality(), result.missingRoles(), inventory.size());
        return result;
    }

    private StyleProfile currentProfile(Long userId) {
        return styleProfileService.findCurrentProfile(userId).orElse(null);
    }

    /**
     * @throws ValidationException на неизвестную роль, лишние цели в одиночной роли или пустой запрос
     */
    static OutfitRequestSpec toSpec(OutfitMatchRequest request) {
        OutfitRequestSpec.Builder builder = OutfitRequestSpec.builder();
        if (request != null && request.roles() != null) {
            for (Map.Entry<String, List<RoleTargetRequest>> entry : request.roles().entrySet()) {
                OutfitRole role;
                try {
                    role = OutfitRole.fromValue(entry.getKey());
                } catch (IllegalArgumentException e) {
                    throw new ValidationException(ErrorCode.VALIDATION_ERROR, e.getMessage());
                }
                if (entry.getValue() == null) {
                    continue;
                }
                for (RoleTargetRequest target : entry.getValue()) {
                    if (target != null) {
                        builder.role(role, target.toTarget());
                    }
                }
            }
        }
        OutfitRequestSpec spec = builder.build();
        if (spec.isEmpty()) {
            throw new ValidationException(ErrorCode.EMPTY_OUTFIT_REQUEST, "Outfit request has no targets");
        }
        return spec;
    }
}
