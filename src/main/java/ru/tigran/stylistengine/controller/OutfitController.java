package ru.tigran.stylistengine.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import ru.tigran.stylistengine.dto.OutfitFeedbackRequest;
import ru.tigran.stylistengine.dto.OutfitHistoryResponse;
import ru.tigran.stylistengine.dto.OutfitMatchRequest;
import ru.tigran.stylistengine.dto.OutfitMatchResponse;
import ru.tigran.stylistengine.dto.OutfitRecommendationRequest;
import ru.tigran.stylistengine.dto.OutfitRecommendationResponse;
import ru.tigran.stylistengine.dto.SavedOutfitResponse;
import ru.tigran.stylistengine.service.OutfitRecommendationService;

/**
 * REST API подбора образов из гардероба.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/users/{userId}/outfits")
@Tag(name = "Outfits", description = "Подбор образа из вещей гардероба")
public class OutfitController {

    private final OutfitRecommendationService outfitRecommendationService;

    public OutfitController(OutfitRecommendationService outfitRecommendationService) {
        this.outfitRecommendationService = outfitRecommendationService;
    }

    @PostMapping("/match")
    @Operation(
            summary = "Подобрать вещи под описание",
            description = "Принимает готовое описание образа по ролям (top, outerwear, bottom, shoes, accessories) " +
                    "и подбирает для каждой роли лучшую вещь. Роль без подходящей вещи попадает в missingRoles."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Подбор выполнен (возможно частично)",
                    content = @Content(schema = @Schema(implementation = OutfitMatchResponse.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Неизвестная роль, пустой запрос или несколько целей в одиночной роли"
            )
    })
    public ResponseEntity<OutfitMatchResponse> match(
            @PathVariable Long userId,
            @Valid @RequestBody OutfitMatchRequest request
    ) {
        log.info("POST /api/v1/users/{}/outfits/match - roles: {}", userId, request.roles().keySet());
        return ResponseEntity.ok(outfitRecommendationService.matchSpec(userId, request));
    }

    @PostMapping("/recommendations")
    @Operation(
            summary = "Сгенерировать образ",
            description = "AI составляет описание образа по запросу с учетом профиля стиля, " +
                    "затем под него подбираются вещи из гардероба."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Образ сгенерирован и подобран",
                    content = @Content(schema = @Schema(implementation = OutfitRecommendationResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "Пустое описание"),
            @ApiResponse(responseCode = "502", description = "AI сервис недоступен или вернул неверный ответ")
    })
    public ResponseEntity<OutfitRecommendationResponse> recommend(
            @PathVariable Long userId,
            @Valid @RequestBody OutfitRecommendationRequest request
    ) {
        log.info("POST /api/v1/users/{}/outfits/recommendations", userId);
        return ResponseEntity.ok(outfitRecommendationService.recommend(userId, request));
    }

    @GetMapping("/recommendations")
    @Operation(
            summary = "История подборов",
            description = "Сохраненные подборы пользователя, новые первыми. " +
                    "Можно отфильтровать по поводу, погоде и отметке избранного."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Страница истории",
                    content = @Content(schema = @Schema(implementation = OutfitHistoryResponse.class))
            )
    })
    public ResponseEntity<OutfitHistoryResponse> getHistory(
            @PathVariable Long userId,
            @RequestParam(defaultValue = "0")
            @Parameter(description = "Номер страницы (0-based)", example = "0")
            int page,
            @RequestParam(defaultValue = "20")
            @Parameter(description = "Размер страницы, не больше 100", example = "20")
            int size,
            @RequestParam(required = false) String occasion,
            @RequestParam(required = false) String weather,
            @RequestParam(required = false) Boolean favorite
    ) {
        log.info("GET /api/v1/users/{}/outfits/recommendations - page: {}, size: {}, occasion: {}, weather: {}, favorite: {}",
                userId, page, size, occasion, weather, favorite);
        return ResponseEntity.ok(outfitRecommendationService.getHistory(userId, page, size, occasion, weather, favorite));
    }

    @GetMapping("/recommendations/{recommendationId}")
    @Operation(summary = "Получить сохраненный подбор")
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Подбор найден",
                    content = @Content(schema = @Schema(implementation = SavedOutfitResponse.class))
            ),
            @ApiResponse(responseCode = "404", description = "Подбор не найден или принадлежит другому пользователю")
    })
    public ResponseEntity<SavedOutfitResponse> getRecommendation(
            @PathVariable Long userId,
            @PathVariable Long recommendationId
    ) {
        log.info("GET /api/v1/users/{}/outfits/recommendations/{}", userId, recommendationId);
        return ResponseEntity.ok(outfitRecommendationService.getRecommendation(userId, recommendationId));
    }

    @PostMapping("/recommendations/{recommendationId}/feedback")
    @Operation(
            summary = "Оценить подбор",
            description = "Оценка от 1 до 5 с необязательным комментарием. " +
                    "Поле favorite добавляет подбор в избранное или убирает из него."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Оценка сохранена",
                    content = @Content(schema = @Schema(implementation = SavedOutfitResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "Оценка вне диапазона 1..5"),
            @ApiResponse(responseCode = "404", description = "Подбор не найден или принадлежит другому пользователю")
    })
    public ResponseEntity<SavedOutfitResponse> submitFeedback(
            @PathVariable Long userId,
            @PathVariable Long recommendationId,
            @Valid @RequestBody OutfitFeedbackRequest request
    ) {
        log.info("POST /api/v1/users/{}/outfits/recommendations/{}/feedback - rating: {}",
                userId, recommendationId, request.rating());
        return ResponseEntity.ok(outfitRecommendationService.submitFeedback(userId, recommendationId, request));
    }
}
