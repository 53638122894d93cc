package ru.tigran.stylistengine.controller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import ru.tigran.stylistengine.dto.OutfitFeedbackRequest;
import ru.tigran.stylistengine.dto.OutfitHistoryResponse;
import ru.tigran.stylistengine.dto.OutfitMatchRequest;
import ru.tigran.stylistengine.dto.OutfitMatchResponse;
import ru.tigran.stylistengine.dto.OutfitRecommendationRequest;
import ru.tigran.stylistengine.dto.OutfitRecommendationResponse;
import ru.tigran.stylistengine.dto.RoleMatchResponse;
import ru.tigran.stylistengine.dto.SavedOutfitResponse;
import ru.tigran.stylistengine.exception.AIGatewayException;
import ru.tigran.stylistengine.exception.ErrorCode;
import ru.tigran.stylistengine.exception.ResourceNotFoundException;
import ru.tigran.stylistengine.exception.ValidationException;
import ru.tigran.stylistengine.matching.OutfitRequestSpec;
import ru.tigran.stylistengine.matching.OutfitRole;
import ru.tigran.stylistengine.matching.RoleTarget;
import ru.tigran.stylistengine.matching.ScoreBreakdown;
import ru.tigran.stylistengine.service.OutfitRecommendationService;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Модульные тесты для OutfitController.
 */
@WebMvcTest(OutfitController.class)
@DisplayName("OutfitController модульные тесты")
class OutfitControllerTest {

    private static final String OUTFITS_URL = "/api/v1/users/7/outfits";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private OutfitRecommendationService outfitRecommendationService;

    private static OutfitMatchResponse partialMatch() {
        return new OutfitMatchResponse(3L, List.of(
                new RoleMatchResponse(OutfitRole.TOP, "shirt", 1L, "shirt", "white",
                        new ScoreBreakdown(0.9, 0.5, 1.0, 1.0, 0.84)),
                new RoleMatchResponse(OutfitRole.SHOES, "loafers", null, null, null, null)),
                0.84, List.of(OutfitRole.SHOES), false);
    }

    @Test
    @DisplayName("POST /outfits/match - частичный подбор с missingRoles")
    void matchPartial() throws Exception {
        when(outfitRecommendationService.matchSpec(eq(7L), any(OutfitMatchRequest.class))).thenReturn(partialMatch());

        mockMvc.perform(post(OUTFITS_URL + "/match")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"roles": {
                                  "top": [{"type": "shirt", "features": {"color:white": 1.0}, "color": "white"}],
                                  "shoes": [{"type": "loafers"}]
                                }}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recommendationId", equalTo(3)))
                .andExpect(jsonPath("$.matches", hasSize(2)))
                .andExpect(jsonPath("$.matches[0].role", equalTo("top")))
                .andExpect(jsonPath("$.matches[0].itemId", equalTo(1)))
                .andExpect(jsonPath("$.matches[0].scores.overall", closeTo(0.84, 1e-9)))
                .andExpect(jsonPath("$.matches[1].itemId", nullValue()))
                .andExpect(jsonPath("$.missingRoles", hasSize(1)))
                .andExpect(jsonPath("$.missingRoles", hasItem("shoes")))
                .andExpect(jsonPath("$.complete", is(false)));
    }

    @Test
    @DisplayName("POST /outfits/match - 400 при пустом наборе ролей")
    void matchWithoutRoles() throws Exception {
        mockMvc.perform(post(OUTFITS_URL + "/match")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"roles\": {}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", equalTo(ErrorCode.VALIDATION_ERROR.getCode())));

        verifyNoInteractions(outfitRecommendationService);
    }

    @Test
    @DisplayName("POST /outfits/match - 400 на неизвестную роль")
    void matchUnknownRole() throws Exception {
        when(outfitRecommendationService.matchSpec(eq(7L), any(OutfitMatchRequest.class)))
                .thenThrow(new ValidationException("Unknown outfit role: hat", ErrorCode.VALIDATION_ERROR.getCode()));

        mockMvc.perform(post(OUTFITS_URL + "/match")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"roles\": {\"hat\": [{\"type\": \"cap\"}]}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("hat")));
    }

    @Test
    @DisplayName("POST /outfits/recommendations - сгенерированный образ и подбор")
    void recommend() throws Exception {
        OutfitRequestSpec spec = OutfitRequestSpec.builder()
                .role(OutfitRole.TOP, new RoleTarget("shirt", Map.of("category:shirt", 1.0), "white"))
                .role(OutfitRole.SHOES, new RoleTarget("loafers", Map.of("category:loafers", 1.0), "brown"))
                .build();
        when(outfitRecommendationService.recommend(eq(7L), any(OutfitRecommendationRequest.class)))
                .thenReturn(new OutfitRecommendationResponse(3L, spec, partialMatch(), "Classic", "test-model"));

        mockMvc.perform(post(OUTFITS_URL + "/recommendations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\": \"office day\", \"weather\": \"sunny\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id", equalTo(3)))
                .andExpect(jsonPath("$.primaryStyle", equalTo("Classic")))
                .andExpect(jsonPath("$.model", equalTo("test-model")))
                .andExpect(jsonPath("$.match.overallQuality", closeTo(0.84, 1e-9)));
    }

    @Test
    @DisplayName("POST /outfits/recommendations - 400 при пустом описании")
    void recommendBlankPrompt() throws Exception {
        mockMvc.perform(post(OUTFITS_URL + "/recommendations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\": \"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", equalTo(ErrorCode.VALIDATION_ERROR.getCode())));

        verifyNoInteractions(outfitRecommendationService);
    }

    @Test
    @DisplayName("POST /outfits/recommendations - 502 при сбое AI")
    void recommendGatewayFailure() throws Exception {
        when(outfitRecommendationService.recommend(eq(7L), any(OutfitRecommendationRequest.class)))
                .thenThrow(new AIGatewayException("AI provider temporarily unavailable",
                        ErrorCode.AI_SERVICE_ERROR.getCode(), true));

        mockMvc.perform(post(OUTFITS_URL + "/recommendations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\": \"wedding guest\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code", equalTo(ErrorCode.AI_SERVICE_ERROR.getCode())));
    }

    private static SavedOutfitResponse savedOutfit(Integer rating, boolean favorite) {
        return new SavedOutfitResponse(3L, "office day", "work", "sunny", "test-model", "Classic",
                partialMatch(), rating, null, favorite, LocalDateTime.of(2026, 10, 1, 9, 30));
    }

    @Test
    @DisplayName("GET /outfits/recommendations - история с фильтрами и пагинацией")
    void history() throws Exception {
        when(outfitRecommendationService.getHistory(7L, 1, 5, "work", null, true))
                .thenReturn(new OutfitHistoryResponse(List.of(savedOutfit(5, true)), 1, 5, 6));

        mockMvc.perform(get(OUTFITS_URL + "/recommendations")
                        .param("page", "1")
                        .param("size", "5")
                        .param("occasion", "work")
                        .param("favorite", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items", hasSize(1)))
                .andExpect(jsonPath("$.items[0].id", equalTo(3)))
                .andExpect(jsonPath("$.items[0].favorite", is(true)))
                .andExpect(jsonPath("$.items[0].match.missingRoles", hasItem("shoes")))
                .andExpect(jsonPath("$.totalElements", equalTo(6)));
    }

    @Test
    @DisplayName("GET /outfits/recommendations - значения пагинации по умолчанию")
    void historyDefaults() throws Exception {
        when(outfitRecommendationService.getHistory(7L, 0, 20, null, null, null))
                .thenReturn(new OutfitHistoryResponse(List.of(), 0, 20, 0));

        mockMvc.perform(get(OUTFITS_URL + "/recommendations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items", hasSize(0)))
                .andExpect(jsonPath("$.size", equalTo(20)));
    }

    @Test
    @DisplayName("GET /outfits/recommendations/{id} - 404 OUTFIT_RECOMMENDATION_NOT_FOUND")
    void getRecommendationNotFound() throws Exception {
        when(outfitRecommendationService.getRecommendation(7L, 99L))
                .thenThrow(ResourceNotFoundException.outfitRecommendation(99L));

        mockMvc.perform(get(OUTFITS_URL + "/recommendations/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code", equalTo(ErrorCode.OUTFIT_RECOMMENDATION_NOT_FOUND.getCode())));
    }

    @Test
    @DisplayName("POST /outfits/recommendations/{id}/feedback - оценка сохраняется")
    void submitFeedback() throws Exception {
        when(outfitRecommendationService.submitFeedback(eq(7L), eq(3L), any(OutfitFeedbackRequest.class)))
                .thenReturn(savedOutfit(4, true));

        mockMvc.perform(post(OUTFITS_URL + "/recommendations/3/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rating\": 4, \"comments\": \"shoes are off\", \"favorite\": true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.feedbackScore", equalTo(4)))
                .andExpect(jsonPath("$.favorite", is(true)));

        verify(outfitRecommendationService).submitFeedback(eq(7L), eq(3L),
                argThat(request -> request.rating() == 4 && Boolean.TRUE.equals(request.favorite())));
    }

    @Test
    @DisplayName("POST /outfits/recommendations/{id}/feedback - 400 на оценку вне 1..5")
    void submitFeedbackOutOfRange() throws Exception {
        mockMvc.perform(post(OUTFITS_URL + "/recommendations/3/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rating\": 6}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", equalTo(ErrorCode.VALIDATION_ERROR.getCode())));

        verifyNoInteractions(outfitRecommendationService);
    }
}
