package ru.tigran.stylistengine.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import ru.tigran.stylistengine.dto.QuizSubmissionRequest;
import ru.tigran.stylistengine.dto.QuizSubmissionResponse;
import ru.tigran.stylistengine.quiz.StyleProfile;
import ru.tigran.stylistengine.quiz.StyleProfileService;

import java.util.List;

/**
 * REST API визуального квиза: прохождение и текущий профиль стиля.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/users/{userId}/quiz")
@Tag(name = "Style Quiz", description = "Прохождение квиза и профиль стиля")
public class QuizController {

    private final StyleProfileService styleProfileService;

    public QuizController(StyleProfileService styleProfileService) {
        this.styleProfileService = styleProfileService;
    }

    /**
     * Отправить ответы квиза.
     *
     * @param request по одному выбору на каждый вопрос
     * @return прохождение с построенным профилем
     */
    @PostMapping("/submissions")
    @Operation(
            summary = "Отправить ответы квиза",
            description = "Строит профиль стиля по выбранным образам и сохраняет прохождение. " +
                    "Количество ответов должно совпадать с количеством вопросов, " +
                    "категории сравниваются без учета регистра."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "201",
                    description = "Профиль построен",
                    content = @Content(schema = @Schema(implementation = QuizSubmissionResponse.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Неполный квиз (INCOMPLETE_QUIZ) или неизвестная категория (UNKNOWN_STYLE_CATEGORY)"
            )
    })
    public ResponseEntity<QuizSubmissionResponse> submit(
            @PathVariable Long userId,
            @Valid @RequestBody QuizSubmissionRequest request
    ) {
        log.info("POST /api/v1/users/{}/quiz/submissions - answers: {}", userId, request.selections().size());

        QuizSubmissionResponse response = styleProfileService.submit(userId, request.selections());

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/profile")
    @Operation(
            summary = "Текущий профиль стиля",
            description = "Профиль по последнему прохождению квиза."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Профиль найден",
                    content = @Content(schema = @Schema(implementation = StyleProfile.class))
            ),
            @ApiResponse(
                    responseCode = "404",
                    description = "Пользователь еще не проходил квиз"
            )
    })
    public ResponseEntity<StyleProfile> getProfile(@PathVariable Long userId) {
        log.info("GET /api/v1/users/{}/quiz/profile", userId);
        return ResponseEntity.ok(styleProfileService.getCurrentProfile(userId));
    }

    @GetMapping("/submissions")
    @Operation(
            summary = "История прохождений",
            description = "Все прохождения пользователя, новые первыми."
    )
    public ResponseEntity<List<QuizSubmissionResponse>> getHistory(@PathVariable Long userId) {
        log.info("GET /api/v1/users/{}/quiz/submissions", userId);
        return ResponseEntity.ok(styleProfileService.getHistory(userId));
    }
}
