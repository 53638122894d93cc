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
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import ru.tigran.stylistengine.dto.ClothingItemRequest;
import ru.tigran.stylistengine.dto.ClothingItemResponse;
import ru.tigran.stylistengine.dto.ItemFeaturesResponse;
import ru.tigran.stylistengine.exception.ErrorCode;
import ru.tigran.stylistengine.exception.ValidationException;
import ru.tigran.stylistengine.fusion.GarmentAnalysisService;
import ru.tigran.stylistengine.service.ClosetService;

import java.io.IOException;
import java.util.List;

/**
 * REST API гардероба: вещи и анализ их изображений.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/users/{userId}/closet/items")
@Tag(name = "Closet", description = "Вещи гардероба и извлечение признаков из фото")
public class ClosetController {

    private final ClosetService closetService;
    private final GarmentAnalysisService garmentAnalysisService;

    public ClosetController(ClosetService closetService, GarmentAnalysisService garmentAnalysisService) {
        this.closetService = closetService;
        this.garmentAnalysisService = garmentAnalysisService;
    }

    @PostMapping
    @Operation(
            summary = "Добавить вещь",
            description = "Создает вещь в гардеробе. Категория, цвет и бренд опциональны: " +
                    "после анализа фото незаполненные поля берутся из признаков."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "201",
                    description = "Вещь создана",
                    content = @Content(schema = @Schema(implementation = ClothingItemResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "Неверные параметры запроса")
    })
    public ResponseEntity<ClothingItemResponse> createItem(
            @PathVariable Long userId,
            @Valid @RequestBody ClothingItemRequest request
    ) {
        log.info("POST /api/v1/users/{}/closet/items - name: {}", userId, request.name());
        return ResponseEntity.status(HttpStatus.CREATED).body(closetService.createItem(userId, request));
    }

    @GetMapping
    @Operation(summary = "Все вещи", description = "Вещи пользователя в порядке добавления.")
    public ResponseEntity<List<ClothingItemResponse>> listItems(@PathVariable Long userId) {
        log.info("GET /api/v1/users/{}/closet/items", userId);
        return ResponseEntity.ok(closetService.listItems(userId));
    }

    @GetMapping("/{itemId}")
    @Operation(summary = "Вещь по ID", description = "Возвращает вещь, если она принадлежит пользователю.")
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Вещь найдена",
                    content = @Content(schema = @Schema(implementation = ClothingItemResponse.class))
            ),
            @ApiResponse(responseCode = "404", description = "Вещь не найдена")
    })
    public ResponseEntity<ClothingItemResponse> getItem(@PathVariable Long userId, @PathVariable Long itemId) {
        log.info("GET /api/v1/users/{}/closet/items/{}", userId, itemId);
        return ResponseEntity.ok(closetService.getItem(userId, itemId));
    }

    /**
     * Загрузить фото вещи и извлечь признаки.
     * Источники признаков вызываются параллельно; результат по одному и тому же изображению кешируется.
     */
    @PostMapping(value = "/{itemId}/analysis", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(
            summary = "Анализ фото вещи",
            description = "Извлекает признаки из изображения тремя источниками (fashion-модель, " +
                    "vision-модель, цвет/бренд эвристика), сливает их в consensus и сохраняет на вещи."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Признаки извлечены и сохранены",
                    content = @Content(schema = @Schema(implementation = ClothingItemResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "Пустое изображение"),
            @ApiResponse(responseCode = "404", description = "Вещь не найдена"),
            @ApiResponse(responseCode = "503", description = "Ни один источник признаков не ответил")
    })
    public ResponseEntity<ClothingItemResponse> analyze(
            @PathVariable Long userId,
            @PathVariable Long itemId,
            @RequestPart("image") MultipartFile image
    ) {
        log.info("POST /api/v1/users/{}/closet/items/{}/analysis - size: {} bytes", userId, itemId, image.getSize());
        return ResponseEntity.ok(garmentAnalysisService.analyze(userId, itemId, readImage(image)));
    }

    @GetMapping("/{itemId}/features")
    @Operation(summary = "Признаки вещи", description = "Сохраненный consensus и provenance по источникам.")
    public ResponseEntity<ItemFeaturesResponse> getFeatures(@PathVariable Long userId, @PathVariable Long itemId) {
        log.info("GET /api/v1/users/{}/closet/items/{}/features", userId, itemId);
        return ResponseEntity.ok(closetService.getFeatures(userId, itemId));
    }

    private static byte[] readImage(MultipartFile image) {
        try {
            return image.getBytes();
        } catch (IOException e) {
            throw new ValidationException("Failed to read uploaded image: " + e.getMessage(),
                    ErrorCode.EMPTY_IMAGE.getCode());
        }
    }
}
