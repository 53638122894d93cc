package ru.tigran.stylistengine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import ru.tigran.stylistengine.exception.AIGatewayException;
import ru.tigran.stylistengine.exception.ErrorCode;
import ru.tigran.stylistengine.exception.RetriableHttpException;

import java.util.Base64;

/**
 * Клиент OpenRouter chat-completions.
 *
 * Используется в двух местах: описание изображения одежды vision-моделью
 * (один из источников признаков) и генерация текстового описания образа.
 * Оба вызова идут через circuit breaker {@code aiProvider}.
 */
@Slf4j
@Service
public class AIGatewayService {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker circuitBreaker;
    private final String apiUrl;
    private final String apiKey;
    private final String textModel;
    private final String visionModel;
    private final long retryDelayMs;
    private final int maxRetries;
    private final int retryBackoffMultiplier;

    // Maximum backoff delay to prevent excessive thread blocking (8 seconds max per retry)
    private static final long MAX_BACKOFF_MS = 8000;
    // Maximum response size (1 MB)
    private static final long MAX_RESPONSE_SIZE_BYTES = 1024 * 1024;

    private static final String VISION_SYSTEM_PROMPT = """
            You are a fashion image analyst. Describe the single garment in the photo.

            OUTPUT FORMAT (CRITICAL):
            - Return ONLY raw JSON object - NO markdown formatting, NO code blocks
            - Structure: {"features": {"<namespace>:<value>": <confidence 0.0-1.0>, ...}}
            - Allowed namespaces: category, color, style, material, occasion, brand, detail
            - category is one of: top, bottom, shoes, outerwear, accessory, dress, or a specific garment type
            - Values are lower-case English words, use hyphens instead of spaces (e.g. "color:light-blue")
            - Include only features you can actually see
            """;

    public AIGatewayService(
            RestClient restClient,
            ObjectMapper objectMapper,
            @Qualifier("aiProviderCircuitBreaker") CircuitBreaker circuitBreaker,
            @Value("${app.openrouter.api-url:https://openrouter.ai/api/v1/chat/completions}") String apiUrl,
            @Value("${app.openrouter.api-key}") String apiKey,
            @Value("${app.openrouter.model}") String textModel,
            @Value("${app.openrouter.vision-model}") String visionModel,
            @Value("${app.openrouter.retry-delay-ms:1000}") long retryDelayMs,
            @Value("${app.ai.max-retries:3}") int maxRetries,
            @Value("${app.ai.retry-backoff-multiplier:2}") int retryBackoffMultiplier
    ) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.circuitBreaker = circuitBreaker;
        this.apiUrl = apiUrl;
        this.apiKey = apiKey;
        this.textModel = textModel;
        this.visionModel = visionModel;
        this.retryDelayMs = retryDelayMs;
        this.maxRetries = maxRetries;
        this.retryBackoffMultiplier = retryBackoffMultiplier;
    }

    /**
     * Asks the vision-language model to describe a garment image.
     *
     * Expected response structure:
     * {
     *   "features": { "category:top": 0.9, "color:navy": 0.8, "style:casual": 0.7 }
     * }
     *
     * @param image raw image bytes (JPEG or PNG)
     * @return validated JSON string containing a "features" object
     */
    public String describeImage(byte[] image) {
        log.debug("Requesting vision description for image of {} bytes", image.length);

        String dataUrl = "data:" + detectMimeType(image) + ";base64," + Base64.getEncoder().encodeToString(image);
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", visionModel);
        ArrayNode messages = root.putArray("messages");

        ObjectNode system = messages.addObject();
        system.put("role", "system");
        system.put("content", VISION_SYSTEM_PROMPT);

        ObjectNode user = messages.addObject();
        user.put("role", "user");
        ArrayNode content = user.putArray("content");
        content.addObject()
                .put("type", "text")
                .put("text", "Describe this garment.");
        content.addObject()
                .put("type", "image_url")
                .putObject("image_url").put("url", dataUrl);

        String response = callAIProvider(root);
        JsonNode parsed = validateJSON(response);
        if (!parsed.path("features").isObject()) {
            throw AIGatewayException.invalidResponse("Vision response has no 'features' object");
        }
        return response;
    }

    /**
     * Generates a structured outfit description.
     *
     * Expected response structure:
     * {
     *   "top": {"type": "shirt", "features": ["cotton", "slim fit"], "color": "white"},
     *   "bottom": {...}, "shoes": {...}, "outerwear": {...},
     *   "accessories": [{"type": "watch", "features": [...], "color": "silver"}]
     * }
     *
     * @return validated JSON object string
     */
    public String generateOutfitDescription(String systemPrompt, String userMessage) {
        log.info("Generating outfit description, prompt length {}", userMessage.length());

        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", textModel);
        ArrayNode messages = root.putArray("messages");
        ObjectNode system = messages.addObject();
        system.put("role", "system");
        system.put("content", systemPrompt);
        ObjectNode user = messages.addObject();
        user.put("role", "user");
        user.put("content", userMessage);

        String response = callAIProvider(root);
        JsonNode parsed = validateJSON(response);
        if (!parsed.isObject()) {
            throw AIGatewayException.invalidResponse("Outfit description is not a JSON object");
        }
        return response;
    }

    public String getConfiguredModel() {
        return textModel;
    }

    private String callAIProvider(ObjectNode requestBody) {
        try {
            return circuitBreaker.executeSupplier(() -> callWithRetries(requestBody));
        } catch (CallNotPermittedException e) {
            log.warn("AI provider circuit breaker is open, call rejected");
            throw new AIGatewayException(
                "AI provider temporarily unavailable",
                ErrorCode.AI_SERVICE_ERROR.getCode(),
                true,
                e
            );
        }
    }

    /**
     * Calls OpenRouter with retry logic for 429/502/503/504.
     */
    private String callWithRetries(ObjectNode requestBody) {
        String body = requestBody.toString();
        String model = requestBody.path("model").asText();

        int attempt = 0;
        while (attempt < maxRetries) {
            try {
                log.debug("callAIProvider - attempt {}/{}, model={}", attempt + 1, maxRetries, model);

                String response = restClient.post()
                        .uri(apiUrl)
                        .header("Authorization", "Bearer " + apiKey)
                        .header("Content-Type", "application/json")
                        .body(body)
                        .retrieve()
                        .onStatus(HttpStatusCode::isError, (request, errorResponse) -> {
                            int statusCode = errorResponse.getStatusCode().value();

                            if (RetriableHttpException.isRetriableStatus(statusCode)) {
                                log.warn("Retriable HTTP error {} from OpenRouter, will retry", statusCode);
                                throw new RetriableHttpException(
                                    statusCode,
                                    String.format("Retriable error from OpenRouter: %d %s", statusCode, errorResponse.getStatusText())
                                );
                            }

                            log.error("OpenRouter API error: {} {}", statusCode, errorResponse.getStatusText());
                            throw new AIGatewayException(
                                "OpenRouter API error: " + statusCode,
                                ErrorCode.AI_SERVICE_ERROR.getCode(),
                                false
                            );
                        })
                        .body(String.class);

                String content = extractMessageContent(response);
                log.info("AI response received: model={}, attempt={}/{}, length={}",
                    model, attempt + 1, maxRetries, content.length());
                if (log.isDebugEnabled()) {
                    log.debug("AI response (first 800 chars): {}",
                        content.length() > 800 ? content.substring(0, 800) + "..." : content);
                }
                return content;

            } catch (RetriableHttpException e) {
                attempt++;
                if (attempt >= maxRetries) {
                    throw new AIGatewayException(
                        "Max retries exceeded for retriable HTTP error: " + e.getStatusCode(),
                        ErrorCode.AI_SERVICE_ERROR.getCode(),
                        true,
                        e
                    );
                }
                sleepBeforeRetry(attempt);
            } catch (AIGatewayException e) {
                throw e;
            } catch (Exception e) {
                log.error("Error calling OpenRouter API", e);
                throw new AIGatewayException(
                    "Failed to call OpenRouter API: " + e.getMessage(),
                    ErrorCode.AI_SERVICE_ERROR.getCode(),
                    false,
                    e
                );
            }
        }
        throw new AIGatewayException("Failed after max retries", ErrorCode.AI_SERVICE_ERROR.getCode(), true);
    }

    private void sleepBeforeRetry(int attempt) {
        long backoffMs = calculateBackoffDelay(retryDelayMs, attempt, retryBackoffMultiplier);
        try {
            log.info("Retrying after {} ms (attempt {}/{})", backoffMs, attempt, maxRetries);
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new AIGatewayException(
                "Interrupted during retry",
                ErrorCode.AI_SERVICE_ERROR.getCode(),
                false,
                ie
            );
        }
    }

    /**
     * Exponential backoff capped at MAX_BACKOFF_MS.
     *
     * @param attemptNumber current attempt number (1-based)
     */
    static long calculateBackoffDelay(long baseDelayMs, int attemptNumber, int multiplier) {
        long backoffMs = baseDelayMs * (long) Math.pow(multiplier, attemptNumber - 1);
        return Math.min(backoffMs, MAX_BACKOFF_MS);
    }

    private void validateResponseSize(String responseBody) {
        if (responseBody == null) {
            return;
        }
        long responseSizeBytes = responseBody.length();
        if (responseSizeBytes > MAX_RESPONSE_SIZE_BYTES) {
            String errorMsg = String.format(
                "API response exceeds maximum allowed size. Response size: %d bytes, max allowed: %d bytes",
                responseSizeBytes,
                MAX_RESPONSE_SIZE_BYTES
            );
            log.error(errorMsg);
            throw new AIGatewayException(errorMsg, ErrorCode.AI_SERVICE_ERROR.getCode(), false);
        }
    }

    /**
     * Extracts choices[0].message.content from the chat-completions response.
     */
    private String extractMessageContent(String response) {
        validateResponseSize(response);
        try {
            JsonNode root = objectMapper.readTree(response);
            JsonNode content = root.at("/choices/0/message/content");
            if (content == null || content.isNull() || content.isMissingNode()) {
                log.error("Missing content in API response. Preview: {}",
                    response.length() > 200 ? response.substring(0, 200) : response);
                throw new AIGatewayException(
                    "Missing content in API response",
                    ErrorCode.INVALID_AI_RESPONSE.getCode(),
                    false
                );
            }
            return cleanMarkdownCodeBlocks(content.asText());
        } catch (AIGatewayException e) {
            throw e;
        } catch (Exception e) {
            throw new AIGatewayException(
                "Failed to parse API response: " + e.getMessage(),
                ErrorCode.AI_SERVICE_ERROR.getCode(),
                false,
                e
            );
        }
    }

    /**
     * Removes ```json ... ``` wrapping if the model added it anyway.
     */
    static String cleanMarkdownCodeBlocks(String content) {
        if (content == null || content.isEmpty()) {
            return content;
        }
        String cleaned = content.trim();
        if (cleaned.startsWith("```")) {
            int firstNewline = cleaned.indexOf('\n');
            if (firstNewline != -1) {
                cleaned = cleaned.substring(firstNewline + 1);
            } else {
                cleaned = cleaned.substring(3);
                if (cleaned.startsWith("json")) {
                    cleaned = cleaned.substring(4);
                }
            }
            if (cleaned.endsWith("```")) {
                cleaned = cleaned.substring(0, cleaned.length() - 3);
            }
            cleaned = cleaned.trim();
        }
        return cleaned;
    }

    private JsonNode validateJSON(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (Exception e) {
            throw new AIGatewayException(
                "Invalid JSON in response: " + e.getMessage(),
                ErrorCode.INVALID_JSON_RESPONSE.getCode(),
                false,
                e
            );
        }
    }

    private static String detectMimeType(byte[] image) {
        if (image.length >= 4 && (image[0] & 0xFF) == 0x89 && image[1] == 'P' && image[2] == 'N' && image[3] == 'G') {
            return "image/png";
        }
        if (image.length >= 4 && image[0] == 'R' && image[1] == 'I' && image[2] == 'F' && image[3] == 'F') {
            return "image/webp";
        }
        return "image/jpeg";
    }
}
