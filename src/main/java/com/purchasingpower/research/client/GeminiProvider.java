package com.purchasingpower.research.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.research.configuration.LlmProperties;
import com.purchasingpower.research.configuration.ResearchProperties;
import com.purchasingpower.research.exception.LlmCallException;
import com.purchasingpower.research.exception.RateLimitException;
import com.purchasingpower.research.model.CallContext;
import com.purchasingpower.research.model.ServiceType;
import com.purchasingpower.research.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.List;
import java.util.Map;

/**
 * Google Gemini provider, selected with {@code app.llm.provider: gemini}.
 *
 * The API key travels in the {@code x-goog-api-key} header, never in the URL.
 */
@Slf4j
@Component
public class GeminiProvider implements LLMProvider {

    static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com";
    static final String DEFAULT_API_VERSION = "v1beta";

    private final LlmProperties llm;
    private final ObjectMapper objectMapper;
    private final WebClient webClient;

    public GeminiProvider(ResearchProperties props, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        this.llm = props.getLlm();
        this.objectMapper = objectMapper;
        this.webClient = webClientBuilder
                .baseUrl(isBlank(llm.getBaseUrl()) ? DEFAULT_BASE_URL : llm.getBaseUrl())
                .defaultHeader("x-goog-api-key", llm.getApiKey() == null ? "" : llm.getApiKey())
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(llm.getMaxResponseBytes()))
                        .build())
                .build();
    }

    private String getApiUrl() {
        String version = isBlank(llm.getApiVersion()) ? DEFAULT_API_VERSION : llm.getApiVersion();
        return String.format("/%s/models/%s:generateContent", version, llm.getModel());
    }

    @Override
    public String chat(String prompt) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.GEMINI, "generateContent", log);
        callCtx.logRequest("Generating text",
                "Model", llm.getModel(),
                "Prompt Length", prompt.length() + " chars",
                "Prompt", ExternalCallLogger.preview(prompt));

        Map<String, Object> body = Map.of(
                "contents", List.of(Map.of("parts", List.of(Map.of("text", prompt)))),
                "generationConfig", Map.of(
                        "temperature", llm.getTemperature(),
                        "maxOutputTokens", llm.getMaxTokens()));

        String json;
        try {
            json = webClient.post()
                    .uri(getApiUrl())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
        } catch (WebClientResponseException e) {
            callCtx.logError(e.getStatusCode() + ": " + ExternalCallLogger.preview(e.getResponseBodyAsString()), e);
            if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                throw new RateLimitException("Gemini quota exhausted", e);
            }
            throw new LlmCallException("Gemini API call failed with status " + e.getStatusCode().value(),
                    e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            callCtx.logError("Request failed: " + e.getMessage(), e);
            throw new LlmCallException("Gemini API call failed: " + e.getMessage(), e);
        }

        String text = extractText(json);
        callCtx.logResponse("Text generated successfully",
                "Response Length", text.length() + " chars",
                "Response", ExternalCallLogger.preview(text));
        return text;
    }

    private String extractText(String json) {
        if (json == null || json.isBlank()) {
            throw new LlmCallException("Gemini returned an empty body");
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            JsonNode usageMetadata = root.path("usageMetadata");
            log.debug("  Tokens: {} in + {} out",
                    usageMetadata.path("promptTokenCount").asInt(0),
                    usageMetadata.path("candidatesTokenCount").asInt(0));

            String text = root.path("candidates").path(0)
                    .path("content").path("parts").path(0)
                    .path("text").asText("");
            if (text.isBlank()) {
                throw new LlmCallException("Gemini response has no candidate text");
            }
            return text;
        } catch (LlmCallException e) {
            throw e;
        } catch (Exception e) {
            throw new LlmCallException("Malformed Gemini response envelope", e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Override
    public String getProviderName() {
        return "Gemini";
    }
}
