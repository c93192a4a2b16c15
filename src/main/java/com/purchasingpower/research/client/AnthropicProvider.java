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
 * Anthropic Messages API provider.
 *
 * Authenticates with the {@code x-api-key} header and reads the answer from {@code content[0].text}.
 */
@Slf4j
@Component
public class AnthropicProvider implements LLMProvider {

    static final String DEFAULT_BASE_URL = "https://api.anthropic.com";
    static final String DEFAULT_API_VERSION = "2023-06-01";

    private final LlmProperties llm;
    private final ObjectMapper objectMapper;
    private final WebClient webClient;

    public AnthropicProvider(ResearchProperties props, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        this.llm = props.getLlm();
        this.objectMapper = objectMapper;
        this.webClient = webClientBuilder
                .baseUrl(isBlank(llm.getBaseUrl()) ? DEFAULT_BASE_URL : llm.getBaseUrl())
                .defaultHeader("x-api-key", llm.getApiKey() == null ? "" : llm.getApiKey())
                .defaultHeader("anthropic-version",
                        isBlank(llm.getApiVersion()) ? DEFAULT_API_VERSION : llm.getApiVersion())
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(llm.getMaxResponseBytes()))
                        .build())
                .build();
    }

    @Override
    public String chat(String prompt) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.ANTHROPIC, "messages", log);
        callCtx.logRequest("Generating text",
                "Model", llm.getModel(),
                "Prompt Length", prompt.length() + " chars",
                "Prompt", ExternalCallLogger.preview(prompt));

        Map<String, Object> body = Map.of(
                "model", llm.getModel(),
                "max_tokens", llm.getMaxTokens(),
                "temperature", llm.getTemperature(),
                "messages", List.of(Map.of("role", "user", "content", prompt)));

        String json;
        try {
            json = webClient.post()
                    .uri("/v1/messages")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
        } catch (WebClientResponseException e) {
            callCtx.logError(e.getStatusCode() + ": " + ExternalCallLogger.preview(e.getResponseBodyAsString()), e);
            if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                throw new RateLimitException("Anthropic rate limit exceeded", e);
            }
            throw new LlmCallException("Anthropic API call failed with status " + e.getStatusCode().value(),
                    e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            callCtx.logError("Request failed: " + e.getMessage(), e);
            throw new LlmCallException("Anthropic API call failed: " + e.getMessage(), e);
        }

        String text = extractText(json);
        callCtx.logResponse("Text generated successfully",
                "Response Length", text.length() + " chars",
                "Response", ExternalCallLogger.preview(text));
        return text;
    }

    private String extractText(String json) {
        if (json == null || json.isBlank()) {
            throw new LlmCallException("Anthropic returned an empty body");
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            JsonNode usage = root.path("usage");
            if (!usage.isMissingNode()) {
                log.debug("  Tokens: {} in + {} out",
                        usage.path("input_tokens").asInt(0), usage.path("output_tokens").asInt(0));
            }
            String text = root.path("content").path(0).path("text").asText("");
            if (text.isBlank()) {
                throw new LlmCallException("Anthropic response has no content[0].text");
            }
            return text;
        } catch (LlmCallException e) {
            throw e;
        } catch (Exception e) {
            throw new LlmCallException("Malformed Anthropic response envelope", e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Override
    public String getProviderName() {
        return "Anthropic";
    }
}
