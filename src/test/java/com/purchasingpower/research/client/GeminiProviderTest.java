package com.purchasingpower.research.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.research.configuration.ResearchProperties;
import com.purchasingpower.research.exception.LlmCallException;
import com.purchasingpower.research.exception.RateLimitException;
import com.purchasingpower.research.support.StubExchange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Gemini Provider Tests")
class GeminiProviderTest {

    private ResearchProperties props;
    private StubExchange exchange;

    @BeforeEach
    void setUp() {
        props = new ResearchProperties();
        props.getLlm().setProvider("gemini");
        props.getLlm().setApiKey("g-key");
        props.getLlm().setModel("gemini-1.5-flash");
        exchange = new StubExchange();
    }

    @Test
    @DisplayName("Returns first candidate text, key in header not URL")
    void testChat_ShouldReturnCandidateText() {
        // Given
        exchange.respondJson(HttpStatus.OK, """
                {"candidates": [{"content": {"parts": [{"text": "hello"}]}}],
                 "usageMetadata": {"promptTokenCount": 3, "candidatesTokenCount": 1}}
                """);
        GeminiProvider provider = new GeminiProvider(props, exchange.builder(), new ObjectMapper());

        // When
        String text = provider.chat("Say hello");

        // Then
        assertThat(text).isEqualTo("hello");
        ClientRequest request = exchange.getRequests().get(0);
        assertThat(request.url().toString())
                .isEqualTo("https://generativelanguage.googleapis.com/v1beta/models/gemini-1.5-flash:generateContent");
        assertThat(request.headers().getFirst("x-goog-api-key")).isEqualTo("g-key");
    }

    @Test
    @DisplayName("Quota exhaustion becomes RateLimitException")
    void testChat_ShouldMapTooManyRequests() {
        exchange.respondJson(HttpStatus.TOO_MANY_REQUESTS, "{\"error\": {\"code\": 429}}");
        GeminiProvider provider = new GeminiProvider(props, exchange.builder(), new ObjectMapper());

        assertThatThrownBy(() -> provider.chat("prompt")).isInstanceOf(RateLimitException.class);
    }

    @Test
    @DisplayName("Missing candidates is malformed")
    void testChat_ShouldRejectMissingCandidates() {
        exchange.respondJson(HttpStatus.OK, "{\"promptFeedback\": {\"blockReason\": \"SAFETY\"}}");
        GeminiProvider provider = new GeminiProvider(props, exchange.builder(), new ObjectMapper());

        assertThatThrownBy(() -> provider.chat("prompt")).isInstanceOf(LlmCallException.class);
    }
}
