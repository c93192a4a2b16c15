package com.purchasingpower.research.client;

/**
 * A hosted language model backend (Anthropic, Gemini).
 *
 * Implementations perform exactly one HTTP round trip per call. Retrying is the caller's job,
 * see {@link LanguageModelClient}.
 */
public interface LLMProvider {

    /**
     * Send a single-turn prompt and return the model's text.
     *
     * @param prompt the fully rendered prompt
     * @return the raw response text, never blank
     * @throws com.purchasingpower.research.exception.RateLimitException when the backend answers 429
     * @throws com.purchasingpower.research.exception.LlmCallException for any other failure
     */
    String chat(String prompt);

    /**
     * Get the provider name (for logging).
     */
    String getProviderName();
}
