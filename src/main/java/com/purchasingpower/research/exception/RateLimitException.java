package com.purchasingpower.research.exception;

/**
 * The model provider rejected the call with HTTP 429. Retried with backoff by
 * {@link com.purchasingpower.research.client.LanguageModelClient}.
 */
public class RateLimitException extends LlmCallException {

    public RateLimitException(String message, Throwable cause) {
        super(message, 429, cause);
    }
}
