package com.purchasingpower.research.exception;

import lombok.Getter;

/**
 * A language model call failed and will not be retried.
 */
@Getter
public class LlmCallException extends RuntimeException {

    /**
     * HTTP status of the failed call, or -1 when the failure happened before a response arrived.
     */
    private final int statusCode;

    public LlmCallException(String message) {
        this(message, -1, null);
    }

    public LlmCallException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public LlmCallException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }
}
