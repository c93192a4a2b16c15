package com.purchasingpower.research.exception;

import lombok.Getter;

/**
 * A model response could not be deserialized into the expected structure.
 */
@Getter
public class StructuredOutputException extends RuntimeException {

    private final String rawResponse;

    public StructuredOutputException(String message, String rawResponse) {
        this(message, rawResponse, null);
    }

    public StructuredOutputException(String message, String rawResponse, Throwable cause) {
        super(message, cause);
        this.rawResponse = rawResponse;
    }
}
