package com.purchasingpower.research.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.research.exception.StructuredOutputException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns a model response into a typed value.
 *
 * <p>Parsing is strict first. If the trimmed text is not valid JSON for the target type, exactly one
 * recovery is attempted: the span from the first opening delimiter ({@code [} or {@code {}) to the
 * last matching closing delimiter is parsed instead. That covers markdown fences and short preambles
 * around the payload. Anything else is a {@link StructuredOutputException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StructuredOutputParser {

    private final ObjectMapper objectMapper;

    public <T> T parse(String response, Class<T> type) {
        return parse(response, objectMapper.constructType(type));
    }

    public <T> T parse(String response, TypeReference<T> type) {
        return parse(response, objectMapper.getTypeFactory().constructType(type));
    }

    private <T> T parse(String response, JavaType type) {
        if (response == null || response.isBlank()) {
            throw new StructuredOutputException("Model returned an empty response", response);
        }

        String trimmed = response.trim();
        try {
            return read(trimmed, type);
        } catch (JsonProcessingException strictFailure) {
            log.debug("Strict parse as {} failed: {}", type.getTypeName(), strictFailure.getOriginalMessage());

            String candidate = extractDelimitedSpan(trimmed);
            if (candidate == null) {
                log.debug("Unparseable model response: {}", ExternalCallLogger.preview(response));
                throw new StructuredOutputException(
                        "No JSON payload found in model response", response, strictFailure);
            }

            try {
                return read(candidate, type);
            } catch (JsonProcessingException recoveryFailure) {
                log.debug("Unparseable model response: {}", ExternalCallLogger.preview(response));
                throw new StructuredOutputException(
                        "Model response is not valid JSON for " + type.getTypeName(), response, recoveryFailure);
            }
        }
    }

    private <T> T read(String json, JavaType type) throws JsonProcessingException {
        T value = objectMapper.readValue(json, type);
        if (value == null) {
            throw new StructuredOutputException("Model response deserialized to null", json);
        }
        return value;
    }

    /**
     * Span from the first {@code [} or {@code {} to the last matching closer, or null when there is none.
     */
    static String extractDelimitedSpan(String text) {
        int array = text.indexOf('[');
        int object = text.indexOf('{');

        int start;
        char closer;
        if (array >= 0 && (object < 0 || array < object)) {
            start = array;
            closer = ']';
        } else if (object >= 0) {
            start = object;
            closer = '}';
        } else {
            return null;
        }

        int end = text.lastIndexOf(closer);
        if (end <= start) {
            return null;
        }
        return text.substring(start, end + 1);
    }
}
