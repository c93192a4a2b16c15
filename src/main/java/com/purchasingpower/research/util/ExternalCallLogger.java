package com.purchasingpower.research.util;

import com.purchasingpower.research.model.CallContext;
import com.purchasingpower.research.model.ServiceType;
import org.slf4j.Logger;

/**
 * Entry point for structured logging of calls to the model provider, search backends and web pages.
 */
public final class ExternalCallLogger {

    /** Prompts and responses are cut to this length in DEBUG output. */
    public static final int LOG_PREVIEW_CHARS = 500;

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Truncate large strings for logging (to avoid log spam)
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }

    public static String preview(String text) {
        return truncate(text, LOG_PREVIEW_CHARS);
    }
}
