package com.purchasingpower.research.exception;

/**
 * Invalid or incomplete configuration detected at startup, before any research run.
 */
public class ResearchConfigurationException extends RuntimeException {

    public ResearchConfigurationException(String message) {
        super(message);
    }
}
