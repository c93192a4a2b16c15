package com.purchasingpower.research.exception;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when a research run gathers no usable source across all of its sub-queries.
 * This is the only condition that aborts a run.
 */
@Getter
public class NoSourcesException extends RuntimeException {

    private final String question;
    private final List<String> subQueries;

    public NoSourcesException(String question, List<String> subQueries) {
        super("No sources found or all content fetches failed. "
                + "Check your internet connection or try a different question.");
        this.question = question;
        this.subQueries = List.copyOf(subQueries);
    }
}
