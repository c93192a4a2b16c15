package com.purchasingpower.research.model.research;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Everything one research run produced.
 */
@Value
public class ResearchReport {
    String question;
    List<String> subQueries;
    List<Source> sources;
    List<Fact> facts;
    Synthesis synthesis;
    Instant timestamp;

    @Builder
    public ResearchReport(String question, List<String> subQueries, List<Source> sources,
                          List<Fact> facts, Synthesis synthesis, Instant timestamp) {
        this.question = question;
        this.subQueries = subQueries == null ? List.of() : List.copyOf(subQueries);
        this.sources = sources == null ? List.of() : List.copyOf(sources);
        this.facts = facts == null ? List.of() : List.copyOf(facts);
        this.synthesis = synthesis;
        this.timestamp = timestamp;
    }
}
