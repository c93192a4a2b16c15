package com.purchasingpower.research.model.research;

import com.google.common.base.Preconditions;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Cross-source analysis of all extracted facts.
 */
@Value
public class Synthesis {

    public static final String NO_SOURCES_GAP = "No sources found with relevant information";
    public static final String NO_SOURCES_ANSWER = "Unable to answer the question due to lack of sources.";

    List<String> agreements;
    List<Contradiction> contradictions;
    List<String> gaps;
    String answer;

    @Builder
    public Synthesis(List<String> agreements, List<Contradiction> contradictions, List<String> gaps, String answer) {
        Preconditions.checkArgument(answer != null && !answer.isBlank(), "Synthesis answer must not be blank");
        this.agreements = agreements == null ? List.of() : List.copyOf(agreements);
        this.contradictions = contradictions == null ? List.of() : List.copyOf(contradictions);
        this.gaps = gaps == null ? List.of() : List.copyOf(gaps);
        this.answer = answer;
    }

    /**
     * Result used when there is nothing to synthesize.
     */
    public static Synthesis noFacts() {
        return Synthesis.builder()
                .gaps(List.of(NO_SOURCES_GAP))
                .answer(NO_SOURCES_ANSWER)
                .build();
    }
}
