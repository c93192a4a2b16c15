package com.purchasingpower.research.model.research;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
public class Contradiction {
    String issue;
    List<String> sources;
    String explanation;

    @Builder
    public Contradiction(String issue, List<String> sources, String explanation) {
        this.issue = issue;
        this.sources = sources == null ? List.of() : List.copyOf(sources);
        this.explanation = explanation;
    }
}
