package com.purchasingpower.research.model.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Wire shape of the synthesis response.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SynthesisPayload {

    private List<String> agreements;
    private List<ContradictionEntry> contradictions;
    private List<String> gaps;
    private String answer;

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContradictionEntry {
        private String issue;
        private List<String> sources;
        private String explanation;
    }
}
