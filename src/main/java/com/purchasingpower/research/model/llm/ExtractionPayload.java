package com.purchasingpower.research.model.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Wire shape of the fact extraction response.
 * <pre>
 * {"facts": [{"claim": "...", "caveat": "...", "confidence": "high"}]}
 * </pre>
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExtractionPayload {

    private List<ExtractedFact> facts;

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ExtractedFact {
        private String claim;
        private String caveat;
        private String confidence;
    }
}
