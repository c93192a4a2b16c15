package com.purchasingpower.research.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Prompt template loaded from YAML.
 *
 * <pre>
 * name: extract
 * version: 1.0
 * systemPrompt: |
 *   You are a careful fact extractor...
 * userPrompt: |
 *   Question: {{{question}}}
 * </pre>
 *
 * @see com.purchasingpower.research.service.PromptLibraryService
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptTemplate {
    private String name;
    private String version;
    private String description;
    private String systemPrompt;
    private String userPrompt;
}
