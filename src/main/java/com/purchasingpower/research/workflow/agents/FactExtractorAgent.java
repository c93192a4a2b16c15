package com.purchasingpower.research.workflow.agents;

import com.purchasingpower.research.client.LanguageModelClient;
import com.purchasingpower.research.configuration.AgentProperties;
import com.purchasingpower.research.configuration.ResearchProperties;
import com.purchasingpower.research.exception.StructuredOutputException;
import com.purchasingpower.research.model.llm.ExtractionPayload;
import com.purchasingpower.research.model.research.Confidence;
import com.purchasingpower.research.model.research.Fact;
import com.purchasingpower.research.model.research.Source;
import com.purchasingpower.research.service.PromptLibraryService;
import com.purchasingpower.research.util.StructuredOutputParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Pulls attributed factual claims out of one source.
 *
 * Failures are not handled here. A malformed response raises {@link StructuredOutputException}
 * and a failed model call raises {@link com.purchasingpower.research.exception.LlmCallException};
 * the orchestrator decides what a failed source means for the run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FactExtractorAgent {

    private final LanguageModelClient llmClient;
    private final PromptLibraryService promptLibrary;
    private final StructuredOutputParser outputParser;
    private final ResearchProperties props;

    public List<Fact> extract(Source source, String question) {
        AgentProperties agent = props.getAgent();

        String content = source.getContent();
        if (content.length() > agent.getMaxExtractionChars()) {
            content = content.substring(0, agent.getMaxExtractionChars());
        }

        log.info("🔎 Extracting facts from: {}", source.getUrl());

        String prompt = promptLibrary.render(PromptLibraryService.EXTRACT, Map.of(
                "question", question,
                "url", source.getUrl(),
                "content", content,
                "factsPerSource", agent.getFactsPerSource()));

        String response = llmClient.call(prompt);
        ExtractionPayload payload = outputParser.parse(response, ExtractionPayload.class);
        if (payload.getFacts() == null) {
            throw new StructuredOutputException("Extraction response has no 'facts' array", response);
        }

        List<Fact> facts = new ArrayList<>();
        for (ExtractionPayload.ExtractedFact extracted : payload.getFacts()) {
            if (extracted == null || extracted.getClaim() == null || extracted.getClaim().isBlank()) {
                continue;
            }
            facts.add(Fact.builder()
                    .claim(extracted.getClaim().strip())
                    .caveat(normalizeCaveat(extracted.getCaveat()))
                    .confidence(Confidence.normalize(extracted.getConfidence()))
                    .sourceUrl(source.getUrl())
                    .build());
        }

        log.info("✅ Extracted {} facts from {}", facts.size(), source.getUrl());
        return facts;
    }

    private static String normalizeCaveat(String caveat) {
        if (caveat == null) {
            return null;
        }
        String trimmed = caveat.strip();
        if (trimmed.isEmpty() || "null".equalsIgnoreCase(trimmed)) {
            return null;
        }
        return trimmed;
    }
}
