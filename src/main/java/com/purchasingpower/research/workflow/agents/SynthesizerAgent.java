package com.purchasingpower.research.workflow.agents;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.research.client.LanguageModelClient;
import com.purchasingpower.research.exception.StructuredOutputException;
import com.purchasingpower.research.model.llm.SynthesisPayload;
import com.purchasingpower.research.model.research.Confidence;
import com.purchasingpower.research.model.research.Contradiction;
import com.purchasingpower.research.model.research.Fact;
import com.purchasingpower.research.model.research.Synthesis;
import com.purchasingpower.research.service.PromptLibraryService;
import com.purchasingpower.research.util.StructuredOutputParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reconciles the facts from every source into agreements, contradictions, gaps and an answer.
 *
 * <p>Never throws. When the model call or its output fails, a deterministic answer is built from
 * the facts themselves.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SynthesizerAgent {

    static final String FALLBACK_AGREEMENT = "Multiple sources found";
    static final String FALLBACK_GAP = "Detailed analysis unavailable due to synthesis error";

    private final LanguageModelClient llmClient;
    private final PromptLibraryService promptLibrary;
    private final StructuredOutputParser outputParser;
    private final ObjectMapper objectMapper;

    public Synthesis synthesize(String question, List<Fact> facts) {
        if (facts == null || facts.isEmpty()) {
            log.warn("⚠️ No facts to synthesize");
            return Synthesis.noFacts();
        }

        long sourceCount = facts.stream().map(Fact::getSourceUrl).distinct().count();
        log.info("🧠 Synthesizing {} facts from {} sources", facts.size(), sourceCount);

        try {
            String prompt = promptLibrary.render(PromptLibraryService.SYNTHESIZE, Map.of(
                    "question", question,
                    "numSources", sourceCount,
                    "factsJson", toFactsJson(facts)));

            String response = llmClient.call(prompt);
            Synthesis synthesis = toSynthesis(outputParser.parse(response, SynthesisPayload.class), response);

            log.info("✅ Synthesis complete: {} agreements, {} contradictions, {} gaps",
                    synthesis.getAgreements().size(),
                    synthesis.getContradictions().size(),
                    synthesis.getGaps().size());
            return synthesis;

        } catch (Exception e) {
            log.error("Synthesis failed, using fallback answer: {}", e.getMessage());
            return fallback(facts);
        }
    }

    private String toFactsJson(List<Fact> facts) throws JsonProcessingException {
        List<Map<String, Object>> rows = facts.stream()
                .map(fact -> {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("claim", fact.getClaim());
                    row.put("caveat", fact.getCaveat());
                    row.put("confidence", fact.getConfidence().toValue());
                    row.put("source", fact.getSourceUrl());
                    return row;
                })
                .toList();
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(rows);
    }

    private Synthesis toSynthesis(SynthesisPayload payload, String response) {
        if (payload.getAnswer() == null || payload.getAnswer().isBlank()) {
            throw new StructuredOutputException("Synthesis response has no answer", response);
        }

        List<Contradiction> contradictions = payload.getContradictions() == null ? List.of()
                : payload.getContradictions().stream()
                .filter(Objects::nonNull)
                .map(c -> Contradiction.builder()
                        .issue(c.getIssue())
                        .sources(c.getSources() == null ? List.of()
                                : c.getSources().stream().filter(Objects::nonNull).toList())
                        .explanation(c.getExplanation())
                        .build())
                .toList();

        return Synthesis.builder()
                .agreements(nonBlank(payload.getAgreements()))
                .contradictions(contradictions)
                .gaps(nonBlank(payload.getGaps()))
                .answer(payload.getAnswer().strip())
                .build();
    }

    private static List<String> nonBlank(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().filter(v -> v != null && !v.isBlank()).toList();
    }

    /**
     * Answer assembled from the facts alone, used when the model cannot produce one.
     */
    static Synthesis fallback(List<Fact> facts) {
        List<String> highClaims = facts.stream()
                .filter(f -> f.getConfidence() == Confidence.HIGH)
                .map(Fact::getClaim)
                .toList();

        String answer;
        if (!highClaims.isEmpty()) {
            answer = "Based on " + highClaims.size() + " high-confidence sources: "
                    + String.join(" ", highClaims.subList(0, Math.min(3, highClaims.size())));
        } else {
            answer = "Multiple sources discuss this topic, but confidence levels vary. Key points include: "
                    + (facts.isEmpty() ? "No clear consensus." : facts.get(0).getClaim());
        }

        return Synthesis.builder()
                .agreements(List.of(FALLBACK_AGREEMENT))
                .contradictions(List.of())
                .gaps(List.of(FALLBACK_GAP))
                .answer(answer)
                .build();
    }
}
