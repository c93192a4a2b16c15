package com.purchasingpower.research.workflow.agents;

import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.base.Preconditions;
import com.purchasingpower.research.client.LanguageModelClient;
import com.purchasingpower.research.configuration.AgentProperties;
import com.purchasingpower.research.configuration.ResearchProperties;
import com.purchasingpower.research.service.PromptLibraryService;
import com.purchasingpower.research.util.StructuredOutputParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Splits a research question into searchable sub-queries.
 *
 * Logic:
 * 1. Ask the model for a JSON array of min..max queries
 * 2. Too few usable entries → search for the question itself
 * 3. Too many → keep the first max
 * 4. Any failure → search for the question itself
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueryDecomposerAgent {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() { };

    private final LanguageModelClient llmClient;
    private final PromptLibraryService promptLibrary;
    private final StructuredOutputParser outputParser;
    private final ResearchProperties props;

    public List<String> decompose(String question) {
        Preconditions.checkArgument(question != null && !question.isBlank(), "Question cannot be empty");
        AgentProperties agent = props.getAgent();

        log.info("🧩 Decomposing question: {}", question);

        try {
            String prompt = promptLibrary.render(PromptLibraryService.DECOMPOSE, Map.of(
                    "question", question,
                    "minSubqueries", agent.getMinSubqueries(),
                    "maxSubqueries", agent.getMaxSubqueries()));

            List<String> queries = outputParser.parse(llmClient.call(prompt), STRING_LIST).stream()
                    .filter(Objects::nonNull)
                    .map(String::strip)
                    .filter(q -> !q.isEmpty())
                    .toList();

            if (queries.size() < agent.getMinSubqueries()) {
                log.warn("⚠️ Only {} sub-queries generated (minimum {}), searching for the question itself",
                        queries.size(), agent.getMinSubqueries());
                return List.of(question);
            }
            if (queries.size() > agent.getMaxSubqueries()) {
                log.info("Truncating {} sub-queries to {}", queries.size(), agent.getMaxSubqueries());
                queries = queries.subList(0, agent.getMaxSubqueries());
            }

            log.info("✅ Generated {} sub-queries: {}", queries.size(), queries);
            return List.copyOf(queries);

        } catch (Exception e) {
            log.warn("⚠️ Query decomposition failed ({}), searching for the question itself", e.getMessage());
            return List.of(question);
        }
    }
}
