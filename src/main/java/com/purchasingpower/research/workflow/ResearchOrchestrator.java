package com.purchasingpower.research.workflow;

import com.google.common.base.Preconditions;
import com.purchasingpower.research.exception.NoSourcesException;
import com.purchasingpower.research.model.research.Fact;
import com.purchasingpower.research.model.research.ResearchReport;
import com.purchasingpower.research.model.research.SearchResult;
import com.purchasingpower.research.model.research.Source;
import com.purchasingpower.research.model.research.Synthesis;
import com.purchasingpower.research.service.search.ContentFetcher;
import com.purchasingpower.research.service.search.SearchProviderSelector;
import com.purchasingpower.research.workflow.agents.FactExtractorAgent;
import com.purchasingpower.research.workflow.agents.QueryDecomposerAgent;
import com.purchasingpower.research.workflow.agents.SynthesizerAgent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs one research question through the pipeline:
 *
 * <pre>
 * decompose → (search → fetch)* per sub-query → extract per source → synthesize → report
 * </pre>
 *
 * Stages run sequentially. Each stage degrades on its own: a failed decomposition searches for the
 * question itself, a failed fetch or extraction drops that source, a failed synthesis uses the
 * fallback answer. The only hard stop is a run that gathered no source at all.
 *
 * Holds no per-run state; persisting the report is the caller's job.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResearchOrchestrator {

    private final QueryDecomposerAgent decomposer;
    private final SearchProviderSelector searchSelector;
    private final ContentFetcher contentFetcher;
    private final FactExtractorAgent factExtractor;
    private final SynthesizerAgent synthesizer;
    private final Clock clock;

    /**
     * @throws NoSourcesException when no page could be fetched for any sub-query
     */
    public ResearchReport research(String question) {
        Preconditions.checkArgument(question != null && !question.isBlank(), "Question cannot be empty");

        log.info("═══════════════════════════════════════════════════════");
        log.info("📚 Research started: {}", question);

        List<String> subQueries = decompose(question);
        log.info("Step 1/4: {} sub-queries", subQueries.size());

        List<Source> sources = gatherSources(subQueries);
        if (sources.isEmpty()) {
            log.error("❌ No sources gathered for '{}' across {} sub-queries", question, subQueries.size());
            throw new NoSourcesException(question, subQueries);
        }
        log.info("Step 2/4: {} sources gathered", sources.size());

        List<Fact> facts = extractFacts(sources, question);
        log.info("Step 3/4: {} facts extracted", facts.size());

        Synthesis synthesis;
        if (facts.isEmpty()) {
            log.warn("⚠️ No facts extracted from {} sources, skipping synthesis", sources.size());
            synthesis = Synthesis.noFacts();
        } else {
            synthesis = synthesizer.synthesize(question, facts);
        }
        log.info("Step 4/4: synthesis complete");
        log.info("═══════════════════════════════════════════════════════");

        return ResearchReport.builder()
                .question(question)
                .subQueries(subQueries)
                .sources(sources)
                .facts(facts)
                .synthesis(synthesis)
                .timestamp(clock.instant())
                .build();
    }

    private List<String> decompose(String question) {
        try {
            return decomposer.decompose(question);
        } catch (RuntimeException e) {
            log.warn("⚠️ Decomposer failed ({}), searching for the question itself", e.getMessage());
            return List.of(question);
        }
    }

    private List<Source> gatherSources(List<String> subQueries) {
        List<Source> sources = new ArrayList<>();

        for (int i = 0; i < subQueries.size(); i++) {
            String query = subQueries.get(i);
            log.info("🔍 [{}/{}] Searching: {}", i + 1, subQueries.size(), query);

            // 0 selects the configured per-query default
            List<SearchResult> results = searchSelector.search(query, 0);
            if (results.isEmpty()) {
                log.warn("⚠️ No search results for '{}'", query);
                continue;
            }

            for (SearchResult result : results) {
                Optional<String> content = contentFetcher.fetch(result.getUrl());
                if (content.isEmpty() || content.get().isBlank()) {
                    log.warn("⚠️ Skipping {} (no content)", result.getUrl());
                    continue;
                }
                sources.add(Source.builder()
                        .url(result.getUrl())
                        .title(result.getTitle())
                        .content(content.get())
                        .fetchTime(clock.instant())
                        .build());
            }
        }
        return sources;
    }

    private List<Fact> extractFacts(List<Source> sources, String question) {
        List<Fact> facts = new ArrayList<>();

        for (Source source : sources) {
            try {
                facts.addAll(factExtractor.extract(source, question));
            } catch (RuntimeException e) {
                log.warn("⚠️ Fact extraction failed for {}: {}", source.getUrl(), e.getMessage());
            }
        }
        return facts;
    }
}
