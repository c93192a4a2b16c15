package com.purchasingpower.research.api;

import com.purchasingpower.research.exception.LlmCallException;
import com.purchasingpower.research.exception.NoSourcesException;
import com.purchasingpower.research.model.research.ResearchReport;
import com.purchasingpower.research.service.ReportPersistenceService;
import com.purchasingpower.research.workflow.ResearchOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * REST controller for research runs.
 *
 * Flow:
 * 1. Validate the question
 * 2. Run the pipeline once (blocking, may take minutes)
 * 3. Save the Markdown report
 * 4. Return the report and where it was saved
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/research")
@RequiredArgsConstructor
public class ResearchController {

    private final ResearchOrchestrator orchestrator;
    private final ReportPersistenceService persistenceService;

    /**
     * Research a question.
     *
     * POST /api/v1/research
     * {"question": "What are the trade-offs of event sourcing?"}
     */
    @PostMapping
    public ResponseEntity<ResearchResponse> research(@RequestBody(required = false) ResearchRequest request) {
        if (request == null || request.getQuestion() == null || request.getQuestion().isBlank()) {
            return ResponseEntity.badRequest()
                .body(ResearchResponse.error(ResearchResponse.ErrorType.INVALID_REQUEST, "question is required"));
        }

        String question = request.getQuestion().strip();
        try {
            ResearchReport report = orchestrator.research(question);

            String reportPath = null;
            try {
                Path saved = persistenceService.save(report);
                reportPath = saved.toString();
            } catch (UncheckedIOException e) {
                log.error("Research finished but the report could not be saved", e);
            }

            return ResponseEntity.ok(ResearchResponse.success(report, reportPath));

        } catch (NoSourcesException e) {
            log.warn("No sources for '{}' ({} sub-queries)", question, e.getSubQueries().size());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ResearchResponse.error(ResearchResponse.ErrorType.NO_SOURCES, e.getMessage()));

        } catch (LlmCallException e) {
            log.error("Language model unavailable", e);
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ResearchResponse.error(ResearchResponse.ErrorType.LLM_UNAVAILABLE,
                    "Language model call failed: " + e.getMessage()));

        } catch (Exception e) {
            log.error("Research failed", e);
            return ResponseEntity.internalServerError()
                .body(ResearchResponse.error(ResearchResponse.ErrorType.UNEXPECTED, "Internal error: " + e.getMessage()));
        }
    }
}
