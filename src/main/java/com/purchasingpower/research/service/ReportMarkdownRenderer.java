package com.purchasingpower.research.service;

import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.purchasingpower.research.model.research.Confidence;
import com.purchasingpower.research.model.research.Contradiction;
import com.purchasingpower.research.model.research.Fact;
import com.purchasingpower.research.model.research.ResearchReport;
import com.purchasingpower.research.model.research.Source;
import org.springframework.stereotype.Component;

import java.io.StringWriter;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link ResearchReport} as Markdown using {@code templates/research-report.md.mustache}.
 */
@Component
public class ReportMarkdownRenderer {

    static final String TEMPLATE = "research-report.md.mustache";

    private static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Mustache template;
    private final Clock clock;

    public ReportMarkdownRenderer(Clock clock) {
        this.template = new DefaultMustacheFactory("templates").compile(TEMPLATE);
        this.clock = clock;
    }

    public String render(ResearchReport report) {
        StringWriter writer = new StringWriter();
        template.execute(writer, toView(report));
        return writer.toString();
    }

    private Map<String, Object> toView(ResearchReport report) {
        Map<String, Object> view = new HashMap<>();
        view.put("question", report.getQuestion());
        view.put("timestamp", report.getTimestamp() == null ? ""
                : DISPLAY_FORMAT.format(report.getTimestamp().atZone(clock.getZone())));
        view.put("subQueries", report.getSubQueries());

        List<Map<String, Object>> buckets = new ArrayList<>();
        addBucket(buckets, "High Confidence", Confidence.HIGH, report.getFacts());
        addBucket(buckets, "Medium Confidence", Confidence.MEDIUM, report.getFacts());
        addBucket(buckets, "Low Confidence", Confidence.LOW, report.getFacts());
        view.put("confidenceBuckets", buckets);
        view.put("hasFacts", !report.getFacts().isEmpty());

        if (report.getSynthesis() != null) {
            view.put("agreements", report.getSynthesis().getAgreements());
            view.put("hasAgreements", !report.getSynthesis().getAgreements().isEmpty());
            view.put("contradictions", report.getSynthesis().getContradictions().stream()
                    .map(ReportMarkdownRenderer::contradictionView)
                    .toList());
            view.put("hasContradictions", !report.getSynthesis().getContradictions().isEmpty());
            view.put("gaps", report.getSynthesis().getGaps());
            view.put("hasGaps", !report.getSynthesis().getGaps().isEmpty());
            view.put("answer", report.getSynthesis().getAnswer());
        }

        List<Map<String, Object>> sources = new ArrayList<>();
        int index = 1;
        for (Source source : report.getSources()) {
            Map<String, Object> row = new HashMap<>();
            row.put("index", index++);
            row.put("title", source.getTitle().isBlank() ? source.getUrl() : source.getTitle());
            row.put("url", source.getUrl());
            sources.add(row);
        }
        view.put("sources", sources);
        view.put("sourceCount", sources.size());
        return view;
    }

    private static void addBucket(List<Map<String, Object>> buckets, String heading,
                                  Confidence confidence, List<Fact> facts) {
        List<Map<String, Object>> rows = facts.stream()
                .filter(f -> f.getConfidence() == confidence)
                .map(ReportMarkdownRenderer::factView)
                .toList();
        if (rows.isEmpty()) {
            return;
        }
        Map<String, Object> bucket = new LinkedHashMap<>();
        bucket.put("heading", heading);
        bucket.put("facts", rows);
        buckets.add(bucket);
    }

    private static Map<String, Object> factView(Fact fact) {
        Map<String, Object> row = new HashMap<>();
        row.put("claim", fact.getClaim());
        row.put("sourceUrl", fact.getSourceUrl());
        row.put("hasCaveat", fact.getCaveat() != null);
        row.put("caveat", fact.getCaveat());
        return row;
    }

    private static Map<String, Object> contradictionView(Contradiction contradiction) {
        Map<String, Object> row = new HashMap<>();
        row.put("issue", contradiction.getIssue());
        row.put("sources", String.join(", ", contradiction.getSources()));
        row.put("explanation", contradiction.getExplanation());
        return row;
    }
}
