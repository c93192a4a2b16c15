package com.purchasingpower.research.service;

import com.purchasingpower.research.configuration.OutputProperties;
import com.purchasingpower.research.configuration.ResearchProperties;
import com.purchasingpower.research.model.research.ResearchReport;
import com.purchasingpower.research.model.research.Source;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.FileAlreadyExistsException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;

/**
 * Writes finished reports to {@code app.output.report-dir}.
 *
 * <pre>
 * reports/
 *   research_report_20250101_120000.md
 *   research_report_20250101_120000_1.md    (second run in the same second)
 *   sources_20250101_120000.txt      (only with app.output.save-intermediate)
 * </pre>
 *
 * <p>Existing reports are never overwritten.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportPersistenceService {

    static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    static final int SOURCE_PREVIEW_CHARS = 1000;

    private final ResearchProperties props;
    private final ReportMarkdownRenderer renderer;
    private final Clock clock;

    /**
     * @return path of the written Markdown report
     * @throws UncheckedIOException when the report directory or file cannot be written
     */
    public Path save(ResearchReport report) {
        OutputProperties output = props.getOutput();
        Path dir = Paths.get(output.getReportDir());
        String stamp = fileTimestamp(report.getTimestamp());

        try {
            Files.createDirectories(dir);

            String markdown = renderer.render(report);
            String suffix = "";
            Path reportPath;
            for (int n = 1; ; n++) {
                reportPath = dir.resolve("research_report_" + stamp + suffix + ".md");
                try {
                    Files.writeString(reportPath, markdown, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
                    break;
                } catch (FileAlreadyExistsException e) {
                    log.debug("Report {} already exists, trying next suffix", reportPath.getFileName());
                    suffix = "_" + n;
                }
            }
            log.info("📄 Report saved: {}", reportPath.toAbsolutePath());

            if (output.isSaveIntermediate()) {
                Path sourcesPath = dir.resolve("sources_" + stamp + suffix + ".txt");
                Files.writeString(sourcesPath, renderSources(report), StandardCharsets.UTF_8);
                log.info("Intermediate sources saved: {}", sourcesPath.toAbsolutePath());
            }
            return reportPath;

        } catch (IOException e) {
            log.error("Failed to write report to {}", dir.toAbsolutePath(), e);
            throw new UncheckedIOException("Failed to write report to " + dir, e);
        }
    }

    private String fileTimestamp(Instant timestamp) {
        Instant instant = timestamp != null ? timestamp : clock.instant();
        return FILE_TIMESTAMP.format(instant.atZone(clock.getZone()));
    }

    private static String renderSources(ResearchReport report) {
        StringBuilder sb = new StringBuilder();
        int index = 1;
        for (Source source : report.getSources()) {
            String content = source.getContent();
            sb.append("Source ").append(index++).append(": ").append(source.getTitle()).append('\n')
                    .append("URL: ").append(source.getUrl()).append('\n')
                    .append("Content length: ").append(content.length()).append(" chars\n")
                    .append('\n')
                    .append(content, 0, Math.min(content.length(), SOURCE_PREVIEW_CHARS))
                    .append("\n\n")
                    .append("=".repeat(80))
                    .append("\n\n");
        }
        return sb.toString();
    }
}
