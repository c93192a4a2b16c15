package com.purchasingpower.research.service;

import com.purchasingpower.research.configuration.ResearchProperties;
import com.purchasingpower.research.model.research.Confidence;
import com.purchasingpower.research.model.research.Contradiction;
import com.purchasingpower.research.model.research.Fact;
import com.purchasingpower.research.model.research.ResearchReport;
import com.purchasingpower.research.model.research.Source;
import com.purchasingpower.research.model.research.Synthesis;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Report Persistence Service Tests")
class ReportPersistenceServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:15:30Z");

    @TempDir
    Path tempDir;

    private ResearchProperties props;
    private ReportPersistenceService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        props = new ResearchProperties();
        props.getOutput().setReportDir(tempDir.resolve("reports").toString());
        service = new ReportPersistenceService(props, new ReportMarkdownRenderer(clock), clock);
    }

    private static ResearchReport report(String longContent) {
        return ResearchReport.builder()
                .question("Does <b>HTML</b> & markdown survive?")
                .subQueries(List.of("first query", "second query"))
                .sources(List.of(
                        Source.builder().url("https://a.example/").title("Alpha").content(longContent).fetchTime(NOW).build(),
                        Source.builder().url("https://b.example/").title("").content("short").fetchTime(NOW).build()))
                .facts(List.of(
                        Fact.builder().claim("High claim").caveat("Small sample").confidence(Confidence.HIGH)
                                .sourceUrl("https://a.example/").build(),
                        Fact.builder().claim("Low claim").confidence(Confidence.LOW)
                                .sourceUrl("https://b.example/").build()))
                .synthesis(Synthesis.builder()
                        .agreements(List.of("Both agree"))
                        .contradictions(List.of(Contradiction.builder()
                                .issue("Effect size")
                                .sources(List.of("https://a.example/", "https://b.example/"))
                                .explanation("Different populations")
                                .build()))
                        .gaps(List.of("Long-term data"))
                        .answer("The answer is nuanced.")
                        .build())
                .timestamp(NOW)
                .build();
    }

    @Test
    @DisplayName("Writes a timestamped Markdown report with every section")
    void testSave_ShouldWriteMarkdownReport() throws IOException {
        // When
        Path path = service.save(report("Alpha content"));

        // Then
        assertThat(path.getFileName().toString()).isEqualTo("research_report_20250301_101530.md");
        String markdown = Files.readString(path);
        assertThat(markdown)
                .contains("**Question:** Does <b>HTML</b> & markdown survive?")
                .contains("**Generated:** 2025-03-01 10:15:30")
                .contains("- first query")
                .contains("### High Confidence")
                .contains("- High claim ([source](https://a.example/))")
                .contains("*Caveat: Small sample*")
                .contains("### Low Confidence")
                .doesNotContain("### Medium Confidence")
                .contains("- Both agree")
                .contains("**Effect size**")
                .contains("Sources: https://a.example/, https://b.example/")
                .contains("- Long-term data")
                .contains("The answer is nuanced.")
                .contains("1. [Alpha](https://a.example/)")
                .contains("2. [https://b.example/](https://b.example/)");
        assertThat(Files.exists(tempDir.resolve("reports").resolve("sources_20250301_101530.txt"))).isFalse();
    }

    @Test
    @DisplayName("Intermediate source dump keeps the first 1000 characters")
    void testSave_ShouldWriteIntermediateSources() throws IOException {
        // Given
        props.getOutput().setSaveIntermediate(true);
        String longContent = "x".repeat(1000) + "TAIL";

        // When
        service.save(report(longContent));

        // Then
        Path dump = tempDir.resolve("reports").resolve("sources_20250301_101530.txt");
        String text = Files.readString(dump);
        assertThat(text)
                .contains("Source 1: Alpha")
                .contains("URL: https://a.example/")
                .contains("Content length: 1004 chars")
                .contains("x".repeat(1000))
                .doesNotContain("TAIL");
    }

    @Test
    @DisplayName("Unwritable directory surfaces as UncheckedIOException")
    void testSave_ShouldWrapIoErrors() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("not-a-dir"), "file");
        props.getOutput().setReportDir(blocker.toString());

        assertThatThrownBy(() -> service.save(report("content"))).isInstanceOf(UncheckedIOException.class);
    }

    @Test
    @DisplayName("Report without facts says so")
    void testRender_ShouldHandleNoFacts() {
        ReportMarkdownRenderer renderer = new ReportMarkdownRenderer(Clock.fixed(NOW, ZoneOffset.UTC));
        ResearchReport empty = ResearchReport.builder()
                .question("q")
                .subQueries(List.of("q"))
                .sources(List.of(Source.builder().url("https://a.example/").title("A").content("c").build()))
                .facts(List.of())
                .synthesis(Synthesis.noFacts())
                .timestamp(NOW)
                .build();

        String markdown = renderer.render(empty);

        assertThat(markdown)
                .contains("No facts could be extracted from the sources.")
                .contains("- No sources found with relevant information")
                .contains("Unable to answer the question due to lack of sources.");
    }

    @Test
    @DisplayName("Second report in the same second gets a suffix instead of overwriting")
    void testSave_ShouldNotOverwriteExistingReport() throws IOException {
        // Given
        props.getOutput().setSaveIntermediate(true);
        Path first = service.save(report("First run content"));
        String firstMarkdown = Files.readString(first);

        // When
        Path second = service.save(ResearchReport.builder()
                .question("A different question")
                .synthesis(Synthesis.noFacts())
                .timestamp(NOW)
                .build());

        // Then
        assertThat(second.getFileName().toString()).isEqualTo("research_report_20250301_101530_1.md");
        assertThat(Files.readString(first)).isEqualTo(firstMarkdown);
        assertThat(Files.readString(second)).contains("A different question");
        assertThat(second.resolveSibling("sources_20250301_101530_1.txt")).exists();
        assertThat(first.resolveSibling("sources_20250301_101530.txt")).exists();
    }
}
