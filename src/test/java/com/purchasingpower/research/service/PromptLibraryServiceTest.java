package com.purchasingpower.research.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Prompt Library Service Tests")
class PromptLibraryServiceTest {

    private PromptLibraryService promptLibrary;

    @BeforeEach
    void setUp() {
        promptLibrary = new PromptLibraryService();
        promptLibrary.loadPrompts();
    }

    @Test
    @DisplayName("All pipeline prompts are loaded")
    void testLoadPrompts_ShouldLoadPipelinePrompts() {
        assertThat(promptLibrary.getTemplate(PromptLibraryService.DECOMPOSE)).isNotNull();
        assertThat(promptLibrary.getTemplate(PromptLibraryService.EXTRACT)).isNotNull();
        assertThat(promptLibrary.getTemplate(PromptLibraryService.SYNTHESIZE).getVersion()).isEqualTo("1.0");
    }

    @Test
    @DisplayName("Page content is inserted without HTML escaping")
    void testRender_ShouldNotEscapeContent() {
        String prompt = promptLibrary.render(PromptLibraryService.EXTRACT, Map.of(
                "question", "Is A < B & \"C\"?",
                "url", "https://a.example/?x=1&y=2",
                "content", "<p>raw</p>",
                "factsPerSource", 4));

        assertThat(prompt)
                .contains("Research question: Is A < B & \"C\"?")
                .contains("Source URL: https://a.example/?x=1&y=2")
                .contains("<p>raw</p>")
                .contains("up to 4 key facts")
                .contains("\"facts\": []");
    }

    @Test
    @DisplayName("Unknown template is rejected")
    void testRender_ShouldRejectUnknownTemplate() {
        assertThatThrownBy(() -> promptLibrary.render("missing", Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
