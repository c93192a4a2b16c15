package com.purchasingpower.research.client;

import com.purchasingpower.research.configuration.ResearchProperties;
import com.purchasingpower.research.exception.ResearchConfigurationException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Selects the active model backend from {@code app.llm.provider}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LLMProviderFactory {

    private final AnthropicProvider anthropicProvider;
    private final GeminiProvider geminiProvider;
    private final ResearchProperties props;

    @PostConstruct
    public void init() {
        log.info("🚀 LLM Provider configured: {}", props.getLlm().getProvider());
        log.info("   Active provider: {} (model {})", getProvider().getProviderName(), props.getLlm().getModel());
    }

    /**
     * Get the active LLM provider based on configuration.
     *
     * @throws ResearchConfigurationException when the configured name is not a known backend
     */
    public LLMProvider getProvider() {
        String name = props.getLlm().getProvider();
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "anthropic", "claude" -> anthropicProvider;
            case "gemini" -> geminiProvider;
            default -> throw new ResearchConfigurationException(
                    "Unknown app.llm.provider '" + name + "' (expected anthropic or gemini)");
        };
    }
}
