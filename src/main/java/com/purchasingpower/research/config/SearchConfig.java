package com.purchasingpower.research.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.research.configuration.ResearchProperties;
import com.purchasingpower.research.configuration.SearchProperties;
import com.purchasingpower.research.exception.ResearchConfigurationException;
import com.purchasingpower.research.service.search.DuckDuckGoSearchProvider;
import com.purchasingpower.research.service.search.GoogleSearchProvider;
import com.purchasingpower.research.service.search.SearchProvider;
import com.purchasingpower.research.service.search.SearchProviderSelector;
import com.purchasingpower.research.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Wires the search providers for {@code app.search.provider}.
 *
 * <pre>
 * app:
 *   search:
 *     provider: auto          # auto | duckduckgo | google
 *     google-api-key: ${GOOGLE_API_KEY:}
 *     google-cse-id: ${GOOGLE_CSE_ID:}
 * </pre>
 *
 * <p>In {@code auto} mode DuckDuckGo goes first and Google is appended only when both credentials
 * are present. {@code google} mode without credentials fails startup.
 */
@Slf4j
@Configuration
public class SearchConfig {

    @Bean
    public SearchProviderSelector searchProviderSelector(ResearchProperties props,
                                                         WebClient.Builder webClientBuilder,
                                                         ObjectMapper objectMapper,
                                                         Sleeper sleeper) {
        SearchProperties search = props.getSearch();
        String mode = search.getProvider().trim().toLowerCase(Locale.ROOT);

        List<SearchProvider> providers = new ArrayList<>();
        switch (mode) {
            case "auto" -> {
                providers.add(new DuckDuckGoSearchProvider(search, webClientBuilder.clone(), sleeper));
                if (search.hasGoogleCredentials()) {
                    providers.add(new GoogleSearchProvider(search, webClientBuilder.clone(), objectMapper));
                } else {
                    log.info("Google search not available: no API key / CSE id configured");
                }
            }
            case "duckduckgo" -> providers.add(new DuckDuckGoSearchProvider(search, webClientBuilder.clone(), sleeper));
            case "google" -> {
                if (!search.hasGoogleCredentials()) {
                    throw new ResearchConfigurationException(
                            "app.search.provider is 'google' but app.search.google-api-key "
                                    + "(GOOGLE_API_KEY) or app.search.google-cse-id (GOOGLE_CSE_ID) is missing");
                }
                providers.add(new GoogleSearchProvider(search, webClientBuilder.clone(), objectMapper));
            }
            default -> throw new ResearchConfigurationException(
                    "Unknown app.search.provider '" + search.getProvider() + "' (expected auto, duckduckgo or google)");
        }

        return new SearchProviderSelector(providers, mode, search.getMaxResultsPerQuery());
    }
}
