package com.purchasingpower.research.service.search;

import com.google.common.base.Preconditions;
import com.purchasingpower.research.exception.ResearchConfigurationException;
import com.purchasingpower.research.model.research.SearchResult;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Tries an ordered list of search providers and returns the first non-empty result.
 *
 * <p>A provider that throws counts as empty. The selector never throws from {@link #search}.
 */
@Slf4j
public class SearchProviderSelector {

    private final List<SearchProvider> providers;
    private final String mode;
    private final int defaultMaxResults;

    public SearchProviderSelector(List<SearchProvider> providers, String mode, int defaultMaxResults) {
        if (providers == null || providers.isEmpty()) {
            throw new ResearchConfigurationException(
                    "No search providers available for mode '" + mode + "'. "
                            + "Configure Google API credentials or use the duckduckgo provider.");
        }
        Preconditions.checkArgument(defaultMaxResults > 0, "defaultMaxResults must be positive");
        this.providers = List.copyOf(providers);
        this.mode = mode;
        this.defaultMaxResults = defaultMaxResults;

        log.info("🔍 Search providers available: {} (mode: {})",
                this.providers.stream().map(SearchProvider::getName).collect(Collectors.joining(", ")), mode);
    }

    /**
     * @param maxResults upper bound on results; 0 or less means the configured default
     */
    public List<SearchResult> search(String query, int maxResults) {
        int limit = maxResults > 0 ? maxResults : defaultMaxResults;

        for (int i = 0; i < providers.size(); i++) {
            SearchProvider provider = providers.get(i);
            List<SearchResult> results;
            try {
                results = provider.search(query, limit);
            } catch (RuntimeException e) {
                log.warn("Search provider {} failed for '{}': {}", provider.getName(), query, e.getMessage());
                results = List.of();
            }

            if (results != null && !results.isEmpty()) {
                log.info("✓ {} returned {} results for '{}'", provider.getName(), results.size(), query);
                return results.size() > limit ? List.copyOf(results.subList(0, limit)) : results;
            }

            if (i + 1 < providers.size()) {
                log.warn("{} returned no results for '{}', trying {}",
                        provider.getName(), query, providers.get(i + 1).getName());
            }
        }

        log.warn("No search results for '{}' (mode: {})", query, mode);
        return List.of();
    }

    public List<String> getProviderNames() {
        return providers.stream().map(SearchProvider::getName).toList();
    }
}
