package com.purchasingpower.research.service.search;

import com.purchasingpower.research.model.research.SearchResult;

import java.util.List;

/**
 * One web search backend.
 *
 * <p>Implementations degrade gracefully: a failed search is an empty list, not an exception.
 */
public interface SearchProvider {

    /**
     * @param query      non-blank query text
     * @param maxResults upper bound on the number of results, at least 1
     * @return results in backend ranking order, possibly empty
     */
    List<SearchResult> search(String query, int maxResults);

    String getName();
}
