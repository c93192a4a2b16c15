package com.purchasingpower.research.model.research;

import lombok.Builder;
import lombok.Value;

/**
 * One hit returned by a search backend.
 */
@Value
@Builder
public class SearchResult {
    String url;
    String title;
    String snippet;
}
