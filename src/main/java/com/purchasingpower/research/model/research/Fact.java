package com.purchasingpower.research.model.research;

import com.google.common.base.Preconditions;
import lombok.Builder;
import lombok.Value;

/**
 * An atomic claim extracted from exactly one source.
 */
@Value
public class Fact {
    String claim;
    String caveat;
    Confidence confidence;
    String sourceUrl;

    @Builder
    public Fact(String claim, String caveat, Confidence confidence, String sourceUrl) {
        Preconditions.checkArgument(claim != null && !claim.isBlank(), "Fact claim must not be blank");
        Preconditions.checkArgument(sourceUrl != null && !sourceUrl.isBlank(), "Fact must reference a source");
        this.claim = claim;
        this.caveat = caveat;
        this.confidence = confidence == null ? Confidence.MEDIUM : confidence;
        this.sourceUrl = sourceUrl;
    }
}
