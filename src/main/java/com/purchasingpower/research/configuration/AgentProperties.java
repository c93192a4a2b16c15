package com.purchasingpower.research.configuration;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class AgentProperties {

    @Min(1)
    private int minSubqueries = 3;

    @Min(1)
    private int maxSubqueries = 5;

    /**
     * Upper bound on facts requested from the model per source.
     */
    @Positive
    private int factsPerSource = 5;

    /**
     * Source content is cut to this many characters before it goes into the extraction prompt.
     */
    @Positive
    private int maxExtractionChars = 10_000;

    @AssertTrue(message = "app.agent.min-subqueries must not exceed app.agent.max-subqueries")
    public boolean isSubqueryRangeValid() {
        return minSubqueries <= maxSubqueries;
    }
}
