package com.purchasingpower.research.config;

import com.purchasingpower.research.util.BackoffPolicy;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Retry configuration for transient failures of one external call site.
 *
 * <p>Bound under {@code app.llm.retry}, {@code app.search.retry} and {@code app.fetch.retry}.
 * Example configuration:
 * <pre>
 * app:
 *   llm:
 *     retry:
 *       max-attempts: 3
 *       initial-backoff: 1s
 *       max-backoff: 30s
 *       multiplier: 2.0
 * </pre>
 *
 * <p><b>Exponential Backoff Calculation:</b>
 * Before retry N (starting at 0), the delay is:
 * <pre>
 *   delay = min(initial-backoff * (multiplier ^ N), max-backoff)
 * </pre>
 * Example with defaults: 1s, 2s, 4s, 8s, then capped at 30s
 */
@Data
@NoArgsConstructor
public class RetryProperties {

    /**
     * Total attempts, the first call included.
     * Range: 1-10
     */
    @Min(1)
    @Max(10)
    private int maxAttempts = 3;

    @NotNull
    private Duration initialBackoff = Duration.ofSeconds(1);

    @NotNull
    private Duration maxBackoff = Duration.ofSeconds(30);

    @DecimalMin("1.0")
    private double multiplier = 2.0;

    public RetryProperties(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public BackoffPolicy toBackoffPolicy() {
        return BackoffPolicy.builder()
                .maxAttempts(maxAttempts)
                .initialDelay(initialBackoff)
                .maxDelay(maxBackoff)
                .multiplier(multiplier)
                .build();
    }
}
