package com.purchasingpower.research.util;

import com.google.common.base.Preconditions;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Bounded exponential backoff.
 *
 * <p>{@code maxAttempts} counts every call, the first one included, so a policy with
 * three attempts sleeps at most twice.
 */
@Value
@Builder
public class BackoffPolicy {

    @Builder.Default
    int maxAttempts = 3;

    @Builder.Default
    Duration initialDelay = Duration.ofSeconds(1);

    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(30);

    @Builder.Default
    double multiplier = 2.0;

    public static BackoffPolicy defaults() {
        return BackoffPolicy.builder().build();
    }

    /**
     * Delay to wait after the failed attempt {@code attempt} (zero based) before the next one.
     */
    public Duration delayBeforeRetry(int attempt) {
        Preconditions.checkArgument(attempt >= 0, "attempt must be >= 0");
        double millis = initialDelay.toMillis() * Math.pow(multiplier, attempt);
        long capped = (long) Math.min(millis, (double) maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }

    /**
     * @return true when another attempt is allowed after the failed attempt {@code attempt} (zero based)
     */
    public boolean canRetryAfter(int attempt) {
        return attempt + 1 < maxAttempts;
    }
}
