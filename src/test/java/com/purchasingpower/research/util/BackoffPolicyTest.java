package com.purchasingpower.research.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Backoff Policy Tests")
class BackoffPolicyTest {

    @Test
    @DisplayName("Default policy doubles from one second")
    void testDefaults_ShouldDoubleFromOneSecond() {
        BackoffPolicy policy = BackoffPolicy.defaults();

        assertThat(policy.getMaxAttempts()).isEqualTo(3);
        assertThat(policy.delayBeforeRetry(0)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.delayBeforeRetry(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delayBeforeRetry(2)).isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    @DisplayName("Delay is capped at maxDelay")
    void testDelay_ShouldBeCappedAtMaxDelay() {
        BackoffPolicy policy = BackoffPolicy.builder()
                .maxAttempts(10)
                .initialDelay(Duration.ofSeconds(1))
                .maxDelay(Duration.ofSeconds(30))
                .build();

        assertThat(policy.delayBeforeRetry(4)).isEqualTo(Duration.ofSeconds(16));
        assertThat(policy.delayBeforeRetry(5)).isEqualTo(Duration.ofSeconds(30));
        assertThat(policy.delayBeforeRetry(9)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("Attempt budget counts the first call")
    void testCanRetryAfter_ShouldCountFirstCall() {
        BackoffPolicy policy = BackoffPolicy.builder().maxAttempts(3).build();

        assertThat(policy.canRetryAfter(0)).isTrue();
        assertThat(policy.canRetryAfter(1)).isTrue();
        assertThat(policy.canRetryAfter(2)).isFalse();

        BackoffPolicy single = BackoffPolicy.builder().maxAttempts(1).build();
        assertThat(single.canRetryAfter(0)).isFalse();
    }

    @Test
    @DisplayName("Negative attempt is rejected")
    void testDelay_ShouldRejectNegativeAttempt() {
        assertThatThrownBy(() -> BackoffPolicy.defaults().delayBeforeRetry(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
