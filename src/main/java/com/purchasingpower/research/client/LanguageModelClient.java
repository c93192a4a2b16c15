package com.purchasingpower.research.client;

import com.google.common.base.Preconditions;
import com.purchasingpower.research.configuration.ResearchProperties;
import com.purchasingpower.research.exception.LlmCallException;
import com.purchasingpower.research.exception.RateLimitException;
import com.purchasingpower.research.util.BackoffPolicy;
import com.purchasingpower.research.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Single entry point the agents use to talk to the model.
 *
 * <p>Rate limits ({@link RateLimitException}) are retried with exponential backoff until the
 * policy's attempt budget is spent, then the last one is rethrown. Every other
 * {@link LlmCallException} propagates on the first occurrence.
 */
@Slf4j
@Component
public class LanguageModelClient {

    private final LLMProvider provider;
    private final BackoffPolicy backoffPolicy;
    private final Sleeper sleeper;

    @Autowired
    public LanguageModelClient(LLMProviderFactory providerFactory, ResearchProperties props, Sleeper sleeper) {
        this(providerFactory.getProvider(), props.getLlm().getRetry().toBackoffPolicy(), sleeper);
    }

    public LanguageModelClient(LLMProvider provider, BackoffPolicy backoffPolicy, Sleeper sleeper) {
        this.provider = Preconditions.checkNotNull(provider, "provider");
        this.backoffPolicy = Preconditions.checkNotNull(backoffPolicy, "backoffPolicy");
        this.sleeper = Preconditions.checkNotNull(sleeper, "sleeper");
    }

    /**
     * Send a prompt and return the raw response text.
     *
     * @throws RateLimitException when every attempt was rate limited
     * @throws LlmCallException on any other provider failure, or when interrupted while backing off
     */
    public String call(String prompt) {
        Preconditions.checkArgument(prompt != null && !prompt.isBlank(), "prompt must not be blank");

        int attempt = 0;
        while (true) {
            try {
                return provider.chat(prompt);
            } catch (RateLimitException e) {
                if (!backoffPolicy.canRetryAfter(attempt)) {
                    log.error("{} still rate limited after {} attempts, giving up",
                            provider.getProviderName(), backoffPolicy.getMaxAttempts());
                    throw e;
                }
                Duration delay = backoffPolicy.delayBeforeRetry(attempt);
                log.warn("{} rate limited (attempt {}/{}), backing off {}ms",
                        provider.getProviderName(), attempt + 1, backoffPolicy.getMaxAttempts(), delay.toMillis());
                pause(delay);
                attempt++;
            }
        }
    }

    private void pause(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmCallException("Interrupted while waiting to retry " + provider.getProviderName(), e);
        }
    }

    public String getProviderName() {
        return provider.getProviderName();
    }
}
