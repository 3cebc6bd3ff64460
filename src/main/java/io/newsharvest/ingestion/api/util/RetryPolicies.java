package io.newsharvest.ingestion.api.util;

import io.newsharvest.ingestion.api.exception.CategorizedException;
import io.newsharvest.ingestion.config.NewsConfig;
import io.newsharvest.ingestion.config.RetryConfig;
import io.newsharvest.ingestion.config.RetrySettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.NoBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

/**
 * Retry templates for the three network boundaries: feed fetch, page fetch and rewrite call.
 * <p>
 * Only transient failures are retried. A {@link CategorizedException} whose category is not
 * transient (404, 403, parse error...) fails on the first attempt.
 */
@Component
public class RetryPolicies {

    private static final Logger logger = LoggerFactory.getLogger(RetryPolicies.class);

    private final RetryTemplate feed;
    private final RetryTemplate page;
    private final RetryTemplate rewrite;

    @Autowired
    public RetryPolicies(NewsConfig config) {
        this(config.retry());
    }

    public RetryPolicies(RetryConfig config) {
        this.feed = build("feed", settingsOrDefault(config == null ? null : config.feed()));
        this.page = build("page", settingsOrDefault(config == null ? null : config.page()));
        this.rewrite = build("rewrite", settingsOrDefault(config == null ? null : config.rewrite()));
    }

    public static RetryPolicies none() {
        return new RetryPolicies(new RetryConfig(RetrySettings.noRetry(), RetrySettings.noRetry(), RetrySettings.noRetry()));
    }

    public RetryTemplate feed() {
        return feed;
    }

    public RetryTemplate page() {
        return page;
    }

    public RetryTemplate rewrite() {
        return rewrite;
    }

    static RetryTemplate build(String boundary, RetrySettings settings) {
        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new TransientOnlyRetryPolicy(Math.max(1, settings.maxAttempts())));

        long initialMs = settings.initialDelay() == null ? 0 : settings.initialDelay().toMillis();
        if (settings.maxAttempts() <= 1 || initialMs <= 0) {
            template.setBackOffPolicy(new NoBackOffPolicy());
        } else {
            ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
            backOff.setInitialInterval(initialMs);
            backOff.setMultiplier(Math.max(1.0, settings.multiplier()));
            long maxMs = settings.maxDelay() == null ? initialMs : settings.maxDelay().toMillis();
            backOff.setMaxInterval(Math.max(initialMs, maxMs));
            template.setBackOffPolicy(backOff);
        }

        template.registerListener(new RetryListener() {
            @Override
            public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                         Throwable throwable) {
                logger.debug("{} call failed (attempt {}): {}", boundary, context.getRetryCount(), throwable.getMessage());
            }
        });

        return template;
    }

    private static RetrySettings settingsOrDefault(RetrySettings settings) {
        return settings == null ? RetrySettings.noRetry() : settings;
    }

    static class TransientOnlyRetryPolicy extends SimpleRetryPolicy {

        TransientOnlyRetryPolicy(int maxAttempts) {
            super(maxAttempts);
        }

        @Override
        public boolean canRetry(RetryContext context) {
            Throwable last = context.getLastThrowable();
            if (last instanceof CategorizedException categorized && !categorized.isTransient()) {
                return false;
            }
            return super.canRetry(context);
        }
    }
}
