/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecastcache.services;

import java.time.Duration;
import java.util.function.Supplier;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.forecastcache.api.types.FetchOutcome;
import villagecompute.forecastcache.config.RetrySettings;
import villagecompute.forecastcache.util.Sleeper;

/**
 * Retries transient upstream failures with capped exponential backoff.
 *
 * <p>
 * Only kinds flagged {@link villagecompute.forecastcache.api.types.ForecastErrorKind#isRetryable()} (TIMEOUT and
 * UPSTREAM_UNAVAILABLE) are retried, up to {@link RetrySettings#maxRetries()} times. The delay before retry {@code n}
 * is {@code min(base × multiplier^(n-1), maxDelay)}. Decisions look at the classified kind on the outcome, never at
 * exception text.
 */
@ApplicationScoped
public class RetryPolicy {

    private static final Logger LOG = Logger.getLogger(RetryPolicy.class);

    private final RetrySettings settings;
    private final Sleeper sleeper;

    @Inject
    public RetryPolicy(RetrySettings settings) {
        this(settings, Sleeper.SYSTEM);
    }

    public RetryPolicy(RetrySettings settings, Sleeper sleeper) {
        this.settings = settings;
        this.sleeper = sleeper;
    }

    /**
     * Runs the call, retrying transient failures.
     *
     * @param operation
     *            label for logs
     * @param call
     *            call producing a classified outcome
     * @return the first success, the first non-retryable failure, or the last failure once retries are exhausted
     */
    public <T> FetchOutcome<T> execute(String operation, Supplier<FetchOutcome<T>> call) {
        FetchOutcome<T> outcome = call.get();
        int retry = 0;

        while (!outcome.isSuccess() && outcome.errorKind().isRetryable() && retry < settings.maxRetries()) {
            retry++;
            Duration delay = settings.delayForRetry(retry);
            LOG.debugf("Retrying %s after %s (retry %d/%d, delay %d ms)", operation, outcome.errorKind(), retry,
                    settings.maxRetries(), delay.toMillis());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warnf("Retry of %s interrupted after %d attempts", operation, retry);
                return outcome;
            }
            outcome = call.get();
        }

        if (!outcome.isSuccess() && retry > 0) {
            LOG.warnf("%s still failing after %d retries: %s", operation, retry, outcome.errorKind());
        }
        return outcome;
    }

    public RetrySettings getSettings() {
        return settings;
    }
}
