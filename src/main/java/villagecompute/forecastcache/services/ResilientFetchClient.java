/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecastcache.services;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.eclipse.microprofile.faulttolerance.exceptions.TimeoutException;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.smallrye.faulttolerance.api.FaultTolerance;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.forecastcache.api.types.FetchAttemptType;
import villagecompute.forecastcache.api.types.FetchOutcome;
import villagecompute.forecastcache.api.types.ForecastErrorKind;
import villagecompute.forecastcache.api.types.ForecastIdentityType;
import villagecompute.forecastcache.api.types.ForecastWindowType;
import villagecompute.forecastcache.api.types.UpstreamPageType;
import villagecompute.forecastcache.exceptions.UpstreamStatusException;
import villagecompute.forecastcache.integration.airquality.UpstreamForecastProvider;
import villagecompute.forecastcache.services.storage.FetchAttemptLog;

/**
 * Single upstream call with a hard deadline and classified failures.
 *
 * <p>
 * The provider call runs under a SmallRye Fault Tolerance timeout guard, one guard per distinct deadline. On expiry the
 * calling thread is interrupted and the attempt is reported as {@link ForecastErrorKind#TIMEOUT}.
 *
 * <h2>Classification</h2>
 * <ul>
 * <li>HTTP 429: RATE_LIMITED</li>
 * <li>HTTP 408 or deadline expiry: TIMEOUT</li>
 * <li>HTTP 5xx or transport failure: UPSTREAM_UNAVAILABLE</li>
 * <li>Other HTTP 4xx: BAD_REQUEST</li>
 * <li>Anything else, including unparseable responses: UNKNOWN</li>
 * </ul>
 *
 * <p>
 * Every call appends one {@link FetchAttemptType} to the {@link FetchAttemptLog}; a failing log never fails the
 * fetch. No retries happen here, see {@link RetryPolicy}.
 */
@ApplicationScoped
public class ResilientFetchClient {

    private static final Logger LOG = Logger.getLogger(ResilientFetchClient.class);

    private final UpstreamForecastProvider provider;
    private final FetchAttemptLog attemptLog;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Map<Duration, FaultTolerance<UpstreamPageType>> guards = new ConcurrentHashMap<>();

    @Inject
    public ResilientFetchClient(UpstreamForecastProvider provider, FetchAttemptLog attemptLog,
            MeterRegistry meterRegistry, Clock clock) {
        this.provider = provider;
        this.attemptLog = attemptLog;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Fetches one upstream page under a deadline.
     *
     * @param identity
     *            location to forecast
     * @param window
     *            requested hours
     * @param pageToken
     *            continuation token, null for the first page
     * @param timeout
     *            deadline of this call
     * @return the page, or a classified failure; never throws for upstream failures
     */
    public FetchOutcome<UpstreamPageType> fetchPage(ForecastIdentityType identity, ForecastWindowType window,
            String pageToken, Duration timeout) {
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();
        Timer.Sample sample = Timer.start(meterRegistry);

        FetchOutcome<UpstreamPageType> outcome;
        try {
            UpstreamPageType page = guardFor(timeout).call(() -> provider.fetchPage(identity, window, pageToken));
            outcome = FetchOutcome.success(page);
        } catch (TimeoutException e) {
            outcome = FetchOutcome.failure(ForecastErrorKind.TIMEOUT, "Upstream call exceeded " + timeout, null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = FetchOutcome.failure(ForecastErrorKind.UNKNOWN, "Interrupted while waiting for upstream", null);
        } catch (Exception e) {
            outcome = classify(e);
        }

        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
        String status = outcome.isSuccess() ? "success" : "failure";
        sample.stop(Timer.builder("forecast.fetch.duration").tag("provider", provider.providerName())
                .tag("status", status).register(meterRegistry));
        incrementCounter("forecast.fetch.total", "provider", provider.providerName(), "kind",
                outcome.isSuccess() ? "none" : outcome.errorKind().name());

        if (outcome.isSuccess()) {
            LOG.debugf("Fetched %d samples from %s in %d ms", (Object) outcome.value().samples().size(),
                    provider.providerName(), duration.toMillis());
        } else {
            LOG.warnf("Upstream %s failed after %d ms: %s (%s)", provider.providerName(), duration.toMillis(),
                    outcome.errorKind(), outcome.message());
        }

        recordAttempt(new FetchAttemptType(provider.providerName(), provider.endpoint(), startedAt, duration,
                outcome.isSuccess(), outcome.errorKind(), outcome.httpStatus()));
        return outcome;
    }

    /**
     * Maps an upstream failure onto the error taxonomy.
     */
    static <T> FetchOutcome<T> classify(Throwable error) {
        if (error instanceof UpstreamStatusException statusError) {
            int status = statusError.getStatusCode();
            ForecastErrorKind kind;
            if (status == 429) {
                kind = ForecastErrorKind.RATE_LIMITED;
            } else if (status == 408) {
                kind = ForecastErrorKind.TIMEOUT;
            } else if (status >= 500) {
                kind = ForecastErrorKind.UPSTREAM_UNAVAILABLE;
            } else if (status >= 400) {
                kind = ForecastErrorKind.BAD_REQUEST;
            } else {
                kind = ForecastErrorKind.UNKNOWN;
            }
            return FetchOutcome.failure(kind, statusError.getMessage(), status);
        }
        if (error instanceof HttpTimeoutException || error instanceof TimeoutException) {
            return FetchOutcome.failure(ForecastErrorKind.TIMEOUT, error.getMessage(), null);
        }
        if (error instanceof JsonProcessingException) {
            return FetchOutcome.failure(ForecastErrorKind.UNKNOWN, "Unparseable upstream response: " + error.getMessage(),
                    null);
        }
        if (error instanceof IOException) {
            return FetchOutcome.failure(ForecastErrorKind.UPSTREAM_UNAVAILABLE, error.getMessage(), null);
        }
        return FetchOutcome.failure(ForecastErrorKind.UNKNOWN, String.valueOf(error), null);
    }

    private void recordAttempt(FetchAttemptType attempt) {
        try {
            attemptLog.record(attempt);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to log fetch attempt to %s", attempt.endpoint());
        }
    }

    private void incrementCounter(String name, String... tags) {
        Counter.builder(name).tags(tags).register(meterRegistry).increment();
        }

    private FaultTolerance<UpstreamPageType> guardFor(Duration timeout) {
        return guards.computeIfAbsent(timeout, deadline -> FaultTolerance.<UpstreamPageType> create()
                .withDescription("forecast-fetch-" + provider.providerName()).withTimeout()
                .duration(deadline.toMillis(), ChronoUnit.MILLIS).done().build());
    }
}
