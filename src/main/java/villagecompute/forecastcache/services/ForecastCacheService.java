/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecastcache.services;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.jboss.logging.Logger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.forecastcache.api.types.ApiUsageStatsType;
import villagecompute.forecastcache.api.types.CachedSampleType;
import villagecompute.forecastcache.api.types.DailyRollupType;
import villagecompute.forecastcache.api.types.ForecastErrorKind;
import villagecompute.forecastcache.api.types.ForecastErrorType;
import villagecompute.forecastcache.api.types.ForecastIdentityType;
import villagecompute.forecastcache.api.types.ForecastResultType;
import villagecompute.forecastcache.api.types.ForecastSampleType;
import villagecompute.forecastcache.api.types.ForecastWindowType;
import villagecompute.forecastcache.api.types.Granularity;
import villagecompute.forecastcache.api.types.PageAggregationType;
import villagecompute.forecastcache.api.types.RefreshResultType;
import villagecompute.forecastcache.api.types.ServedFrom;
import villagecompute.forecastcache.api.types.WriteReportType;
import villagecompute.forecastcache.config.PaginationSettings;
import villagecompute.forecastcache.exceptions.StorageException;
import villagecompute.forecastcache.observability.LoggingConfig;

/**
 * Read path of the forecast cache: serves from the store, refreshes from upstream on a coverage gap, and falls back to
 * stale rows when the refresh fails.
 *
 * <h2>Read Path</h2>
 * <ol>
 * <li>SERVING_FROM_CACHE: non-expired rows cover every hour of the window, answer FRESH</li>
 * <li>REFRESH_TRIGGERED: coverage gap (a store read failure counts as a miss), fetch all pages with retries</li>
 * <li>REFRESH_SUCCEEDED: rows persisted, re-read from the store and answered FRESH</li>
 * <li>REFRESH_FAILED_FALLBACK_TO_STALE: refresh failed, cached rows (expired included) answered STALE with the
 * error</li>
 * <li>REFRESH_FAILED_NO_DATA: refresh failed and nothing is cached, answer NO_DATA_AVAILABLE</li>
 * </ol>
 *
 * <p>
 * BAD_REQUEST and VALIDATION_ERROR failures are surfaced directly without stale fallback. Concurrent refreshes of the
 * same identity and window collapse into a single upstream run.
 *
 * <h2>Usage</h2>
 *
 * <pre>
 * {@code
 * @Inject
 * ForecastCacheService forecastCacheService;
 *
 * ForecastIdentityType identity = new ForecastIdentityType(null, 37.5665, 126.978);
 * ForecastWindowType window = ForecastWindowType.ofHours(Instant.now(), 24);
 * ForecastResultType result = forecastCacheService.getForecast(identity, window, Granularity.HOURLY);
 * }
 * </pre>
 */
@ApplicationScoped
public class ForecastCacheService {

    private static final Logger LOG = Logger.getLogger(ForecastCacheService.class);

    enum ReadPathState {
        SERVING_FROM_CACHE, REFRESH_TRIGGERED, REFRESH_SUCCEEDED, REFRESH_FAILED_FALLBACK_TO_STALE,
        REFRESH_FAILED_NO_DATA
    }

    private final UpsertStore store;
    private final CachePolicy cachePolicy;
    private final ResilientFetchClient fetchClient;
    private final RetryPolicy retryPolicy;
    private final PageAggregator pageAggregator;
    private final DailyRollupAggregator rollupAggregator;
    private final ApiUsageService usageService;
    private final PaginationSettings paginationSettings;
    private final Clock clock;
    private final Tracer tracer;
    private final MeterRegistry meterRegistry;

    private final ConcurrentMap<String, CompletableFuture<RefreshOutcome>> inFlight = new ConcurrentHashMap<>();

    @Inject
    public ForecastCacheService(UpsertStore store, CachePolicy cachePolicy, ResilientFetchClient fetchClient,
            RetryPolicy retryPolicy, PageAggregator pageAggregator, DailyRollupAggregator rollupAggregator,
            ApiUsageService usageService, PaginationSettings paginationSettings, Clock clock, Tracer tracer,
            MeterRegistry meterRegistry) {
        this.store = store;
        this.cachePolicy = cachePolicy;
        this.fetchClient = fetchClient;
        this.retryPolicy = retryPolicy;
        this.pageAggregator = pageAggregator;
        this.rollupAggregator = rollupAggregator;
        this.usageService = usageService;
        this.paginationSettings = paginationSettings;
        this.clock = clock;
        this.tracer = tracer;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Gets forecast data for an identity and window (cache-first).
     *
     * @param identity
     *            location and optional owner scope
     * @param window
     *            requested time range, widened to whole hours
     * @param granularity
     *            HOURLY for samples only, DAILY/WEEKLY to add rollups
     * @return fresh or stale data, or a single classified error; never throws
     */
    public ForecastResultType getForecast(ForecastIdentityType identity, ForecastWindowType window,
            Granularity granularity) {
        Optional<ForecastErrorType> invalid = validate(identity, window, granularity);
        if (invalid.isPresent()) {
            incrementCounter("forecast.requests.rejected");
            return ForecastResultType.failed(granularity, invalid.get());
        }

        ForecastWindowType hourly = window.toWholeHours();
        String cacheKey = cachePolicy.cacheKey(granularity, identity);
        LoggingConfig.setCacheKey(cacheKey);
        LoggingConfig.setSubjectId(identity.subjectId());
        Span span = tracer.spanBuilder("forecast.get").setAttribute("cache_key", cacheKey)
                .setAttribute("granularity", granularity.getTag()).startSpan();

        try (Scope scope = span.makeCurrent()) {
            int required = hourly.expectedHours();
            List<CachedSampleType> cached = safeRangeQuery(identity, hourly);

            if (cached.size() >= required) {
                incrementCounter("forecast.cache.hits");
                markState(span, ReadPathState.SERVING_FROM_CACHE);
                LOG.debugf("Forecast cache hit for %s (%d samples)", cacheKey, cached.size());
                return buildResult(identity, granularity, samplesOf(cached, required), ServedFrom.FRESH, null);
            }

            incrementCounter("forecast.cache.misses");
            markState(span, ReadPathState.REFRESH_TRIGGERED);
            LOG.debugf("Forecast cache miss for %s (%d/%d hours cached), refreshing", cacheKey, cached.size(),
                    required);

            RefreshOutcome refresh = refreshCollapsed(identity, hourly, granularity);
            if (!refresh.succeeded()) {
                return fallbackToStale(identity, hourly, granularity, refresh.error(), span);
            }

            List<ForecastSampleType> served = servedAfterRefresh(identity, hourly, refresh, required);
            if (served.isEmpty()) {
                markState(span, ReadPathState.REFRESH_FAILED_NO_DATA);
                return ForecastResultType.failed(granularity, ForecastErrorType
                        .of(ForecastErrorKind.NO_DATA_AVAILABLE, "Upstream returned no samples for the window"));
            }

            markState(span, ReadPathState.REFRESH_SUCCEEDED);
            return buildResult(identity, granularity, served, ServedFrom.FRESH, refresh.error());

        } catch (RuntimeException e) {
            span.recordException(e);
            LOG.errorf(e, "Unexpected failure serving forecast for %s", cacheKey);
            return ForecastResultType.failed(granularity,
                    ForecastErrorType.of(ForecastErrorKind.UNKNOWN, "Forecast unavailable: " + e.getMessage()));
        } finally {
            span.end();
            LoggingConfig.clearForecastContext();
        }
    }

    /**
     * Refreshes an identity and window from upstream regardless of cache state.
     * <p>
     * Used by the refresh job and the refresh endpoint. Failure handling mirrors {@link #getForecast}.
     *
     * @return rows written, or stale rows still available when the refresh failed
     */
    public RefreshResultType refreshNow(ForecastIdentityType identity, ForecastWindowType window,
            Granularity granularity) {
        Optional<ForecastErrorType> invalid = validate(identity, window, granularity);
        if (invalid.isPresent()) {
            incrementCounter("forecast.requests.rejected");
            return new RefreshResultType(0, 0, null, invalid.get());
        }

        ForecastWindowType hourly = window.toWholeHours();
        String cacheKey = cachePolicy.cacheKey(granularity, identity);
        LoggingConfig.setCacheKey(cacheKey);
        LoggingConfig.setSubjectId(identity.subjectId());
        Span span = tracer.spanBuilder("forecast.refresh_now").setAttribute("cache_key", cacheKey)
                .setAttribute("granularity", granularity.getTag()).startSpan();

        try (Scope scope = span.makeCurrent()) {
            markState(span, ReadPathState.REFRESH_TRIGGERED);
            RefreshOutcome refresh = refreshCollapsed(identity, hourly, granularity);

            if (refresh.succeeded()) {
                if (refresh.samples().isEmpty()) {
                    markState(span, ReadPathState.REFRESH_FAILED_NO_DATA);
                    return new RefreshResultType(0, 0, null, ForecastErrorType
                            .of(ForecastErrorKind.NO_DATA_AVAILABLE, "Upstream returned no samples for the window"));
                }
                markState(span, ReadPathState.REFRESH_SUCCEEDED);
                WriteReportType report = refresh.report();
                ForecastErrorType error = refresh.error();
                if (error == null && report.written() == 0) {
                    error = ForecastErrorType.of(ForecastErrorKind.STORAGE_ERROR,
                            "None of " + refresh.samples().size() + " fetched samples could be persisted");
                }
                return new RefreshResultType(report.written(), report.failures().size(), ServedFrom.FRESH, error);
            }

            ForecastErrorType upstreamError = refresh.error();
            if (!upstreamError.kind().allowsStaleFallback()) {
                return new RefreshResultType(0, 0, null, upstreamError);
            }
            List<CachedSampleType> stale = safeFindIncludingExpired(identity, hourly);
            if (!stale.isEmpty()) {
                markState(span, ReadPathState.REFRESH_FAILED_FALLBACK_TO_STALE);
                return new RefreshResultType(stale.size(), 0, ServedFrom.STALE, upstreamError);
            }
            markState(span, ReadPathState.REFRESH_FAILED_NO_DATA);
            return new RefreshResultType(0, 0, null, noData(upstreamError));

        } catch (RuntimeException e) {
            span.recordException(e);
            LOG.errorf(e, "Unexpected failure refreshing forecast for %s", cacheKey);
            return new RefreshResultType(0, 0, null,
                    ForecastErrorType.of(ForecastErrorKind.UNKNOWN, "Refresh failed: " + e.getMessage()));
        } finally {
            span.end();
            LoggingConfig.clearForecastContext();
        }
    }

    /**
     * Upstream usage statistics of one calendar day (today when {@code date} is null).
     */
    public ApiUsageStatsType getUsageStats(LocalDate date) {
        return usageService.getUsageStats(date == null ? usageService.today() : date);
    }

    private Optional<ForecastErrorType> validate(ForecastIdentityType identity, ForecastWindowType window,
            Granularity granularity) {
        if (identity == null) {
            return Optional.of(ForecastErrorType.of(ForecastErrorKind.VALIDATION_ERROR, "Identity is required"));
        }
        if (window == null) {
            return Optional.of(ForecastErrorType.of(ForecastErrorKind.VALIDATION_ERROR, "Window is required"));
        }
        if (granularity == null) {
            return Optional.of(ForecastErrorType.of(ForecastErrorKind.VALIDATION_ERROR, "Granularity is required"));
        }
        long hours = window.hourCount();
        if (hours > paginationSettings.maxWindowHours()) {
            return Optional.of(ForecastErrorType.of(ForecastErrorKind.VALIDATION_ERROR, "Window covers " + hours
                    + " hours, at most " + paginationSettings.maxWindowHours() + " are supported"));
        }
        return Optional.empty();
    }

    private ForecastResultType fallbackToStale(ForecastIdentityType identity, ForecastWindowType hourly,
            Granularity granularity, ForecastErrorType upstreamError, Span span) {
        span.setAttribute("error_kind", upstreamError.kind().name());

        if (!upstreamError.kind().allowsStaleFallback()) {
            LOG.warnf("Refresh rejected with %s, not serving stale data: %s", upstreamError.kind(),
                    upstreamError.message());
            return ForecastResultType.failed(granularity, upstreamError);
        }

        List<CachedSampleType> stale = safeFindIncludingExpired(identity, hourly);
        if (!stale.isEmpty()) {
            incrementCounter("forecast.cache.stale_served");
            markState(span, ReadPathState.REFRESH_FAILED_FALLBACK_TO_STALE);
            LOG.warnf("Serving %d stale samples due to %s", stale.size(), upstreamError.kind());
            return buildResult(identity, granularity, samplesOf(stale, Integer.MAX_VALUE), ServedFrom.STALE,
                    upstreamError);
        }

        markState(span, ReadPathState.REFRESH_FAILED_NO_DATA);
        LOG.warnf("No cached forecast to fall back on after %s", upstreamError.kind());
        return ForecastResultType.failed(granularity, noData(upstreamError));
    }

    private RefreshOutcome refreshCollapsed(ForecastIdentityType identity, ForecastWindowType hourly,
            Granularity granularity) {
        String key = cachePolicy.cacheKey(granularity, identity) + "|" + hourly.from() + "/" + hourly.to();
        CompletableFuture<RefreshOutcome> mine = new CompletableFuture<>();
        CompletableFuture<RefreshOutcome> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            incrementCounter("forecast.refresh.collapsed");
            LOG.debugf("Joining in-flight refresh for %s", key);
            return existing.join();
        }

        try {
            RefreshOutcome outcome = performRefresh(identity, hourly, granularity);
            mine.complete(outcome);
            return outcome;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Refresh of %s failed unexpectedly", key);
            RefreshOutcome outcome = RefreshOutcome
                    .failed(ForecastErrorType.of(ForecastErrorKind.UNKNOWN, "Refresh failed: " + e.getMessage()));
            mine.complete(outcome);
            return outcome;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    private RefreshOutcome performRefresh(ForecastIdentityType identity, ForecastWindowType hourly,
            Granularity granularity) {
        Span span = tracer.spanBuilder("forecast.refresh").setAttribute("identity_key", cachePolicy.identityKey(identity))
                .setAttribute("hours", hourly.expectedHours()).startSpan();

        try (Scope scope = span.makeCurrent()) {
            trackQuietly(identity);
            Duration timeout = retryPolicy.getSettings().fetchTimeout();
            PageAggregationType pages = pageAggregator.aggregate(hourly,
                    token -> retryPolicy.execute("forecast page fetch",
                            () -> fetchClient.fetchPage(identity, hourly, token, timeout)));
            span.setAttribute("pages_fetched", pages.pagesFetched());
            span.setAttribute("truncated", pages.truncated());

            if (pages.isFailed()) {
                incrementCounter("forecast.refresh.total", "status", "failure");
                return RefreshOutcome.failed(pages.error());
            }

            WriteReportType report = store.upsertAll(identity, pages.samples(), granularity);
            span.setAttribute("rows_written", report.written());
            if (report.written() > 0) {
                purgeAfterReplacement(identity, hourly);
                if (granularity != Granularity.HOURLY) {
                    recomputeDailyRollups(identity, pages.samples());
                }
            }

            incrementCounter("forecast.refresh.total", "status",
                    pages.isPartial() || report.hasFailures() ? "partial" : "success");
            return RefreshOutcome.succeeded(pages.samples(), report, pages.error());
        } finally {
            span.end();
        }
    }

    private void trackQuietly(ForecastIdentityType identity) {
        try {
            store.track(identity);
        } catch (StorageException e) {
            LOG.warnf(e, "Failed to register %s for scheduled refreshes", cachePolicy.identityKey(identity));
        }
    }

    /**
     * A replacement fetch has landed: drop expired rows and hours that are already past.
     */
    private void purgeAfterReplacement(ForecastIdentityType identity, ForecastWindowType hourly) {
        Instant currentHour = clock.instant().truncatedTo(ChronoUnit.HOURS);
        Instant before = hourly.from().isBefore(currentHour) ? hourly.from() : currentHour;
        try {
            long expired = store.purgeExpired(identity);
            long past = store.purgeStale(identity, before);
            LOG.debugf("Purged %d expired and %d past samples", expired, past);
        } catch (StorageException e) {
            LOG.warnf(e, "Failed to purge replaced forecast samples");
        }
    }

    private void recomputeDailyRollups(ForecastIdentityType identity, List<ForecastSampleType> samples) {
        TreeSet<LocalDate> days = new TreeSet<>();
        samples.forEach(sample -> days.add(rollupAggregator.periodStart(sample.timestamp(), Granularity.DAILY)));
        for (LocalDate day : days) {
            try {
                rollupAggregator.rollup(identity, day);
            } catch (StorageException e) {
                LOG.warnf(e, "Failed to recompute daily rollup for %s", day);
            }
        }
    }

    private List<ForecastSampleType> servedAfterRefresh(ForecastIdentityType identity, ForecastWindowType hourly,
            RefreshOutcome refresh, int required) {
        try {
            List<CachedSampleType> rows = store.rangeQuery(identity, hourly);
            if (!rows.isEmpty()) {
                return samplesOf(rows, required);
            }
        } catch (StorageException e) {
            LOG.warnf(e, "Re-reading refreshed forecast failed, serving fetched samples directly");
        }
        return refresh.samples().stream().limit(required).toList();
    }

    private ForecastResultType buildResult(ForecastIdentityType identity, Granularity granularity,
            List<ForecastSampleType> samples, ServedFrom servedFrom, ForecastErrorType error) {
        List<DailyRollupType> rollups = granularity == Granularity.HOURLY ? List.of()
                : rollupAggregator.summarize(samples, granularity);
        return new ForecastResultType(granularity, samples, rollups, servedFrom, error);
    }

    private List<CachedSampleType> safeRangeQuery(ForecastIdentityType identity, ForecastWindowType hourly) {
        try {
            return store.rangeQuery(identity, hourly);
        } catch (StorageException e) {
            incrementCounter("forecast.store.read_failures");
            LOG.warnf(e, "Forecast store read failed, treating as cache miss");
            return List.of();
        }
    }

    private List<CachedSampleType> safeFindIncludingExpired(ForecastIdentityType identity,
            ForecastWindowType hourly) {
        try {
            return store.findIncludingExpired(identity, hourly);
        } catch (StorageException e) {
            incrementCounter("forecast.store.read_failures");
            LOG.warnf(e, "Forecast store read failed while looking for stale data");
            return List.of();
        }
    }

    private static List<ForecastSampleType> samplesOf(List<CachedSampleType> rows, int limit) {
        return rows.stream().map(CachedSampleType::sample).limit(limit).toList();
    }

    private static ForecastErrorType noData(ForecastErrorType upstreamError) {
        return new ForecastErrorType(ForecastErrorKind.NO_DATA_AVAILABLE,
                "No cached forecast available after upstream failure: " + upstreamError.message(),
                upstreamError.kind());
    }

    private static void markState(Span span, ReadPathState state) {
        span.setAttribute("read_path.state", state.name());
    }

    private void incrementCounter(String name, String... tags) {
        Counter.builder(name).tags(tags).register(meterRegistry).increment();
    }

    /**
     * Result of one upstream refresh run, shared with collapsed concurrent callers.
     */
    private record RefreshOutcome(boolean succeeded, List<ForecastSampleType> samples, WriteReportType report,
            ForecastErrorType error) {

        static RefreshOutcome succeeded(List<ForecastSampleType> samples, WriteReportType report,
                ForecastErrorType partialError) {
            return new RefreshOutcome(true, samples, report, partialError);
        }

        static RefreshOutcome failed(ForecastErrorType error) {
            return new RefreshOutcome(false, List.of(), new WriteReportType(0, List.of()), error);
        }
    }
}
