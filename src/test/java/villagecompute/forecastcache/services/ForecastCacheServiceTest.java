/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecastcache.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.trace.TracerProvider;
import villagecompute.forecastcache.api.types.ApiUsageStatsType;
import villagecompute.forecastcache.api.types.ForecastErrorKind;
import villagecompute.forecastcache.api.types.ForecastIdentityType;
import villagecompute.forecastcache.api.types.ForecastResultType;
import villagecompute.forecastcache.api.types.ForecastWindowType;
import villagecompute.forecastcache.api.types.Granularity;
import villagecompute.forecastcache.api.types.RefreshResultType;
import villagecompute.forecastcache.api.types.ServedFrom;
import villagecompute.forecastcache.api.types.UpstreamPageType;
import villagecompute.forecastcache.config.PaginationSettings;
import villagecompute.forecastcache.config.RetrySettings;
import villagecompute.forecastcache.config.RollupSettings;
import villagecompute.forecastcache.config.TtlSettings;
import villagecompute.forecastcache.exceptions.UpstreamStatusException;
import villagecompute.forecastcache.testing.ForecastFixtures;
import villagecompute.forecastcache.testing.InMemoryFetchAttemptLog;
import villagecompute.forecastcache.testing.InMemoryForecastStorage;
import villagecompute.forecastcache.testing.MutableClock;
import villagecompute.forecastcache.testing.ScriptedUpstreamProvider;

/**
 * Unit tests for {@link ForecastCacheService}.
 * <p>
 * Wires the real engine around an in-memory store and a scripted upstream.
 */
class ForecastCacheServiceTest {

    private static final ForecastIdentityType IDENTITY = new ForecastIdentityType(null, 37.5665, 126.978);
    private static final ForecastWindowType WINDOW = ForecastWindowType.ofHours(ForecastFixtures.NOW, 6);

    private InMemoryForecastStorage storage;
    private InMemoryFetchAttemptLog attemptLog;
    private ScriptedUpstreamProvider provider;
    private MutableClock clock;
    private MeterRegistry meterRegistry;
    private ResilientFetchClient fetchClient;
    private ForecastCacheService service;

    @BeforeEach
    void setUp() {
        storage = new InMemoryForecastStorage();
        attemptLog = new InMemoryFetchAttemptLog();
        provider = ScriptedUpstreamProvider.paged(4);
        clock = new MutableClock(ForecastFixtures.NOW);
        meterRegistry = new SimpleMeterRegistry();

        CachePolicy cachePolicy = new CachePolicy(TtlSettings.DEFAULTS);
        UpsertStore store = new UpsertStore(storage, cachePolicy, clock, meterRegistry);
        RetrySettings retrySettings = new RetrySettings(2, Duration.ofMillis(1), 2.0, Duration.ofMillis(5),
                Duration.ofSeconds(2));
        PaginationSettings paginationSettings = new PaginationSettings(10, 4, 96);
        fetchClient = new ResilientFetchClient(provider, attemptLog, meterRegistry, clock);

        service = new ForecastCacheService(store, cachePolicy, fetchClient,
                new RetryPolicy(retrySettings, delay -> {
                }), new PageAggregator(paginationSettings),
                new DailyRollupAggregator(store, RollupSettings.DEFAULTS, meterRegistry),
                new ApiUsageService(attemptLog, RollupSettings.DEFAULTS, clock), paginationSettings, clock,
                TracerProvider.noop().get("test"), meterRegistry);
    }

    @Test
    void testGetForecast_missRefreshesThenHits() {
        ForecastResultType first = service.getForecast(IDENTITY, WINDOW, Granularity.HOURLY);

        assertEquals(ServedFrom.FRESH, first.servedFrom());
        assertNull(first.error());
        assertEquals(6, first.samples().size());
        assertEquals(2, provider.getCalls());
        assertEquals(1.0, meterRegistry.counter("forecast.cache.misses").count());

        ForecastResultType second = service.getForecast(IDENTITY, WINDOW, Granularity.HOURLY);

        assertEquals(ServedFrom.FRESH, second.servedFrom());
        assertEquals(first.samples(), second.samples());
        assertEquals(2, provider.getCalls());
        assertEquals(1.0, meterRegistry.counter("forecast.cache.hits").count());
    }

    @Test
    void testGetForecast_samplesOrderedByTimestamp() {
        ForecastResultType result = service.getForecast(IDENTITY, WINDOW, Granularity.HOURLY);

        List<Instant> timestamps = new ArrayList<>();
        result.samples().forEach(sample -> timestamps.add(sample.timestamp()));
        List<Instant> sorted = new ArrayList<>(timestamps);
        sorted.sort(null);
        assertEquals(sorted, timestamps);
        assertEquals(WINDOW.from(), timestamps.get(0));
    }

    @Test
    void testGetForecast_expiredRowsTriggerRefresh() {
        service.getForecast(IDENTITY, WINDOW, Granularity.HOURLY);
        clock.advance(Duration.ofMinutes(61));

        ForecastResultType result = service.getForecast(IDENTITY, WINDOW, Granularity.HOURLY);

        assertEquals(ServedFrom.FRESH, result.servedFrom());
        assertEquals(4, provider.getCalls());
    }

    @Test
    void testGetForecast_upstreamDownServesStale() {
        service.getForecast(IDENTITY, WINDOW, Granularity.HOURLY);
        clock.advance(Duration.ofHours(2));
        provider.setScript((window, token) -> {
            throw new UpstreamStatusException(503, "maintenance");
        });

        ForecastResultType result = service.getForecast(IDENTITY, WINDOW, Granularity.HOURLY);

        assertEquals(ServedFrom.STALE, result.servedFrom());
        assertEquals(6, result.samples().size());
        assertEquals(ForecastErrorKind.UPSTREAM_UNAVAILABLE, result.error().kind());
        // one successful refresh (2 pages) plus 1 + 2 retries on the failing first page
        assertEquals(5, provider.getCalls());
        assertEquals(1.0, meterRegistry.counter("forecast.cache.stale_served").count());
    }

    @Test
    void testGetForecast_rateLimitedServesStaleWithoutRetry() {
        service.getForecast(IDENTITY, WINDOW, Granularity.HOURLY);
        clock.advance(Duration.ofHours(2));
        provider.setScript((window, token) -> {
            throw new UpstreamStatusException(429, "quota");
        });

        ForecastResultType result = service.getForecast(IDENTITY, WINDOW, Granularity.HOURLY);

        assertEquals(ServedFrom.STALE, result.servedFrom());
        assertEquals(ForecastErrorKind.RATE_LIMITED, result.error().kind());
        assertEquals(3, provider.getCalls());
    }

    @Test
    void testGetForecast_nothingCachedAndUpstreamDownIsNoData() {
        provider.setScript((window, token) -> {
            throw new UpstreamStatusException(500, "boom");
        });

        ForecastResultType result = service.getForecast(IDENTITY, WINDOW, Granularity.HOURLY);

        assertFalse(result.hasData());
        assertNull(result.servedFrom());
        assertEquals(ForecastErrorKind.NO_DATA_AVAILABLE, result.error().kind());
        assertEquals(ForecastErrorKind.UPSTREAM_UNAVAILABLE, result.error().causeKind());
    }

    @Test
    void testGetForecast_badRequestNeverServesStale() {
        service.getForecast(IDENTITY, WINDOW, Granularity.HOURLY);
        clock.advance(Duration.ofHours(2));
        provider.setScript((window, token) -> {
            throw new UpstreamStatusException(400, "invalid location");
        });

        ForecastResultType result = service.getForecast(IDENTITY, WINDOW, Granularity.HOURLY);

        assertFalse(result.hasData());
        assertEquals(ForecastErrorKind.BAD_REQUEST, result.error().kind());
        assertEquals(3, provider.getCalls());
    }

    @Test
    void testGetForecast_storeReadFailureTreatedAsMiss() {
        service.getForecast(IDENTITY, WINDOW, Granularity.HOURLY);
        storage.setFailReads(true);

        ForecastResultType result = service.getForecast(IDENTITY, WINDOW, Granularity.HOURLY);

        assertEquals(ServedFrom.FRESH, result.servedFrom());
        assertEquals(6, result.samples().size());
        assertEquals(4, provider.getCalls());
        assertEquals(1.0, meterRegistry.counter("forecast.store.read_failures").count());
    }

    @Test
    void testGetForecast_emptyUpstreamIsNoData() {
        provider.setScript((window, token) -> new UpstreamPageType(List.of(), null));

        ForecastResultType result = service.getForecast(IDENTITY, WINDOW, Granularity.HOURLY);

        assertEquals(ForecastErrorKind.NO_DATA_AVAILABLE, result.error().kind());
        assertFalse(result.hasData());
    }

    @Test
    void testGetForecast_partialPaginationServesWithError() {
        ScriptedUpstreamProvider.PageScript paged = ScriptedUpstreamProvider.pagedScript(4);
        provider.setScript((window, token) -> {
            if (token != null) {
                throw new UpstreamStatusException(503, "second page down");
            }
            return paged.page(window, null);
        });

        ForecastResultType result = service.getForecast(IDENTITY, WINDOW, Granularity.HOURLY);

        assertEquals(ServedFrom.FRESH, result.servedFrom());
        assertEquals(4, result.samples().size());
        assertEquals(ForecastErrorKind.UPSTREAM_UNAVAILABLE, result.error().kind());
    }

    @Test
    void testGetForecast_dailyGranularityAddsRollups() {
        ForecastWindowType day = new ForecastWindowType(Instant.parse("2025-03-10T00:00:00Z"),
                Instant.parse("2025-03-11T00:00:00Z"));

        ForecastResultType result = service.getForecast(IDENTITY, day, Granularity.DAILY);

        assertEquals(24, result.samples().size());
        assertEquals(1, result.rollups().size());
        // PM2.5 is the hour index 0..23
        assertEquals(11.5, result.rollups().get(0).averages().values().iterator().next());
        assertEquals(1, storage.rollupCount());
    }

    @Test
    void testGetForecast_rejectsOversizedWindow() {
        ForecastWindowType tooLong = ForecastWindowType.ofHours(ForecastFixtures.NOW, 97);

        ForecastResultType result = service.getForecast(IDENTITY, tooLong, Granularity.HOURLY);

        assertEquals(ForecastErrorKind.VALIDATION_ERROR, result.error().kind());
        assertEquals(0, provider.getCalls());
    }

    @Test
    void testGetForecast_rejectsWindowBeyondIntHours() {
        ForecastWindowType wrapsNegative = new ForecastWindowType(ForecastFixtures.NOW,
                ForecastFixtures.NOW.plus((1L << 31) + 10, ChronoUnit.HOURS));
        ForecastWindowType wrapsSmall = new ForecastWindowType(ForecastFixtures.NOW,
                ForecastFixtures.NOW.plus((1L << 32) + 6, ChronoUnit.HOURS));

        assertEquals(ForecastErrorKind.VALIDATION_ERROR,
                service.getForecast(IDENTITY, wrapsNegative, Granularity.HOURLY).error().kind());
        assertEquals(ForecastErrorKind.VALIDATION_ERROR,
                service.getForecast(IDENTITY, wrapsSmall, Granularity.HOURLY).error().kind());
        assertEquals(ForecastErrorKind.VALIDATION_ERROR,
                service.refreshNow(IDENTITY, wrapsSmall, Granularity.HOURLY).error().kind());
        assertEquals(0, provider.getCalls());
    }

    @Test
    void testGetForecast_rejectsMissingArguments() {
        assertEquals(ForecastErrorKind.VALIDATION_ERROR,
                service.getForecast(null, WINDOW, Granularity.HOURLY).error().kind());
        assertEquals(ForecastErrorKind.VALIDATION_ERROR,
                service.getForecast(IDENTITY, null, Granularity.HOURLY).error().kind());
        assertEquals(ForecastErrorKind.VALIDATION_ERROR, service.getForecast(IDENTITY, WINDOW, null).error().kind());
    }

    @Test
    void testGetForecast_concurrentMissesCollapseIntoOneRefresh() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        ScriptedUpstreamProvider.PageScript paged = ScriptedUpstreamProvider.pagedScript(24);
        provider.setScript((window, token) -> {
            release.await(5, TimeUnit.SECONDS);
            return paged.page(window, token);
        });

        ExecutorService callers = Executors.newFixedThreadPool(4);
        try {
            List<Future<ForecastResultType>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                futures.add(callers.submit(() -> service.getForecast(IDENTITY, WINDOW, Granularity.HOURLY)));
            }
            Thread.sleep(200);
            release.countDown();

            for (Future<ForecastResultType> future : futures) {
                ForecastResultType result = future.get(10, TimeUnit.SECONDS);
                assertEquals(ServedFrom.FRESH, result.servedFrom());
                assertEquals(6, result.samples().size());
            }
        } finally {
            callers.shutdownNow();
        }

        assertEquals(1, provider.getCalls());
    }

    @Test
    void testGetForecast_concurrentMissesOfDifferentGranularityRefreshSeparately() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        ScriptedUpstreamProvider.PageScript paged = ScriptedUpstreamProvider.pagedScript(24);
        provider.setScript((window, token) -> {
            release.await(5, TimeUnit.SECONDS);
            return paged.page(window, token);
        });

        ExecutorService callers = Executors.newFixedThreadPool(2);
        ForecastResultType hourly;
        ForecastResultType daily;
        try {
            Future<ForecastResultType> hourlyFuture = callers
                    .submit(() -> service.getForecast(IDENTITY, WINDOW, Granularity.HOURLY));
            Future<ForecastResultType> dailyFuture = callers
                    .submit(() -> service.getForecast(IDENTITY, WINDOW, Granularity.DAILY));
            Thread.sleep(200);
            release.countDown();
            hourly = hourlyFuture.get(10, TimeUnit.SECONDS);
            daily = dailyFuture.get(10, TimeUnit.SECONDS);
        } finally {
            callers.shutdownNow();
        }

        assertEquals(2, provider.getCalls());
        assertEquals(12, storage.getUpserts());
        assertEquals(0.0, meterRegistry.counter("forecast.refresh.collapsed").count());
        assertTrue(hourly.rollups().isEmpty());
        assertEquals(1, daily.rollups().size());
        assertEquals(1, storage.rollupCount());
    }

    @Test
    void testRefreshNow_writesRowsAndPurgesPast() {
        ForecastWindowType earlier = ForecastWindowType.ofHours(ForecastFixtures.NOW.minus(3, ChronoUnit.HOURS), 2);
        service.refreshNow(IDENTITY, earlier, Granularity.HOURLY);

        RefreshResultType result = service.refreshNow(IDENTITY, WINDOW, Granularity.HOURLY);

        assertEquals(6, result.count());
        assertEquals(0, result.writeFailures());
        assertEquals(ServedFrom.FRESH, result.servedFrom());
        assertNull(result.error());
        assertEquals(6, storage.rowCount(new CachePolicy(TtlSettings.DEFAULTS).identityKey(IDENTITY)));
    }

    @Test
    void testRefreshNow_allWritesFailingIsStorageError() {
        storage.setFailWrites(true);

        RefreshResultType result = service.refreshNow(IDENTITY, WINDOW, Granularity.HOURLY);

        assertEquals(0, result.count());
        assertEquals(6, result.writeFailures());
        assertEquals(ForecastErrorKind.STORAGE_ERROR, result.error().kind());
    }

    @Test
    void testRefreshNow_failureReportsStaleRows() {
        service.refreshNow(IDENTITY, WINDOW, Granularity.HOURLY);
        provider.setScript((window, token) -> {
            throw new UpstreamStatusException(429, "quota");
        });

        RefreshResultType result = service.refreshNow(IDENTITY, WINDOW, Granularity.HOURLY);

        assertEquals(ServedFrom.STALE, result.servedFrom());
        assertEquals(6, result.count());
        assertEquals(ForecastErrorKind.RATE_LIMITED, result.error().kind());
    }

    @Test
    void testGetUsageStats_countsEveryAttempt() {
        provider.setScript((window, token) -> {
            throw new UpstreamStatusException(503, "down");
        });
        service.getForecast(IDENTITY, WINDOW, Granularity.HOURLY);

        ApiUsageStatsType stats = service.getUsageStats(null);

        assertNotNull(stats);
        assertEquals(LocalDate.of(2025, 3, 10), stats.date());
        assertEquals(3, stats.totalCalls());
        assertEquals(3, stats.failedCalls());
        assertTrue(stats.remainingCalls() < stats.dailyLimit());
    }
}
