/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecastcache.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.TracerProvider;
import villagecompute.forecastcache.api.types.ForecastIdentityType;
import villagecompute.forecastcache.api.types.ForecastWindowType;
import villagecompute.forecastcache.api.types.Granularity;
import villagecompute.forecastcache.api.types.ServedFrom;
import villagecompute.forecastcache.config.PaginationSettings;
import villagecompute.forecastcache.config.RetrySettings;
import villagecompute.forecastcache.config.RollupSettings;
import villagecompute.forecastcache.config.TtlSettings;
import villagecompute.forecastcache.exceptions.UpstreamStatusException;
import villagecompute.forecastcache.services.ApiUsageService;
import villagecompute.forecastcache.services.CachePolicy;
import villagecompute.forecastcache.services.DailyRollupAggregator;
import villagecompute.forecastcache.services.ForecastCacheService;
import villagecompute.forecastcache.services.PageAggregator;
import villagecompute.forecastcache.services.ResilientFetchClient;
import villagecompute.forecastcache.services.RetryPolicy;
import villagecompute.forecastcache.services.UpsertStore;
import villagecompute.forecastcache.testing.ForecastFixtures;
import villagecompute.forecastcache.testing.InMemoryFetchAttemptLog;
import villagecompute.forecastcache.testing.InMemoryForecastStorage;
import villagecompute.forecastcache.testing.MutableClock;
import villagecompute.forecastcache.testing.ScriptedUpstreamProvider;

/**
 * Runs the refresh and purge jobs against the real engine across an upstream outage.
 */
class TrackedIdentityRefreshTest {

    private static final ForecastIdentityType SEOUL = new ForecastIdentityType(null, 37.5665, 126.978);

    private InMemoryForecastStorage storage;
    private ScriptedUpstreamProvider provider;
    private MutableClock clock;
    private CachePolicy cachePolicy;
    private UpsertStore store;
    private ForecastCacheService service;
    private ForecastRefreshJobHandler refreshHandler;
    private CachePurgeJobHandler purgeHandler;

    @BeforeEach
    void setUp() {
        storage = new InMemoryForecastStorage();
        InMemoryFetchAttemptLog attemptLog = new InMemoryFetchAttemptLog();
        provider = ScriptedUpstreamProvider.paged(24);
        clock = new MutableClock(ForecastFixtures.NOW);
        MeterRegistry meterRegistry = new SimpleMeterRegistry();
        Tracer tracer = TracerProvider.noop().get("test");

        cachePolicy = new CachePolicy(TtlSettings.DEFAULTS);
        store = new UpsertStore(storage, cachePolicy, clock, meterRegistry);
        RetrySettings retrySettings = new RetrySettings(1, Duration.ofMillis(1), 2.0, Duration.ofMillis(5),
                Duration.ofSeconds(2));
        PaginationSettings paginationSettings = new PaginationSettings(10, 24, 96);
        service = new ForecastCacheService(store, cachePolicy,
                new ResilientFetchClient(provider, attemptLog, meterRegistry, clock),
                new RetryPolicy(retrySettings, delay -> {
                }), new PageAggregator(paginationSettings),
                new DailyRollupAggregator(store, RollupSettings.DEFAULTS, meterRegistry),
                new ApiUsageService(attemptLog, RollupSettings.DEFAULTS, clock), paginationSettings, clock, tracer,
                meterRegistry);

        refreshHandler = new ForecastRefreshJobHandler();
        refreshHandler.forecastCacheService = service;
        refreshHandler.upsertStore = store;
        refreshHandler.clock = clock;
        refreshHandler.tracer = tracer;
        refreshHandler.meterRegistry = meterRegistry;

        purgeHandler = new CachePurgeJobHandler();
        purgeHandler.upsertStore = store;
        purgeHandler.clock = clock;
        purgeHandler.tracer = tracer;
    }

    @Test
    void testRefreshJob_recoversIdentityAfterOutageOutlivesCachedRows() throws Exception {
        service.getForecast(SEOUL, ForecastWindowType.ofHours(ForecastFixtures.NOW, 6), Granularity.HOURLY);
        String identityKey = cachePolicy.identityKey(SEOUL);
        assertEquals(6, storage.rowCount(identityKey));

        provider.setScript((window, token) -> {
            throw new UpstreamStatusException(503, "outage");
        });
        clock.advance(Duration.ofHours(30));
        refreshHandler.execute(1L, Map.of());
        purgeHandler.execute(2L, Map.of());

        assertEquals(0, storage.rowCount(identityKey));
        assertEquals(List.of(SEOUL), store.trackedIdentities());

        provider.setScript(ScriptedUpstreamProvider.pagedScript(24));
        int callsBefore = provider.getCalls();
        refreshHandler.execute(3L, Map.of());

        assertEquals(callsBefore + 1, provider.getCalls());
        assertEquals(ForecastRefreshJobHandler.DEFAULT_HOURS, storage.rowCount(identityKey));
        assertEquals(ServedFrom.FRESH, service.getForecast(SEOUL,
                ForecastWindowType.ofHours(clock.instant(), 6), Granularity.HOURLY).servedFrom());
    }

    @Test
    void testTrack_registersIdentityEvenWhenFirstRefreshFails() {
        provider.setScript((window, token) -> {
            throw new UpstreamStatusException(503, "outage");
        });

        service.getForecast(SEOUL, ForecastWindowType.ofHours(ForecastFixtures.NOW, 6), Granularity.HOURLY);

        assertEquals(0, storage.rowCount(cachePolicy.identityKey(SEOUL)));
        assertTrue(store.trackedIdentities().contains(SEOUL));
    }
}
