/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecastcache.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import villagecompute.forecastcache.api.types.CachedSampleType;
import villagecompute.forecastcache.api.types.ForecastIdentityType;
import villagecompute.forecastcache.api.types.ForecastMetric;
import villagecompute.forecastcache.api.types.ForecastSampleType;
import villagecompute.forecastcache.api.types.ForecastWindowType;
import villagecompute.forecastcache.api.types.Granularity;
import villagecompute.forecastcache.api.types.WriteReportType;
import villagecompute.forecastcache.config.TtlSettings;
import villagecompute.forecastcache.exceptions.StorageException;
import villagecompute.forecastcache.testing.ForecastFixtures;
import villagecompute.forecastcache.testing.InMemoryForecastStorage;
import villagecompute.forecastcache.testing.MutableClock;

/**
 * Unit tests for {@link UpsertStore}.
 */
class UpsertStoreTest {

    private static final ForecastIdentityType IDENTITY = new ForecastIdentityType(null, 37.77, -122.42);

    private InMemoryForecastStorage storage;
    private MutableClock clock;
    private MeterRegistry meterRegistry;
    private CachePolicy cachePolicy;
    private UpsertStore store;

    @BeforeEach
    void setUp() {
        storage = new InMemoryForecastStorage();
        clock = new MutableClock(ForecastFixtures.NOW);
        meterRegistry = new SimpleMeterRegistry();
        cachePolicy = new CachePolicy(TtlSettings.DEFAULTS);
        store = new UpsertStore(storage, cachePolicy, clock, meterRegistry);
    }

    @Test
    void testUpsert_stampsExpirationFromGranularity() {
        Instant hour = ForecastFixtures.NOW.truncatedTo(ChronoUnit.HOURS);

        CachedSampleType hourly = store.upsert(IDENTITY, ForecastFixtures.sample(hour, 10), Granularity.HOURLY);
        CachedSampleType weekly = store.upsert(IDENTITY, ForecastFixtures.sample(hour, 10), Granularity.WEEKLY);

        assertEquals(ForecastFixtures.NOW.plus(Duration.ofHours(1)), hourly.expiresAt());
        assertEquals(ForecastFixtures.NOW.plus(Duration.ofHours(24)), weekly.expiresAt());
        assertEquals(ForecastFixtures.NOW, weekly.fetchedAt());
        assertEquals(cachePolicy.sampleKey(IDENTITY, hour), weekly.cacheKey());
    }

    @Test
    void testUpsert_sameSampleTwiceKeepsOneRow() {
        Instant hour = ForecastFixtures.NOW.truncatedTo(ChronoUnit.HOURS);
        ForecastSampleType sample = ForecastFixtures.sample(hour, 12.5);

        store.upsert(IDENTITY, sample, Granularity.HOURLY);
        clock.advance(Duration.ofMinutes(5));
        CachedSampleType second = store.upsert(IDENTITY, sample, Granularity.HOURLY);

        assertEquals(1, storage.rowCount(cachePolicy.identityKey(IDENTITY)));
        assertEquals(clock.instant(), second.fetchedAt());
        List<CachedSampleType> rows = store.rangeQuery(IDENTITY, ForecastWindowType.ofHours(hour, 1));
        assertEquals(12.5, rows.get(0).sample().metric(ForecastMetric.PM25));
    }

    @Test
    void testUpsert_newerValueOverwritesExpiredRow() {
        Instant hour = ForecastFixtures.NOW.truncatedTo(ChronoUnit.HOURS);
        ForecastWindowType window = ForecastWindowType.ofHours(hour, 1);
        store.upsert(IDENTITY, ForecastFixtures.sample(hour, 1), Granularity.HOURLY);

        clock.advance(Duration.ofHours(2));
        assertTrue(store.rangeQuery(IDENTITY, window).isEmpty());
        assertEquals(1, store.findIncludingExpired(IDENTITY, window).size());

        store.upsert(IDENTITY, ForecastFixtures.sample(hour, 2), Granularity.HOURLY);

        List<CachedSampleType> rows = store.rangeQuery(IDENTITY, window);
        assertEquals(1, rows.size());
        assertEquals(2.0, rows.get(0).sample().metric(ForecastMetric.PM25));
    }

    @Test
    void testUpsertAll_partialFailureReportsAndContinues() {
        ForecastWindowType window = ForecastWindowType.ofHours(ForecastFixtures.NOW, 4);
        List<ForecastSampleType> samples = ForecastFixtures.hourlySamples(window);
        storage.failWritesAt(samples.get(1).timestamp());

        WriteReportType report = store.upsertAll(IDENTITY, samples, Granularity.HOURLY);

        assertEquals(3, report.written());
        assertEquals(1, report.failures().size());
        assertEquals(samples.get(1).timestamp(), report.failures().get(0).timestamp());
        assertEquals(3, store.rangeQuery(IDENTITY, window).size());
        assertEquals(1.0, meterRegistry.counter("forecast.store.write_failures").count());
    }

    @Test
    void testUpsert_singleFailurePropagates() {
        storage.setFailWrites(true);

        assertThrows(StorageException.class,
                () -> store.upsert(IDENTITY, ForecastFixtures.sample(ForecastFixtures.NOW, 1), Granularity.HOURLY));
    }

    @Test
    void testPurge_expiredAndPastRows() {
        ForecastWindowType window = ForecastWindowType.ofHours(ForecastFixtures.NOW.minus(2, ChronoUnit.HOURS), 4);
        store.upsertAll(IDENTITY, ForecastFixtures.hourlySamples(window), Granularity.HOURLY);

        long past = store.purgeStale(IDENTITY, ForecastFixtures.NOW.truncatedTo(ChronoUnit.HOURS));
        clock.advance(Duration.ofHours(2));
        long expired = store.purgeExpired(IDENTITY);

        assertEquals(2, past);
        assertEquals(2, expired);
        assertEquals(0, storage.rowCount(cachePolicy.identityKey(IDENTITY)));
    }

    @Test
    void testTrackedIdentities_surviveSamplePurges() {
        ForecastIdentityType other = new ForecastIdentityType("owner", 1, 1);
        store.track(IDENTITY);
        store.track(other);
        store.track(IDENTITY);
        store.upsert(IDENTITY, ForecastFixtures.sample(ForecastFixtures.NOW, 1), Granularity.HOURLY);

        store.purgeStale(IDENTITY, ForecastFixtures.NOW.plus(1, ChronoUnit.DAYS));

        assertEquals(0, storage.rowCount(cachePolicy.identityKey(IDENTITY)));
        assertEquals(List.of(IDENTITY, other), store.trackedIdentities());
    }
}
