/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecastcache.services;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.jboss.logging.Logger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.forecastcache.api.types.CachedSampleType;
import villagecompute.forecastcache.api.types.DailyRollupType;
import villagecompute.forecastcache.api.types.ForecastIdentityType;
import villagecompute.forecastcache.api.types.ForecastSampleType;
import villagecompute.forecastcache.api.types.ForecastWindowType;
import villagecompute.forecastcache.api.types.Granularity;
import villagecompute.forecastcache.api.types.WriteReportType;
import villagecompute.forecastcache.api.types.WriteReportType.PartialWriteFailure;
import villagecompute.forecastcache.exceptions.StorageException;
import villagecompute.forecastcache.services.storage.ForecastStorage;

/**
 * Sole writer of cached forecast rows.
 *
 * <p>
 * Stamps every row with its cache key, fetch time and granularity-dependent expiration, then upserts it keyed by
 * (identity, forecast hour). Re-upserting the same sample is idempotent apart from refreshed timestamps.
 *
 * <p>
 * Batch writes never abort: a failing row is logged, counted and reported in the {@link WriteReportType}.
 */
@ApplicationScoped
public class UpsertStore {

    private static final Logger LOG = Logger.getLogger(UpsertStore.class);

    private final ForecastStorage storage;
    private final CachePolicy cachePolicy;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    @Inject
    public UpsertStore(ForecastStorage storage, CachePolicy cachePolicy, Clock clock, MeterRegistry meterRegistry) {
        this.storage = storage;
        this.cachePolicy = cachePolicy;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Upserts one sample.
     *
     * @return the row as written
     * @throws StorageException
     *             if the row could not be written
     */
    public CachedSampleType upsert(ForecastIdentityType identity, ForecastSampleType sample, Granularity granularity) {
        Instant now = clock.instant();
        CachedSampleType row = new CachedSampleType(identity, sample, cachePolicy.sampleKey(identity, sample.timestamp()),
                now, now.plus(cachePolicy.ttl(granularity)));
        storage.upsertSample(cachePolicy.identityKey(identity), row);
        return row;
    }

    /**
     * Upserts samples one by one, skipping rows that fail.
     */
    public WriteReportType upsertAll(ForecastIdentityType identity, List<ForecastSampleType> samples,
            Granularity granularity) {
        int written = 0;
        List<PartialWriteFailure> failures = new ArrayList<>();

        for (ForecastSampleType sample : samples) {
            try {
                upsert(identity, sample, granularity);
                written++;
            } catch (StorageException e) {
                String key = cachePolicy.sampleKey(identity, sample.timestamp());
                LOG.errorf(e, "Failed to persist forecast sample %s (continuing)", key);
                Counter.builder("forecast.store.write_failures").register(meterRegistry).increment();
                failures.add(new PartialWriteFailure(sample.timestamp(), key, e.getMessage()));
            }
        }

        if (!failures.isEmpty()) {
            LOG.warnf("Persisted %d/%d forecast samples for %s", written, samples.size(),
                    cachePolicy.identityKey(identity));
        }
        return new WriteReportType(written, failures);
    }

    /**
     * Non-expired samples in the window, ordered by timestamp.
     */
    public List<CachedSampleType> rangeQuery(ForecastIdentityType identity, ForecastWindowType window) {
        return storage.findValidSamples(cachePolicy.identityKey(identity), window.from(), window.to(), clock.instant());
    }

    /**
     * Every cached sample in the window, expired included. Used for stale fallback and rollups of served data.
     */
    public List<CachedSampleType> findIncludingExpired(ForecastIdentityType identity, ForecastWindowType window) {
        return storage.findAllSamples(cachePolicy.identityKey(identity), window.from(), window.to());
    }

    /**
     * Deletes samples strictly before {@code before}.
     */
    public long purgeStale(ForecastIdentityType identity, Instant before) {
        long deleted = storage.deleteSamplesBefore(cachePolicy.identityKey(identity), before);
        if (deleted > 0) {
            LOG.debugf("Purged %d forecast samples before %s for %s", deleted, before,
                    cachePolicy.identityKey(identity));
        }
        return deleted;
    }

    /**
     * Deletes expired samples. Only call once a replacement fetch for the identity has landed.
     */
    public long purgeExpired(ForecastIdentityType identity) {
        return storage.deleteExpiredSamples(cachePolicy.identityKey(identity), clock.instant());
    }

    /**
     * Registers the identity for scheduled refreshes.
     *
     * @throws StorageException
     *             if the registration could not be written
     */
    public void track(ForecastIdentityType identity) {
        storage.trackIdentity(cachePolicy.identityKey(identity), identity, clock.instant());
    }

    /**
     * Identities registered through {@link #track}, including those whose samples have all been purged.
     */
    public List<ForecastIdentityType> trackedIdentities() {
        return storage.findTrackedIdentities();
    }

    /**
     * Replaces the persisted rollup of a period, stamping the TTL of the rollup's granularity.
     */
    public void replaceRollup(ForecastIdentityType identity, DailyRollupType rollup) {
        Instant now = clock.instant();
        storage.replaceRollup(cachePolicy.identityKey(identity), rollup, now,
                now.plus(cachePolicy.ttl(rollup.granularity())));
    }

    public Optional<DailyRollupType> findRollup(ForecastIdentityType identity, Granularity granularity,
            LocalDate periodStart) {
        return storage.findRollup(cachePolicy.identityKey(identity), granularity, periodStart);
    }

    public long deleteRollup(ForecastIdentityType identity, Granularity granularity, LocalDate periodStart) {
        return storage.deleteRollup(cachePolicy.identityKey(identity), granularity, periodStart);
    }
}
