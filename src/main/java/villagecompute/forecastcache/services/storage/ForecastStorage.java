/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecastcache.services.storage;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import villagecompute.forecastcache.api.types.CachedSampleType;
import villagecompute.forecastcache.api.types.DailyRollupType;
import villagecompute.forecastcache.api.types.ForecastIdentityType;
import villagecompute.forecastcache.api.types.Granularity;

/**
 * Row-level persistence for cached forecast samples and rollups.
 *
 * <p>
 * Every method throws {@link villagecompute.forecastcache.exceptions.StorageException} when the backing store fails.
 * Each write commits independently of the caller's transaction.
 */
public interface ForecastStorage {

    /**
     * Inserts the row, or overwrites metrics, payload, fetch time and expiration of the existing row with the same
     * identity key and forecast hour.
     */
    void upsertSample(String identityKey, CachedSampleType row);

    /**
     * Non-expired rows with forecast hour in {@code [from, to)}, ordered by forecast hour.
     */
    List<CachedSampleType> findValidSamples(String identityKey, Instant from, Instant to, Instant asOf);

    /**
     * All rows with forecast hour in {@code [from, to)}, expired included, ordered by forecast hour.
     */
    List<CachedSampleType> findAllSamples(String identityKey, Instant from, Instant to);

    long deleteSamplesBefore(String identityKey, Instant before);

    long deleteExpiredSamples(String identityKey, Instant asOf);

    /**
     * Registers the identity for scheduled refreshes, or bumps its last request time when already registered.
     */
    void trackIdentity(String identityKey, ForecastIdentityType identity, Instant requestedAt);

    /**
     * Registered identities, oldest registration first. Sample purges never remove them.
     */
    List<ForecastIdentityType> findTrackedIdentities();

    void replaceRollup(String identityKey, DailyRollupType rollup, Instant computedAt, Instant expiresAt);

    Optional<DailyRollupType> findRollup(String identityKey, Granularity granularity, LocalDate periodStart);

    long deleteRollup(String identityKey, Granularity granularity, LocalDate periodStart);
}
