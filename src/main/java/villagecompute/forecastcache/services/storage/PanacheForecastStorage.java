/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecastcache.services.storage;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import org.jboss.logging.Logger;

import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.forecastcache.api.types.CachedSampleType;
import villagecompute.forecastcache.api.types.DailyRollupType;
import villagecompute.forecastcache.api.types.ForecastIdentityType;
import villagecompute.forecastcache.api.types.Granularity;
import villagecompute.forecastcache.data.models.DailyRollup;
import villagecompute.forecastcache.data.models.ForecastSample;
import villagecompute.forecastcache.data.models.TrackedLocation;
import villagecompute.forecastcache.exceptions.StorageException;

/**
 * {@link ForecastStorage} backed by the {@link ForecastSample}, {@link DailyRollup} and {@link TrackedLocation} Panache
 * entities.
 *
 * <p>
 * Writes run in their own transaction ({@code QuarkusTransaction.requiringNew()}) so one failing row never rolls back
 * its neighbours. Reads join the caller's transaction when there is one.
 */
@ApplicationScoped
public class PanacheForecastStorage implements ForecastStorage {

    private static final Logger LOG = Logger.getLogger(PanacheForecastStorage.class);

    @Override
    public void upsertSample(String identityKey, CachedSampleType row) {
        write("upsert sample " + row.cacheKey(), () -> {
            ForecastSample entity = ForecastSample.findByIdentityAndTime(identityKey, row.sample().timestamp())
                    .orElseGet(ForecastSample::new);
            boolean inserted = entity.id == null;

            entity.identityKey = identityKey;
            entity.cacheKey = row.cacheKey();
            entity.subjectId = row.identity().subjectId();
            entity.latitude = row.identity().latitude();
            entity.longitude = row.identity().longitude();
            entity.applySample(row.sample());
            entity.fetchedAt = row.fetchedAt();
            entity.expiresAt = row.expiresAt();
            entity.updatedAt = row.fetchedAt();
            entity.persist();

            LOG.tracef("%s forecast sample %s (expires %s)", inserted ? "Inserted" : "Updated", row.cacheKey(),
                    row.expiresAt());
        });
    }

    @Override
    public List<CachedSampleType> findValidSamples(String identityKey, Instant from, Instant to, Instant asOf) {
        return read("find valid samples for " + identityKey, () -> ForecastSample
                .findValidInRange(identityKey, from, to, asOf).stream().map(ForecastSample::toCachedType).toList());
    }

    @Override
    public List<CachedSampleType> findAllSamples(String identityKey, Instant from, Instant to) {
        return read("find samples for " + identityKey, () -> ForecastSample.findAllInRange(identityKey, from, to)
                .stream().map(ForecastSample::toCachedType).toList());
    }

    @Override
    public long deleteSamplesBefore(String identityKey, Instant before) {
        return writeAndGet("delete samples before " + before,
                () -> ForecastSample.deleteBefore(identityKey, before));
    }

    @Override
    public long deleteExpiredSamples(String identityKey, Instant asOf) {
        return writeAndGet("delete expired samples", () -> ForecastSample.deleteExpired(identityKey, asOf));
    }

    @Override
    public void trackIdentity(String identityKey, ForecastIdentityType identity, Instant requestedAt) {
        write("track identity " + identityKey, () -> {
            TrackedLocation entity = TrackedLocation.findByIdentityKey(identityKey).orElseGet(() -> {
                TrackedLocation created = new TrackedLocation();
                created.identityKey = identityKey;
                created.subjectId = identity.subjectId();
                created.latitude = identity.latitude();
                created.longitude = identity.longitude();
                created.firstRequestedAt = requestedAt;
                LOG.infof("Tracking new forecast location %s", identityKey);
                return created;
            });
            entity.lastRequestedAt = requestedAt;
            entity.persist();
        });
    }

    @Override
    public List<ForecastIdentityType> findTrackedIdentities() {
        return read("find tracked identities",
                () -> TrackedLocation.listTracked().stream().map(TrackedLocation::toIdentityType).toList());
    }

    @Override
    public void replaceRollup(String identityKey, DailyRollupType rollup, Instant computedAt, Instant expiresAt) {
        write("replace rollup " + rollup.granularity() + " " + rollup.periodStart(), () -> {
            DailyRollup entity = DailyRollup.findByPeriod(identityKey, rollup.granularity(), rollup.periodStart())
                    .orElseGet(DailyRollup::new);
            entity.identityKey = identityKey;
            entity.applyRollup(rollup);
            entity.computedAt = computedAt;
            entity.expiresAt = expiresAt;
            entity.persist();
        });
    }

    @Override
    public Optional<DailyRollupType> findRollup(String identityKey, Granularity granularity, LocalDate periodStart) {
        return read("find rollup " + granularity + " " + periodStart,
                () -> DailyRollup.findByPeriod(identityKey, granularity, periodStart).map(DailyRollup::toRollupType));
    }

    @Override
    public long deleteRollup(String identityKey, Granularity granularity, LocalDate periodStart) {
        return writeAndGet("delete rollup " + granularity + " " + periodStart,
                () -> DailyRollup.deleteByPeriod(identityKey, granularity, periodStart));
    }

    private void write(String operation, Runnable work) {
        try {
            QuarkusTransaction.requiringNew().run(work);
        } catch (RuntimeException e) {
            throw new StorageException("Failed to " + operation, e);
        }
    }

    private <T> T writeAndGet(String operation, Supplier<T> work) {
        try {
            return QuarkusTransaction.requiringNew().call(work::get);
        } catch (RuntimeException e) {
            throw new StorageException("Failed to " + operation, e);
        }
    }

    private <T> T read(String operation, Supplier<T> work) {
        try {
            return QuarkusTransaction.joiningExisting().call(work::get);
        } catch (RuntimeException e) {
            throw new StorageException("Failed to " + operation, e);
        }
    }
}
