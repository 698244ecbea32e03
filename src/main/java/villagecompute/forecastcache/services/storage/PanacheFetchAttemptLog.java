/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecastcache.services.storage;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.jboss.logging.Logger;

import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.forecastcache.api.types.FetchAttemptType;
import villagecompute.forecastcache.api.types.ForecastErrorKind;
import villagecompute.forecastcache.data.models.ApiCallLog;
import villagecompute.forecastcache.exceptions.StorageException;

/**
 * {@link FetchAttemptLog} persisting attempts as {@link ApiCallLog} rows.
 *
 * <p>
 * Each attempt is written in a new transaction so it is kept even if the surrounding request fails.
 */
@ApplicationScoped
public class PanacheFetchAttemptLog implements FetchAttemptLog {

    private static final Logger LOG = Logger.getLogger(PanacheFetchAttemptLog.class);

    @Override
    public void record(FetchAttemptType attempt) {
        try {
            QuarkusTransaction.requiringNew().run(() -> {
                ApiCallLog entry = new ApiCallLog();
                entry.provider = attempt.provider();
                entry.endpoint = attempt.endpoint();
                entry.startedAt = attempt.startedAt();
                entry.durationMs = attempt.duration().toMillis();
                entry.success = attempt.success();
                entry.errorKind = attempt.errorKind() == null ? null : attempt.errorKind().name();
                entry.httpStatus = attempt.httpStatus();
                entry.persist();
            });
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to record fetch attempt to %s (success=%s)", attempt.endpoint(), attempt.success());
        }
    }

    @Override
    public List<FetchAttemptType> findAttempts(Instant from, Instant to) {
        try {
            return QuarkusTransaction.joiningExisting()
                    .call(() -> ApiCallLog.findInRange(from, to).stream().map(PanacheFetchAttemptLog::toType).toList());
        } catch (RuntimeException e) {
            throw new StorageException("Failed to read fetch attempts", e);
        }
    }

    private static FetchAttemptType toType(ApiCallLog entry) {
        ForecastErrorKind kind = entry.errorKind == null ? null : ForecastErrorKind.valueOf(entry.errorKind);
        return new FetchAttemptType(entry.provider, entry.endpoint, entry.startedAt,
                Duration.ofMillis(entry.durationMs), entry.success, kind, entry.httpStatus);
    }
}
