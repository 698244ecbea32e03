/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecastcache.services;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.forecastcache.api.types.ApiUsageStatsType;
import villagecompute.forecastcache.api.types.FetchAttemptType;
import villagecompute.forecastcache.config.RollupSettings;
import villagecompute.forecastcache.services.storage.FetchAttemptLog;

/**
 * Daily upstream usage accounting over the fetch-attempt log.
 *
 * <p>
 * Every attempt counts against the daily limit, retries included.
 */
@ApplicationScoped
public class ApiUsageService {

    private static final Logger LOG = Logger.getLogger(ApiUsageService.class);

    private final FetchAttemptLog attemptLog;
    private final RollupSettings settings;
    private final Clock clock;

    @Inject
    public ApiUsageService(FetchAttemptLog attemptLog, RollupSettings settings, Clock clock) {
        this.attemptLog = attemptLog;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Calendar day of "now" in the configured zone.
     */
    public LocalDate today() {
        return LocalDate.now(clock.withZone(settings.zone()));
    }

    /**
     * Usage statistics of one calendar day.
     *
     * @throws villagecompute.forecastcache.exceptions.StorageException
     *             if the log cannot be read
     */
    public ApiUsageStatsType getUsageStats(LocalDate date) {
        Instant from = date.atStartOfDay(settings.zone()).toInstant();
        Instant to = date.plusDays(1).atStartOfDay(settings.zone()).toInstant();
        List<FetchAttemptType> attempts = attemptLog.findAttempts(from, to);

        long total = attempts.size();
        long successful = attempts.stream().filter(FetchAttemptType::success).count();
        long avgResponseTime = Math.round(
                attempts.stream().mapToLong(attempt -> attempt.duration().toMillis()).average().orElse(0.0));
        int limit = settings.dailyCallLimit();
        long remaining = Math.max(0, limit - total);
        int usagePercentage = (int) Math.round(total * 100.0 / limit);

        if (total >= limit) {
            LOG.warnf("Upstream call budget exhausted for %s: %d/%d calls", date, total, limit);
        }
        return new ApiUsageStatsType(date, total, successful, total - successful, avgResponseTime, limit, remaining,
                usagePercentage);
    }
}
