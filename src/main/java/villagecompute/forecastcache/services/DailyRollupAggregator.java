/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecastcache.services;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import org.jboss.logging.Logger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.forecastcache.api.types.CachedSampleType;
import villagecompute.forecastcache.api.types.DailyRollupType;
import villagecompute.forecastcache.api.types.ForecastIdentityType;
import villagecompute.forecastcache.api.types.ForecastMetric;
import villagecompute.forecastcache.api.types.ForecastSampleType;
import villagecompute.forecastcache.api.types.ForecastWindowType;
import villagecompute.forecastcache.api.types.Granularity;
import villagecompute.forecastcache.config.RollupSettings;
import villagecompute.forecastcache.exceptions.StorageException;

/**
 * Rolls hourly samples up into daily or weekly per-metric means.
 *
 * <h2>Algorithm</h2>
 * <ul>
 * <li>Samples are bucketed by calendar day (or ISO week starting Monday) in the configured zone</li>
 * <li>Each metric is averaged independently over the samples that carry it</li>
 * <li>{@code sampleCount} counts samples carrying at least one metric</li>
 * <li>A bucket with no contributing sample produces no rollup</li>
 * </ul>
 *
 * <p>
 * Rollups only cover hours already present in the cache; they never extend past the cached hourly horizon.
 */
@ApplicationScoped
public class DailyRollupAggregator {

    private static final Logger LOG = Logger.getLogger(DailyRollupAggregator.class);

    private final UpsertStore store;
    private final RollupSettings settings;
    private final MeterRegistry meterRegistry;

    @Inject
    public DailyRollupAggregator(UpsertStore store, RollupSettings settings, MeterRegistry meterRegistry) {
        this.store = store;
        this.settings = settings;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Computes and persists the daily rollup of one identity and day.
     *
     * <p>
     * When the day has no contributing samples any previously persisted rollup is removed and empty is returned.
     *
     * @throws StorageException
     *             if the day's samples cannot be read or the rollup cannot be written
     */
    public Optional<DailyRollupType> rollup(ForecastIdentityType identity, LocalDate date) {
        ZoneId zone = settings.zone();
        Instant from = date.atStartOfDay(zone).toInstant();
        Instant to = date.plusDays(1).atStartOfDay(zone).toInstant();

        List<ForecastSampleType> samples = store.rangeQuery(identity, new ForecastWindowType(from, to)).stream()
                .map(CachedSampleType::sample).toList();
        List<DailyRollupType> rollups = summarize(samples, Granularity.DAILY);

        if (rollups.isEmpty()) {
            long removed = store.deleteRollup(identity, Granularity.DAILY, date);
            LOG.debugf("No samples for %s on %s, rollup skipped (%d stale rollups removed)", identity, date, removed);
            incrementCounter("forecast.rollup.total", "status", "empty");
            return Optional.empty();
        }

        DailyRollupType rollup = rollups.get(0);
        store.replaceRollup(identity, rollup);
        incrementCounter("forecast.rollup.total", "status", "persisted");
        LOG.debugf("Persisted daily rollup for %s on %s over %d samples", identity, date, rollup.sampleCount());
        return Optional.of(rollup);
    }

    /**
     * Buckets samples into calendar periods and averages each metric independently. Pure; does not touch the store.
     *
     * @param samples
     *            hourly samples in any order
     * @param granularity
     *            DAILY or WEEKLY
     * @return rollups ordered by period start, empty periods omitted
     * @throws IllegalArgumentException
     *             for HOURLY, which has nothing to roll up
     */
    public List<DailyRollupType> summarize(List<ForecastSampleType> samples, Granularity granularity) {
        if (granularity == Granularity.HOURLY) {
            throw new IllegalArgumentException("Hourly samples are not rolled up");
        }

        Map<LocalDate, List<ForecastSampleType>> buckets = new TreeMap<>();
        for (ForecastSampleType sample : samples) {
            buckets.computeIfAbsent(periodStart(sample.timestamp(), granularity), key -> new ArrayList<>())
                    .add(sample);
        }

        List<DailyRollupType> rollups = new ArrayList<>();
        buckets.forEach((periodStart, bucket) -> average(granularity, periodStart, bucket).ifPresent(rollups::add));
        return rollups;
    }

    /**
     * First day of the period containing {@code timestamp}.
     */
    public LocalDate periodStart(Instant timestamp, Granularity granularity) {
        LocalDate day = timestamp.atZone(settings.zone()).toLocalDate();
        if (granularity == Granularity.WEEKLY) {
            return day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        }
        return day;
    }

    private Optional<DailyRollupType> average(Granularity granularity, LocalDate periodStart,
            List<ForecastSampleType> bucket) {
        Map<ForecastMetric, double[]> sums = new EnumMap<>(ForecastMetric.class);
        int contributing = 0;

        for (ForecastSampleType sample : bucket) {
            if (!sample.hasAnyMetric()) {
                continue;
            }
            contributing++;
            sample.metrics().forEach((metric, value) -> {
                double[] acc = sums.computeIfAbsent(metric, key -> new double[2]);
                acc[0] += value;
                acc[1]++;
            });
        }

        if (contributing == 0) {
            return Optional.empty();
        }

        Map<ForecastMetric, Double> averages = new EnumMap<>(ForecastMetric.class);
        sums.forEach((metric, acc) -> averages.put(metric, acc[0] / acc[1]));
        return Optional.of(new DailyRollupType(granularity, periodStart, averages, contributing));
    }

    private void incrementCounter(String name, String... tags) {
        Counter.builder(name).tags(tags).register(meterRegistry).increment();
    }
}
