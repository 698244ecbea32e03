/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecastcache.data.models;

import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import villagecompute.forecastcache.api.types.DailyRollupType;
import villagecompute.forecastcache.api.types.ForecastMetric;
import villagecompute.forecastcache.api.types.Granularity;

/**
 * Persisted per-metric means of one identity over one day or ISO week.
 *
 * <p>
 * Rows are always replaced as a whole. A period without samples has no row.
 */
@Entity
@Table(
        name = "forecast_rollups",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_forecast_rollups_identity_period",
                columnNames = {"identity_key", "granularity", "period_start"}))
public class DailyRollup extends PanacheEntityBase {

    @Id
    @GeneratedValue(
            strategy = GenerationType.UUID)
    public UUID id;

    @Column(
            name = "identity_key",
            nullable = false)
    public String identityKey;

    @Column(
            nullable = false)
    public String granularity;

    @Column(
            name = "period_start",
            nullable = false)
    public LocalDate periodStart;

    @Column(
            name = "sample_count",
            nullable = false)
    public int sampleCount;

    @Column(
            name = "avg_pm10")
    public Double avgPm10;

    @Column(
            name = "avg_pm25")
    public Double avgPm25;

    @Column(
            name = "avg_no2")
    public Double avgNo2;

    @Column(
            name = "avg_o3")
    public Double avgO3;

    @Column(
            name = "avg_so2")
    public Double avgSo2;

    @Column(
            name = "avg_co")
    public Double avgCo;

    @Column(
            name = "avg_universal_aqi")
    public Double avgUniversalAqi;

    @Column(
            name = "avg_cai_kr")
    public Double avgCaiKr;

    @Column(
            name = "computed_at",
            nullable = false)
    public Instant computedAt;

    @Column(
            name = "expires_at",
            nullable = false)
    public Instant expiresAt;

    public static Optional<DailyRollup> findByPeriod(String identityKey, Granularity granularity,
            LocalDate periodStart) {
        return find("identityKey = ?1 AND granularity = ?2 AND periodStart = ?3", identityKey, granularity.name(),
                periodStart).firstResultOptional();
    }

    public static long deleteByPeriod(String identityKey, Granularity granularity, LocalDate periodStart) {
        return delete("identityKey = ?1 AND granularity = ?2 AND periodStart = ?3", identityKey, granularity.name(),
                periodStart);
    }

    public void applyRollup(DailyRollupType rollup) {
        this.granularity = rollup.granularity().name();
        this.periodStart = rollup.periodStart();
        this.sampleCount = rollup.sampleCount();
        Map<ForecastMetric, Double> averages = rollup.averages();
        this.avgPm10 = averages.get(ForecastMetric.PM10);
        this.avgPm25 = averages.get(ForecastMetric.PM25);
        this.avgNo2 = averages.get(ForecastMetric.NO2);
        this.avgO3 = averages.get(ForecastMetric.O3);
        this.avgSo2 = averages.get(ForecastMetric.SO2);
        this.avgCo = averages.get(ForecastMetric.CO);
        this.avgUniversalAqi = averages.get(ForecastMetric.UNIVERSAL_AQI);
        this.avgCaiKr = averages.get(ForecastMetric.CAI_KR);
    }

    public DailyRollupType toRollupType() {
        Map<ForecastMetric, Double> averages = new EnumMap<>(ForecastMetric.class);
        putIfPresent(averages, ForecastMetric.PM10, avgPm10);
        putIfPresent(averages, ForecastMetric.PM25, avgPm25);
        putIfPresent(averages, ForecastMetric.NO2, avgNo2);
        putIfPresent(averages, ForecastMetric.O3, avgO3);
        putIfPresent(averages, ForecastMetric.SO2, avgSo2);
        putIfPresent(averages, ForecastMetric.CO, avgCo);
        putIfPresent(averages, ForecastMetric.UNIVERSAL_AQI, avgUniversalAqi);
        putIfPresent(averages, ForecastMetric.CAI_KR, avgCaiKr);
        return new DailyRollupType(Granularity.valueOf(granularity), periodStart, averages, sampleCount);
    }

    private static void putIfPresent(Map<ForecastMetric, Double> averages, ForecastMetric metric, Double value) {
        if (value != null) {
            averages.put(metric, value);
        }
    }
}
