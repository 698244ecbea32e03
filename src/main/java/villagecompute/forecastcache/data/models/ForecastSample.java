/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecastcache.data.models;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Sort;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import villagecompute.forecastcache.api.types.CachedSampleType;
import villagecompute.forecastcache.api.types.ForecastIdentityType;
import villagecompute.forecastcache.api.types.ForecastMetric;
import villagecompute.forecastcache.api.types.ForecastSampleType;

/**
 * Cache table for hourly air-quality forecast samples.
 *
 * <p>
 * One row per identity per forecast hour. Re-fetching an hour overwrites the metrics, payload and expiration of the
 * existing row. Expired rows stay in place until a replacement fetch for the identity has landed, so they remain
 * available as a stale fallback.
 *
 * <h2>Cache Strategy</h2>
 * <ul>
 * <li>Identity key: "lat=..|lon=..|subject=.." with coordinates rounded to 4 decimals</li>
 * <li>Hourly TTL: 60 minutes; daily and weekly requests stamp longer TTLs</li>
 * <li>Unique constraint on (identity_key, forecast_time)</li>
 * </ul>
 */
@Entity
@Table(
        name = "forecast_samples",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_forecast_samples_identity_time",
                columnNames = {"identity_key", "forecast_time"}),
        indexes = @Index(
                name = "idx_forecast_samples_expires",
                columnList = "identity_key, expires_at"))
public class ForecastSample extends PanacheEntityBase {

    @Id
    @GeneratedValue(
            strategy = GenerationType.UUID)
    public UUID id;

    /**
     * Granularity-free identity key shared by all rows of one location/subject.
     */
    @Column(
            name = "identity_key",
            nullable = false)
    public String identityKey;

    /**
     * Row key: identity key plus forecast hour.
     */
    @Column(
            name = "cache_key",
            nullable = false,
            unique = true)
    public String cacheKey;

    @Column(
            name = "subject_id")
    public String subjectId;

    @Column(
            nullable = false)
    public double latitude;

    @Column(
            nullable = false)
    public double longitude;

    @Column(
            name = "forecast_time",
            nullable = false)
    public Instant forecastTime;

    public Double pm10;

    public Double pm25;

    public Double no2;

    public Double o3;

    public Double so2;

    public Double co;

    @Column(
            name = "universal_aqi")
    public Double universalAqi;

    @Column(
            name = "cai_kr")
    public Double caiKr;

    /**
     * Upstream hourly payload kept for audit/debug.
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(
            name = "raw_payload")
    public Map<String, Object> rawPayload;

    @Column(
            name = "fetched_at",
            nullable = false)
    public Instant fetchedAt;

    @Column(
            name = "expires_at",
            nullable = false)
    public Instant expiresAt;

    @Column(
            name = "created_at",
            nullable = false,
            updatable = false)
    public Instant createdAt = Instant.now();

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt = Instant.now();

    /**
     * Finds the row of one identity and forecast hour (may be expired).
     */
    public static Optional<ForecastSample> findByIdentityAndTime(String identityKey, Instant forecastTime) {
        return find("identityKey = ?1 AND forecastTime = ?2", identityKey, forecastTime).firstResultOptional();
    }

    /**
     * Finds non-expired rows in {@code [from, to)} ordered by forecast hour.
     */
    public static List<ForecastSample> findValidInRange(String identityKey, Instant from, Instant to, Instant asOf) {
        return list("identityKey = ?1 AND forecastTime >= ?2 AND forecastTime < ?3 AND expiresAt > ?4",
                Sort.by("forecastTime"), identityKey, from, to, asOf);
    }

    /**
     * Finds every row in {@code [from, to)}, expired or not, ordered by forecast hour.
     */
    public static List<ForecastSample> findAllInRange(String identityKey, Instant from, Instant to) {
        return list("identityKey = ?1 AND forecastTime >= ?2 AND forecastTime < ?3", Sort.by("forecastTime"),
                identityKey, from, to);
    }

    public static long deleteBefore(String identityKey, Instant before) {
        return delete("identityKey = ?1 AND forecastTime < ?2", identityKey, before);
    }

    public static long deleteExpired(String identityKey, Instant asOf) {
        return delete("identityKey = ?1 AND expiresAt <= ?2", identityKey, asOf);
    }

    /**
     * Copies metrics and payload from an API sample onto this row.
     */
    public void applySample(ForecastSampleType sample) {
        this.forecastTime = sample.timestamp();
        this.pm10 = sample.metric(ForecastMetric.PM10);
        this.pm25 = sample.metric(ForecastMetric.PM25);
        this.no2 = sample.metric(ForecastMetric.NO2);
        this.o3 = sample.metric(ForecastMetric.O3);
        this.so2 = sample.metric(ForecastMetric.SO2);
        this.co = sample.metric(ForecastMetric.CO);
        this.universalAqi = sample.metric(ForecastMetric.UNIVERSAL_AQI);
        this.caiKr = sample.metric(ForecastMetric.CAI_KR);
        this.rawPayload = sample.rawPayload().isEmpty() ? null : sample.rawPayload();
    }

    public CachedSampleType toCachedType() {
        Map<ForecastMetric, Double> metrics = new EnumMap<>(ForecastMetric.class);
        putIfPresent(metrics, ForecastMetric.PM10, pm10);
        putIfPresent(metrics, ForecastMetric.PM25, pm25);
        putIfPresent(metrics, ForecastMetric.NO2, no2);
        putIfPresent(metrics, ForecastMetric.O3, o3);
        putIfPresent(metrics, ForecastMetric.SO2, so2);
        putIfPresent(metrics, ForecastMetric.CO, co);
        putIfPresent(metrics, ForecastMetric.UNIVERSAL_AQI, universalAqi);
        putIfPresent(metrics, ForecastMetric.CAI_KR, caiKr);

        ForecastIdentityType identity = new ForecastIdentityType(subjectId, latitude, longitude);
        return new CachedSampleType(identity, new ForecastSampleType(forecastTime, metrics, rawPayload), cacheKey,
                fetchedAt, expiresAt);
    }

    private static void putIfPresent(Map<ForecastMetric, Double> metrics, ForecastMetric metric, Double value) {
        if (value != null) {
            metrics.put(metric, value);
        }
    }
}
