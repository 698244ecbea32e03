/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecastcache.services;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.forecastcache.api.types.ForecastIdentityType;
import villagecompute.forecastcache.api.types.Granularity;
import villagecompute.forecastcache.config.TtlSettings;

/**
 * Cache-key and TTL policy for forecast rows.
 *
 * <h2>Key format</h2>
 * <ul>
 * <li>Fields are joined in sorted field-name order: {@code granularity}, {@code lat}, {@code lon}, {@code subject}</li>
 * <li>Coordinates use 4-decimal fixed notation (e.g. {@code lat=37.7700})</li>
 * <li>A missing subject is rendered as {@code subject=-}</li>
 * </ul>
 *
 * <p>
 * Example: {@code granularity=hourly|lat=37.7700|lon=-122.4200|subject=-}
 */
@ApplicationScoped
public class CachePolicy {

    private static final String NO_SUBJECT = "-";

    private final TtlSettings ttlSettings;

    @Inject
    public CachePolicy(TtlSettings ttlSettings) {
        this.ttlSettings = ttlSettings;
    }

    /**
     * Deterministic cache key of a (granularity, identity) pair.
     */
    public String cacheKey(Granularity granularity, ForecastIdentityType identity) {
        Map<String, String> fields = identityFields(identity);
        fields.put("granularity", granularity.getTag());
        return join(fields);
    }

    /**
     * Granularity-free key of an identity. Hourly sample rows of one identity share this key whatever granularity
     * requested them.
     */
    public String identityKey(ForecastIdentityType identity) {
        return join(identityFields(identity));
    }

    /**
     * Key of a single sample row.
     */
    public String sampleKey(ForecastIdentityType identity, Instant timestamp) {
        return identityKey(identity) + "|t=" + timestamp;
    }

    public Duration ttl(Granularity granularity) {
        return ttlSettings.ttl(granularity);
    }

    private Map<String, String> identityFields(ForecastIdentityType identity) {
        Map<String, String> fields = new TreeMap<>();
        fields.put("lat", ForecastIdentityType.formatCoordinate(identity.latitude()));
        fields.put("lon", ForecastIdentityType.formatCoordinate(identity.longitude()));
        fields.put("subject", identity.subjectId() == null ? NO_SUBJECT : identity.subjectId());
        return fields;
    }

    private static String join(Map<String, String> fields) {
        StringJoiner joiner = new StringJoiner("|");
        fields.forEach((name, value) -> joiner.add(name + "=" + value));
        return joiner.toString();
    }
}
