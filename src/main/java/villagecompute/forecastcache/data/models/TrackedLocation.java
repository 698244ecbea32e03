/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecastcache.data.models;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Sort;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import villagecompute.forecastcache.api.types.ForecastIdentityType;

/**
 * Locations the scheduled jobs keep refreshing.
 *
 * <p>
 * A row is registered the first time an identity is refreshed and is never touched by sample purges, so an identity
 * whose cached rows all aged out during an upstream outage is still picked up by the next refresh run.
 */
@Entity
@Table(
        name = "tracked_locations")
public class TrackedLocation extends PanacheEntityBase {

    @Id
    @GeneratedValue(
            strategy = GenerationType.UUID)
    public UUID id;

    @Column(
            name = "identity_key",
            nullable = false,
            unique = true)
    public String identityKey;

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
            name = "first_requested_at",
            nullable = false,
            updatable = false)
    public Instant firstRequestedAt;

    @Column(
            name = "last_requested_at",
            nullable = false)
    public Instant lastRequestedAt;

    public static Optional<TrackedLocation> findByIdentityKey(String identityKey) {
        return find("identityKey", identityKey).firstResultOptional();
    }

    /**
     * All tracked locations, oldest registration first.
     */
    public static List<TrackedLocation> listTracked() {
        return listAll(Sort.by("firstRequestedAt").and("identityKey"));
    }

    public ForecastIdentityType toIdentityType() {
        return new ForecastIdentityType(subjectId, latitude, longitude);
    }
}
