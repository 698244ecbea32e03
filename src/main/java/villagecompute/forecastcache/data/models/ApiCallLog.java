/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecastcache.data.models;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Parameters;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.NamedQuery;
import jakarta.persistence.Table;

/**
 * Append-only log of upstream forecast calls, one row per attempt (retries included).
 */
@Entity
@Table(
        name = "api_call_logs")
@NamedQuery(
        name = ApiCallLog.QUERY_FIND_IN_RANGE,
        query = "FROM ApiCallLog WHERE startedAt >= :from AND startedAt < :to ORDER BY startedAt")
public class ApiCallLog extends PanacheEntityBase {

    public static final String QUERY_FIND_IN_RANGE = "ApiCallLog.findInRange";

    @Id
    @GeneratedValue(
            strategy = GenerationType.UUID)
    public UUID id;

    @Column(
            nullable = false)
    public String provider;

    @Column(
            nullable = false)
    public String endpoint;

    @Column(
            name = "started_at",
            nullable = false)
    public Instant startedAt;

    @Column(
            name = "duration_ms",
            nullable = false)
    public long durationMs;

    @Column(
            nullable = false)
    public boolean success;

    @Column(
            name = "error_kind")
    public String errorKind;

    @Column(
            name = "http_status")
    public Integer httpStatus;

    /**
     * Finds calls started in {@code [from, to)}.
     */
    public static List<ApiCallLog> findInRange(Instant from, Instant to) {
        return find("#" + QUERY_FIND_IN_RANGE, Parameters.with("from", from).and("to", to)).list();
    }
}
