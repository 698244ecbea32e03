/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecastcache.services.storage;

import java.time.Instant;
import java.util.List;

import villagecompute.forecastcache.api.types.FetchAttemptType;

/**
 * Append-only log of upstream fetch attempts.
 */
public interface FetchAttemptLog {

    /**
     * Appends an attempt. Best effort: implementations log and drop failures instead of throwing.
     */
    void record(FetchAttemptType attempt);

    /**
     * Attempts started in {@code [from, to)}.
     *
     * @throws villagecompute.forecastcache.exceptions.StorageException
     *             if the log cannot be read
     */
    List<FetchAttemptType> findAttempts(Instant from, Instant to);
}
