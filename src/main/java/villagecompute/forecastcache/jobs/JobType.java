/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecastcache.jobs;

/**
 * Forecast maintenance job types and their execution cadence.
 *
 * @see JobHandler for handler contract
 */
public enum JobType {

    /**
     * Refreshes the next hours of every tracked identity from upstream.
     * <p>
     * <b>Cadence:</b> Every 1 hour
     * <p>
     * <b>Handler:</b> ForecastRefreshJobHandler
     */
    FORECAST_REFRESH,

    /**
     * Recomputes persisted daily rollups of today and tomorrow for every tracked identity.
     * <p>
     * <b>Cadence:</b> Every 6 hours
     * <p>
     * <b>Handler:</b> DailyRollupJobHandler
     */
    DAILY_ROLLUP,

    /**
     * Deletes samples for hours that have already passed.
     * <p>
     * <b>Cadence:</b> Hourly at minute 5
     * <p>
     * <b>Handler:</b> CachePurgeJobHandler
     */
    CACHE_PURGE
}
