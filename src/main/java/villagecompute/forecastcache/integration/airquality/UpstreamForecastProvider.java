/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecastcache.integration.airquality;

import java.io.IOException;

import villagecompute.forecastcache.api.types.ForecastIdentityType;
import villagecompute.forecastcache.api.types.ForecastWindowType;
import villagecompute.forecastcache.api.types.UpstreamPageType;

/**
 * Paged source of hourly forecast samples.
 *
 * <p>
 * Implementations signal non-success HTTP answers with
 * {@link villagecompute.forecastcache.exceptions.UpstreamStatusException} and transport failures with
 * {@link IOException}. Error classification, deadlines and retries are applied by the caller.
 */
public interface UpstreamForecastProvider {

    /**
     * Short provider name recorded in the API call log (e.g. "google_air_quality").
     */
    String providerName();

    /**
     * Endpoint recorded in the API call log.
     */
    String endpoint();

    /**
     * Fetches one page of hourly samples.
     *
     * @param identity
     *            location to forecast
     * @param window
     *            requested hours
     * @param pageToken
     *            continuation token from the previous page, null for the first page
     * @return page of samples with an optional continuation token
     */
    UpstreamPageType fetchPage(ForecastIdentityType identity, ForecastWindowType window, String pageToken)
            throws IOException, InterruptedException;
}
