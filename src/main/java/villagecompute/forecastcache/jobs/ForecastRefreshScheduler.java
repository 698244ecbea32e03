/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecastcache.jobs;

import java.util.Map;

import org.jboss.logging.Logger;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.forecastcache.services.JobDispatchService;

/**
 * Schedules the hourly refresh of every tracked forecast identity.
 */
@ApplicationScoped
public class ForecastRefreshScheduler {

    private static final Logger LOG = Logger.getLogger(ForecastRefreshScheduler.class);

    @Inject
    JobDispatchService jobService;

    @Scheduled(
            every = "1h",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduleForecastRefresh() {
        LOG.info("Enqueuing hourly forecast refresh job");
        jobService.enqueue(JobType.FORECAST_REFRESH, Map.of());
    }
}
