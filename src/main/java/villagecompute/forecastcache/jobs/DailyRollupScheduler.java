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
 * Schedules daily rollup recomputation every 6 hours, shortly after the hourly refresh.
 */
@ApplicationScoped
public class DailyRollupScheduler {

    private static final Logger LOG = Logger.getLogger(DailyRollupScheduler.class);

    @Inject
    JobDispatchService jobService;

    @Scheduled(
            cron = "0 15 */6 * * ?")
    void scheduleDailyRollup() {
        LOG.info("Enqueuing daily rollup job");
        jobService.enqueue(JobType.DAILY_ROLLUP, Map.of());
    }
}
