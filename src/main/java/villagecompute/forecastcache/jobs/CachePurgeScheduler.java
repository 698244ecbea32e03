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
 * Schedules the purge of past forecast hours at minute 5 of every hour.
 */
@ApplicationScoped
public class CachePurgeScheduler {

    private static final Logger LOG = Logger.getLogger(CachePurgeScheduler.class);

    @Inject
    JobDispatchService jobService;

    @Scheduled(
            cron = "0 5 * * * ?")
    void schedulePurge() {
        LOG.debug("Enqueuing cache purge job");
        jobService.enqueue(JobType.CACHE_PURGE, Map.of());
    }
}
