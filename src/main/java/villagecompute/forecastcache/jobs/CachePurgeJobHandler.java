/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecastcache.jobs;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;

import org.jboss.logging.Logger;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.forecastcache.api.types.ForecastIdentityType;
import villagecompute.forecastcache.observability.LoggingConfig;
import villagecompute.forecastcache.services.UpsertStore;

/**
 * Deletes cached samples for hours that have already passed.
 *
 * <p>
 * Expired rows for future hours are left alone: they stay available as stale fallback until a refresh replaces them.
 */
@ApplicationScoped
public class CachePurgeJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(CachePurgeJobHandler.class);

    @Inject
    UpsertStore upsertStore;

    @Inject
    Clock clock;

    @Inject
    Tracer tracer;

    @Override
    public JobType handlesType() {
        return JobType.CACHE_PURGE;
    }

    @Override
    public void execute(Long jobId, Map<String, Object> payload) throws Exception {
        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setJobId(jobId);

        Span span = tracer.spanBuilder("job.cache_purge").setAttribute("job.id", jobId).startSpan();

        try (Scope scope = span.makeCurrent()) {
            Instant before = clock.instant().truncatedTo(ChronoUnit.HOURS);
            long deleted = 0;
            for (ForecastIdentityType identity : upsertStore.trackedIdentities()) {
                try {
                    deleted += upsertStore.purgeStale(identity, before);
                } catch (RuntimeException e) {
                    LOG.errorf(e, "Failed to purge past samples for %s (continuing)", identity);
                }
            }
            span.setAttribute("samples_deleted", deleted);
            LOG.infof("Cache purge job %d deleted %d samples before %s", jobId, deleted, before);
        } catch (Exception e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
            LoggingConfig.clearMDC();
        }
    }
}
