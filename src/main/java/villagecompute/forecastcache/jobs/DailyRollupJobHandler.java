/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecastcache.jobs;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import org.jboss.logging.Logger;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.forecastcache.api.types.ForecastIdentityType;
import villagecompute.forecastcache.observability.LoggingConfig;
import villagecompute.forecastcache.services.ApiUsageService;
import villagecompute.forecastcache.services.DailyRollupAggregator;
import villagecompute.forecastcache.services.UpsertStore;

/**
 * Recomputes persisted daily rollups from cached hourly samples.
 *
 * <p>
 * <b>Payload:</b> optional {@code rollup_date} (ISO date). Without it today and tomorrow are rolled up, which covers
 * the cached forecast horizon of the hourly refresh job.
 */
@ApplicationScoped
public class DailyRollupJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(DailyRollupJobHandler.class);

    @Inject
    DailyRollupAggregator rollupAggregator;

    @Inject
    UpsertStore upsertStore;

    @Inject
    ApiUsageService usageService;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @Override
    public JobType handlesType() {
        return JobType.DAILY_ROLLUP;
    }

    @Override
    public void execute(Long jobId, Map<String, Object> payload) throws Exception {
        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setJobId(jobId);
        LoggingConfig.setRequestOrigin("JobType." + JobType.DAILY_ROLLUP.name());

        Span span = tracer.spanBuilder("job.daily_rollup").setAttribute("job.id", jobId).startSpan();
        Timer.Sample sample = Timer.start(meterRegistry);

        try (Scope scope = span.makeCurrent()) {
            List<LocalDate> dates;
            if (payload.containsKey("rollup_date")) {
                dates = List.of(LocalDate.parse(payload.get("rollup_date").toString()));
            } else {
                LocalDate today = usageService.today();
                dates = List.of(today, today.plusDays(1));
            }

            List<ForecastIdentityType> identities = upsertStore.trackedIdentities();
            int persisted = 0;
            int failed = 0;

            for (ForecastIdentityType identity : identities) {
                for (LocalDate date : dates) {
                    try {
                        if (rollupAggregator.rollup(identity, date).isPresent()) {
                            persisted++;
                        }
                    } catch (RuntimeException e) {
                        failed++;
                        LOG.errorf(e, "Failed to roll up %s on %s (continuing)", identity, date);
                    }
                }
            }

            span.setAttribute("rollups_persisted", persisted);
            span.setAttribute("rollups_failed", failed);
            LOG.infof("Daily rollup job %d completed: %d rollups over %d identities, %d failures", jobId, persisted,
                    identities.size(), failed);

        } catch (Exception e) {
            span.recordException(e);
            LOG.errorf(e, "Daily rollup job %d failed", jobId);
            throw e;
        } finally {
            sample.stop(Timer.builder("forecast.rollup_job.duration").register(meterRegistry));
            span.end();
            LoggingConfig.clearMDC();
        }
    }
}
