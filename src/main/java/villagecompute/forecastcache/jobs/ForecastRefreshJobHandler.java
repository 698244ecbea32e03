/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecastcache.jobs;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import org.jboss.logging.Logger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.forecastcache.api.types.ForecastIdentityType;
import villagecompute.forecastcache.api.types.ForecastWindowType;
import villagecompute.forecastcache.api.types.Granularity;
import villagecompute.forecastcache.api.types.RefreshResultType;
import villagecompute.forecastcache.api.types.ServedFrom;
import villagecompute.forecastcache.observability.LoggingConfig;
import villagecompute.forecastcache.services.ForecastCacheService;
import villagecompute.forecastcache.services.UpsertStore;

/**
 * Job handler that keeps the forecast cache warm for every tracked identity.
 *
 * <p>
 * <b>Payload:</b>
 * <ul>
 * <li>{@code hours} - hours ahead to refresh, starting at the current hour (default 24)</li>
 * <li>{@code granularity} - TTL granularity to stamp on refreshed rows (default hourly)</li>
 * </ul>
 *
 * <p>
 * Each identity is refreshed independently; a failing identity is logged and counted and the batch continues.
 */
@ApplicationScoped
public class ForecastRefreshJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(ForecastRefreshJobHandler.class);

    static final int DEFAULT_HOURS = 24;

    @Inject
    ForecastCacheService forecastCacheService;

    @Inject
    UpsertStore upsertStore;

    @Inject
    Clock clock;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @Override
    public JobType handlesType() {
        return JobType.FORECAST_REFRESH;
    }

    @Override
    public void execute(Long jobId, Map<String, Object> payload) throws Exception {
        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setJobId(jobId);
        LoggingConfig.setRequestOrigin("JobType." + JobType.FORECAST_REFRESH.name());

        Span span = tracer.spanBuilder("job.forecast_refresh").setAttribute("job.id", jobId)
                .setAttribute("job.type", JobType.FORECAST_REFRESH.name()).startSpan();

        Timer.Sample sample = Timer.start(meterRegistry);
        int successCount = 0;
        int failureCount = 0;

        try (Scope scope = span.makeCurrent()) {
            int hours = payload.containsKey("hours") ? Integer.parseInt(payload.get("hours").toString())
                    : DEFAULT_HOURS;
            Granularity granularity = payload.containsKey("granularity")
                    ? Granularity.fromTag(payload.get("granularity").toString())
                    : Granularity.HOURLY;
            ForecastWindowType window = ForecastWindowType.ofHours(clock.instant(), hours);

            List<ForecastIdentityType> identities = upsertStore.trackedIdentities();
            span.setAttribute("identities_total", identities.size());
            LOG.infof("Starting forecast refresh job %d for %d identities over %s", jobId, identities.size(), window);

            for (ForecastIdentityType identity : identities) {
                try {
                    RefreshResultType result = forecastCacheService.refreshNow(identity, window, granularity);
                    if (result.servedFrom() == ServedFrom.FRESH) {
                        successCount++;
                        incrementCounter("forecast.refresh_job.total", "status", "success");
                        LOG.debugf("Refreshed %d samples for %s", result.count(), identity);
                    } else {
                        failureCount++;
                        incrementCounter("forecast.refresh_job.total", "status", "failure");
                        LOG.warnf("Refresh for %s failed with %s (continuing)", identity,
                                result.error() == null ? "unknown error" : result.error().kind());
                    }
                } catch (RuntimeException e) {
                    failureCount++;
                    incrementCounter("forecast.refresh_job.total", "status", "failure");
                    LOG.errorf(e, "Failed to refresh forecast for %s (continuing)", identity);
                }
            }

            span.setAttribute("identities_success", successCount);
            span.setAttribute("identities_failed", failureCount);
            LOG.infof("Forecast refresh job %d completed: %d success, %d failures", jobId, successCount,
                    failureCount);

        } catch (Exception e) {
            span.recordException(e);
            LOG.errorf(e, "Forecast refresh job %d failed", jobId);
            throw e;
        } finally {
            sample.stop(Timer.builder("forecast.refresh_job.duration").register(meterRegistry));
            span.end();
            LoggingConfig.clearMDC();
        }
    }

    private void incrementCounter(String name, String... tags) {
        Counter.builder(name).tags(tags).register(meterRegistry).increment();
    }
}
