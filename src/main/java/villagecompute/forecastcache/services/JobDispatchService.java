/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecastcache.services;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.jboss.logging.Logger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import villagecompute.forecastcache.jobs.JobHandler;
import villagecompute.forecastcache.jobs.JobType;

/**
 * In-process dispatcher routing scheduled forecast jobs to their {@link JobHandler}.
 *
 * <p>
 * Jobs run synchronously on the calling scheduler thread. A failing job is logged, traced and counted; the next
 * scheduled run is its retry.
 *
 * @see JobHandler for handler contract
 * @see JobType for job types and cadence
 */
@ApplicationScoped
public class JobDispatchService {

    private static final Logger LOG = Logger.getLogger(JobDispatchService.class);

    private final Map<JobType, JobHandler> handlerRegistry;
    private final AtomicLong jobSequence = new AtomicLong();

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    public JobDispatchService(Instance<JobHandler> handlers) {
        this.handlerRegistry = buildHandlerRegistry(handlers);
        LOG.infof("Initialized JobDispatchService with %d registered handlers", handlerRegistry.size());
    }

    /**
     * Discovers all CDI-managed {@link JobHandler} beans and builds a type → handler map.
     *
     * @throws IllegalStateException
     *             if duplicate handlers register for the same JobType
     */
    private Map<JobType, JobHandler> buildHandlerRegistry(Iterable<JobHandler> handlers) {
        Map<JobType, JobHandler> registry = new EnumMap<>(JobType.class);
        for (JobHandler handler : handlers) {
            JobType type = handler.handlesType();
            if (registry.containsKey(type)) {
                throw new IllegalStateException("Duplicate handlers registered for JobType." + type + ": "
                        + registry.get(type).getClass().getName() + " and " + handler.getClass().getName());
            }
            registry.put(type, handler);
            LOG.debugf("Registered handler %s for JobType.%s", handler.getClass().getSimpleName(), type);
        }
        return registry;
    }

    /**
     * Assigns a job id and runs the job.
     *
     * @return assigned job id
     */
    public long enqueue(JobType jobType, Map<String, Object> payload) {
        long jobId = jobSequence.incrementAndGet();
        LOG.infof("Dispatching JobType.%s as job %d", jobType, jobId);
        executeJob(jobType, jobId, payload);
        return jobId;
    }

    /**
     * Executes a single job by dispatching to its registered handler.
     *
     * @return true when the handler completed without throwing
     * @throws IllegalStateException
     *             if no handler registered for jobType
     */
    public boolean executeJob(JobType jobType, Long jobId, Map<String, Object> payload) {
        JobHandler handler = handlerRegistry.get(jobType);
        if (handler == null) {
            throw new IllegalStateException("No handler registered for JobType." + jobType);
        }

        Span span = tracer.spanBuilder("job.execute").setAttribute("job.id", jobId)
                .setAttribute("job.type", jobType.name()).startSpan();

        try (Scope scope = span.makeCurrent()) {
            handler.execute(jobId, payload);
            span.addEvent("job.completed");
            LOG.infof("Job %d (type: %s) completed successfully", jobId, jobType);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            span.recordException(e);
            span.addEvent("job.interrupted");
            LOG.warnf(e, "Job %d (type: %s) interrupted during execution", jobId, jobType);
            return false;
        } catch (Exception e) {
            span.recordException(e);
            span.addEvent("job.failed");
            Counter.builder("forecast.jobs.failures").tag("type", jobType.name()).register(meterRegistry).increment();
            LOG.errorf(e, "Job %d (type: %s) failed", jobId, jobType);
            return false;
        } finally {
            span.end();
        }
    }
}
