/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecastcache.jobs;

import java.util.Map;

/**
 * Contract for forecast maintenance job handlers.
 *
 * <p>Handlers must be CDI-managed beans annotated with {@code @ApplicationScoped} and implement
 * this interface. The {@link villagecompute.forecastcache.services.JobDispatchService} discovers handlers
 * at startup and routes jobs based on their {@link JobType}.
 *
 * <p><b>Execution Model:</b>
 * <ul>
 *   <li>Handlers execute on Quarkus scheduler threads</li>
 *   <li>Per-identity failures are logged and counted without aborting the batch</li>
 *   <li>OpenTelemetry spans wrap handler execution</li>
 * </ul>
 */
public interface JobHandler {

    /**
     * Returns the job type this handler processes.
     *
     * @return the job type enum value
     */
    JobType handlesType();

    /**
     * Executes the job with the given payload.
     *
     * <p><b>Thread Safety:</b> This method may be called concurrently by multiple scheduler threads.
     *
     * @param jobId sequence number assigned by the dispatcher
     * @param payload job parameters (may be empty)
     * @throws Exception any error that aborts the whole job
     */
    void execute(Long jobId, Map<String, Object> payload) throws Exception;
}
