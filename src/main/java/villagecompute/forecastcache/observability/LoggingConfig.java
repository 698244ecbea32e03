package villagecompute.forecastcache.observability;

import org.jboss.logging.MDC;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;

/**
 * Standard MDC field names and helpers for enriching forecast engine logs.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code cache_key} - Forecast cache key being served or refreshed</li>
 * <li>{@code subject_id} - Owner scope of the forecast identity (absent for shared locations)</li>
 * <li>{@code request_origin} - HTTP request path or job type identifier</li>
 * <li>{@code job_id} - Job sequence number (only for scheduled job execution)</li>
 * </ul>
 *
 * <p>
 * <b>Usage in Job Handlers:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setJobId(jobId);
 * LoggingConfig.setRequestOrigin("JobType." + jobType.name());
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Each request/job execution
 * should clear MDC at the end of processing to prevent context leakage.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_CACHE_KEY = "cache_key";

    public static final String MDC_SUBJECT_ID = "subject_id";

    /**
     * HTTP request path (e.g., "/api/forecast") or job type identifier (e.g., "JobType.FORECAST_REFRESH").
     */
    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    public static final String MDC_JOB_ID = "job_id";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Enriches MDC with trace_id and span_id from the current OpenTelemetry span. Without an active span the fields are
     * set to empty strings to keep the log structure consistent.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    public static void setCacheKey(String cacheKey) {
        if (cacheKey != null) {
            MDC.put(MDC_CACHE_KEY, cacheKey);
        }
    }

    public static void setSubjectId(String subjectId) {
        if (subjectId != null) {
            MDC.put(MDC_SUBJECT_ID, subjectId);
        }
    }

    /**
     * Sets the request origin (HTTP path or job type identifier).
     */
    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    public static void setJobId(Long jobId) {
        if (jobId != null) {
            MDC.put(MDC_JOB_ID, jobId.toString());
        }
    }

    /**
     * Clears the request-scoped fields set by the forecast read path, leaving job and origin fields intact so that a
     * job iterating over identities keeps its context.
     */
    public static void clearForecastContext() {
        MDC.remove(MDC_CACHE_KEY);
        MDC.remove(MDC_SUBJECT_ID);
    }

    /**
     * Clears all observability-related MDC fields. Should be called at the end of every request/job.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_CACHE_KEY);
        MDC.remove(MDC_SUBJECT_ID);
        MDC.remove(MDC_REQUEST_ORIGIN);
        MDC.remove(MDC_JOB_ID);
    }
}
