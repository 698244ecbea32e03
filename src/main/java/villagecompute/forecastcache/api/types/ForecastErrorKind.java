package villagecompute.forecastcache.api.types;

/**
 * Classified error taxonomy shared by the fetch client, retry policy and read path.
 */
public enum ForecastErrorKind {

    /** Request parameters rejected before any I/O. Never retried. */
    VALIDATION_ERROR(false),

    /** Upstream call exceeded its deadline (or upstream answered 408). Retried. */
    TIMEOUT(true),

    /** Upstream answered 429. Not retried; stale data may be served. */
    RATE_LIMITED(false),

    /** Upstream 5xx or transport failure. Retried. */
    UPSTREAM_UNAVAILABLE(true),

    /** Upstream rejected the request (other 4xx). Never retried. */
    BAD_REQUEST(false),

    /** Store read or write failed. */
    STORAGE_ERROR(false),

    /** Upstream failed and nothing was cached for the identity and window. */
    NO_DATA_AVAILABLE(false),

    UNKNOWN(false);

    private final boolean retryable;

    ForecastErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Whether a failure of this kind may be answered with stale cached rows.
     */
    public boolean allowsStaleFallback() {
        return this != BAD_REQUEST && this != VALIDATION_ERROR;
    }
}
