package villagecompute.forecastcache.api.types;

/**
 * Freshness of the data in a response.
 */
public enum ServedFrom {
    FRESH, STALE
}
