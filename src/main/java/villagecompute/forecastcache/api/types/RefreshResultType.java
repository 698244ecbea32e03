package villagecompute.forecastcache.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response of {@code refreshNow}.
 *
 * @param count
 *            rows written by the refresh, or stale rows available when the refresh failed
 * @param writeFailures
 *            rows that could not be persisted
 * @param servedFrom
 *            FRESH when the refresh landed, STALE when only cached rows are available, null when nothing is
 * @param error
 *            classified error, null on a clean refresh
 */
public record RefreshResultType(int count, @JsonProperty("write_failures") int writeFailures,
        @JsonProperty("served_from") ServedFrom servedFrom, ForecastErrorType error) {
}
