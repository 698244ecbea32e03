package villagecompute.forecastcache.api.types;

import java.time.Duration;
import java.time.Instant;

/**
 * Record of a single upstream call, appended to the API call log for usage accounting.
 *
 * @param provider
 *            upstream provider name
 * @param endpoint
 *            endpoint that was called
 * @param startedAt
 *            call start
 * @param duration
 *            wall-clock duration including timeout waits
 * @param success
 *            whether a page was returned
 * @param errorKind
 *            classified failure, null on success
 * @param httpStatus
 *            upstream HTTP status when one was received
 */
public record FetchAttemptType(String provider, String endpoint, Instant startedAt, Duration duration, boolean success,
        ForecastErrorKind errorKind, Integer httpStatus) {
}
