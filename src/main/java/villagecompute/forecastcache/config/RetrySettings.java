package villagecompute.forecastcache.config;

import java.time.Duration;

/**
 * Retry and deadline settings for upstream calls.
 *
 * @param maxRetries
 *            retries after the first attempt
 * @param baseDelay
 *            delay before the first retry
 * @param multiplier
 *            growth factor between consecutive retries
 * @param maxDelay
 *            cap on any single delay
 * @param fetchTimeout
 *            deadline of one upstream call
 */
public record RetrySettings(int maxRetries, Duration baseDelay, double multiplier, Duration maxDelay,
        Duration fetchTimeout) {

    public static final RetrySettings DEFAULTS = new RetrySettings(3, Duration.ofMillis(200), 2.0,
            Duration.ofSeconds(5), Duration.ofSeconds(10));

    public RetrySettings {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Backoff multiplier must be at least 1.0");
        }
        if (baseDelay.isNegative() || maxDelay.isNegative() || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("Delays must satisfy 0 <= baseDelay <= maxDelay");
        }
        if (fetchTimeout.isZero() || fetchTimeout.isNegative()) {
            throw new IllegalArgumentException("Fetch timeout must be positive");
        }
    }

    /**
     * Delay before retry number {@code retry} (1-indexed): {@code min(base × multiplier^(retry-1), maxDelay)}.
     */
    public Duration delayForRetry(int retry) {
        double millis = baseDelay.toMillis() * Math.pow(multiplier, Math.max(0, retry - 1));
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.round(millis));
    }
}
