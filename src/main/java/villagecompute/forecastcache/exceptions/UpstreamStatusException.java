package villagecompute.forecastcache.exceptions;

/**
 * Exception thrown when the upstream forecast provider answers with a non-success HTTP status.
 *
 * <p>
 * The status code drives error classification in {@code ResilientFetchClient}: 429 is a rate limit, 408 and 5xx are
 * transient, any other 4xx is a bad request.
 */
public class UpstreamStatusException extends RuntimeException {

    private final int statusCode;

    public UpstreamStatusException(int statusCode, String body) {
        super("Upstream returned status " + statusCode + ": " + body);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
