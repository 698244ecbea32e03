package villagecompute.forecastcache.exceptions;

/**
 * Exception thrown when a forecast request carries coordinates, windows, or parameters the engine cannot serve.
 *
 * <p>
 * Validation failures are never retried and never fall back to cached data.
 *
 * <p>
 * All exceptions in this project extend RuntimeException per project standards.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
