package villagecompute.forecastcache.exceptions;

/**
 * Exception thrown when the forecast store cannot read or write rows.
 *
 * <p>
 * On the read path a storage failure is treated as a cache miss. On the write path the failing row is logged, reported
 * as a partial write failure, and skipped.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
