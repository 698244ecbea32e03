package villagecompute.forecastcache.api.types;

/**
 * Result value of an upstream call: either a value or a classified error.
 *
 * @param <T>
 *            value type
 */
public record FetchOutcome<T>(T value, ForecastErrorKind errorKind, String message, Integer httpStatus) {

    public static <T> FetchOutcome<T> success(T value) {
        return new FetchOutcome<>(value, null, null, null);
    }

    public static <T> FetchOutcome<T> failure(ForecastErrorKind errorKind, String message, Integer httpStatus) {
        return new FetchOutcome<>(null, errorKind, message, httpStatus);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public ForecastErrorType toError() {
        return isSuccess() ? null : ForecastErrorType.of(errorKind, message);
    }
}
