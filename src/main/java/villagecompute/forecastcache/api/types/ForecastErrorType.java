package villagecompute.forecastcache.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Classified error attached to a forecast or refresh result.
 *
 * @param kind
 *            error kind
 * @param message
 *            human-readable detail
 * @param causeKind
 *            underlying upstream kind for {@link ForecastErrorKind#NO_DATA_AVAILABLE}, otherwise null
 */
public record ForecastErrorType(ForecastErrorKind kind, String message,
        @JsonProperty("cause_kind") ForecastErrorKind causeKind) {

    public static ForecastErrorType of(ForecastErrorKind kind, String message) {
        return new ForecastErrorType(kind, message, null);
    }
}
