package villagecompute.forecastcache.api.types;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response of {@code getForecast}.
 *
 * @param granularity
 *            requested granularity
 * @param samples
 *            hourly samples served, ordered by timestamp
 * @param rollups
 *            daily/weekly rollups of the served samples (empty for hourly requests)
 * @param servedFrom
 *            freshness of the data, null when no data is returned
 * @param error
 *            classified error, null on a fresh answer
 */
public record ForecastResultType(Granularity granularity, List<ForecastSampleType> samples,
        List<DailyRollupType> rollups, @JsonProperty("served_from") ServedFrom servedFrom, ForecastErrorType error) {

    public ForecastResultType {
        samples = samples == null ? List.of() : List.copyOf(samples);
        rollups = rollups == null ? List.of() : List.copyOf(rollups);
    }

    public static ForecastResultType failed(Granularity granularity, ForecastErrorType error) {
        return new ForecastResultType(granularity, List.of(), List.of(), null, error);
    }

    public boolean hasData() {
        return !samples.isEmpty();
    }
}
