package villagecompute.forecastcache.api.types;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Flattened result of following upstream continuation tokens.
 *
 * @param samples
 *            order-preserving, timestamp-deduplicated samples inside the window
 * @param pagesFetched
 *            pages requested, including a failed one
 * @param truncated
 *            true when the page ceiling stopped aggregation while a continuation token was still present
 * @param error
 *            failure of the last page requested, or null
 */
public record PageAggregationType(List<ForecastSampleType> samples, @JsonProperty("pages_fetched") int pagesFetched,
        boolean truncated, ForecastErrorType error) {

    public PageAggregationType {
        samples = samples == null ? List.of() : List.copyOf(samples);
    }

    /**
     * Nothing usable was collected before the failure.
     */
    public boolean isFailed() {
        return error != null && samples.isEmpty();
    }

    /**
     * Later pages failed but earlier pages yielded samples.
     */
    public boolean isPartial() {
        return error != null && !samples.isEmpty();
    }
}
