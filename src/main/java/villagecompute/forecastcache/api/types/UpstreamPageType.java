package villagecompute.forecastcache.api.types;

import java.util.List;

/**
 * One page of upstream forecast samples.
 *
 * @param samples
 *            samples in upstream order
 * @param nextPageToken
 *            continuation token, null or blank when this is the last page
 */
public record UpstreamPageType(List<ForecastSampleType> samples, String nextPageToken) {

    public UpstreamPageType {
        samples = samples == null ? List.of() : List.copyOf(samples);
    }

    public boolean hasNextPage() {
        return nextPageToken != null && !nextPageToken.isBlank();
    }
}
