package villagecompute.forecastcache.api.types;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One hourly forecast reading.
 *
 * @param timestamp
 *            start of the forecast hour
 * @param metrics
 *            metric values present on this sample (absent metrics are simply missing from the map)
 * @param rawPayload
 *            opaque upstream payload kept for audit/debug
 */
public record ForecastSampleType(Instant timestamp, Map<ForecastMetric, Double> metrics,
        @JsonProperty("raw_payload") Map<String, Object> rawPayload) {

    public ForecastSampleType {
        EnumMap<ForecastMetric, Double> copy = new EnumMap<>(ForecastMetric.class);
        if (metrics != null) {
            metrics.forEach((metric, value) -> {
                if (metric != null && value != null && !value.isNaN()) {
                    copy.put(metric, value);
                }
            });
        }
        metrics = Collections.unmodifiableMap(copy);
        rawPayload = rawPayload == null ? Map.of() : rawPayload;
    }

    @JsonIgnore
    public Double metric(ForecastMetric metric) {
        return metrics.get(metric);
    }

    @JsonIgnore
    public boolean hasAnyMetric() {
        return !metrics.isEmpty();
    }
}
