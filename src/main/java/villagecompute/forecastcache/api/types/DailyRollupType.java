package villagecompute.forecastcache.api.types;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-metric means over one calendar period of hourly samples.
 *
 * @param granularity
 *            {@link Granularity#DAILY} or {@link Granularity#WEEKLY}
 * @param periodStart
 *            first day of the period (Monday for weekly rollups)
 * @param averages
 *            mean of each metric over the samples that carried it
 * @param sampleCount
 *            samples contributing at least one metric, always positive
 */
public record DailyRollupType(Granularity granularity, @JsonProperty("period_start") LocalDate periodStart,
        Map<ForecastMetric, Double> averages, @JsonProperty("sample_count") int sampleCount) {

    public DailyRollupType {
        averages = averages == null || averages.isEmpty() ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(averages));
    }
}
