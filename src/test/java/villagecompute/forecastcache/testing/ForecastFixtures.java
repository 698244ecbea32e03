package villagecompute.forecastcache.testing;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import villagecompute.forecastcache.api.types.ForecastMetric;
import villagecompute.forecastcache.api.types.ForecastSampleType;
import villagecompute.forecastcache.api.types.ForecastWindowType;

/**
 * Sample builders shared by forecast tests.
 */
public final class ForecastFixtures {

    public static final Instant NOW = Instant.parse("2025-03-10T08:20:00Z");

    private ForecastFixtures() {
    }

    public static ForecastSampleType sample(Instant timestamp, double pm25) {
        return new ForecastSampleType(timestamp, Map.of(ForecastMetric.PM25, pm25), Map.of("source", "test"));
    }

    public static ForecastSampleType sample(Instant timestamp, Map<ForecastMetric, Double> metrics) {
        return new ForecastSampleType(timestamp, metrics, Map.of());
    }

    /**
     * One sample per hour of the window with PM2.5 equal to the hour index.
     */
    public static List<ForecastSampleType> hourlySamples(ForecastWindowType window) {
        List<ForecastSampleType> samples = new ArrayList<>();
        Instant hour = window.from().truncatedTo(ChronoUnit.HOURS);
        int index = 0;
        while (hour.isBefore(window.to())) {
            samples.add(sample(hour, index++));
            hour = hour.plus(1, ChronoUnit.HOURS);
        }
        return samples;
    }
}
