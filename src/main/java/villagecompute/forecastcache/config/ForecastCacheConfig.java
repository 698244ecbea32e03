package villagecompute.forecastcache.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the forecast cache engine.
 *
 * <p>
 * Configuration prefix: {@code forecast-cache}
 *
 * <p>
 * Components never read this mapping directly; {@link ForecastCacheSettingsProducer} converts it into immutable
 * settings records so tests can construct any combination of values.
 */
@ConfigMapping(
        prefix = "forecast-cache")
public interface ForecastCacheConfig {

    TtlConfig ttl();

    RetryConfig retry();

    FetchConfig fetch();

    PaginationConfig pagination();

    WindowConfig window();

    RollupConfig rollup();

    UsageConfig usage();

    UpstreamConfig upstream();

    interface TtlConfig {

        /**
         * TTL of hourly rows.
         *
         * @return base TTL (default: 60 minutes)
         */
        @WithDefault("PT60M")
        Duration base();

        /**
         * @return multiplier applied to the base TTL for daily rows (default: 6)
         */
        @WithDefault("6")
        @Min(1)
        long dailyMultiplier();

        /**
         * @return multiplier applied to the base TTL for weekly rows (default: 24)
         */
        @WithDefault("24")
        @Min(1)
        long weeklyMultiplier();
    }

    interface RetryConfig {

        /**
         * @return retries after the first attempt for transient failures (default: 3)
         */
        @WithDefault("3")
        @Min(0)
        int maxRetries();

        @WithDefault("PT0.2S")
        Duration baseDelay();

        @WithDefault("2.0")
        @DecimalMin("1.0")
        double multiplier();

        /**
         * @return cap applied to every backoff delay (default: 5 seconds)
         */
        @WithDefault("PT5S")
        Duration maxDelay();
    }

    interface FetchConfig {

        /**
         * Deadline for one upstream call. Expiry cancels the call and classifies it as a timeout.
         *
         * @return per-call timeout (default: 10 seconds)
         */
        @WithDefault("PT10S")
        Duration timeout();
    }

    interface PaginationConfig {

        /**
         * @return page ceiling per aggregation (default: 10)
         */
        @WithDefault("10")
        @Min(1)
        int maxPages();

        /**
         * @return hourly samples requested per upstream page (default: 24)
         */
        @WithDefault("24")
        @Min(1)
        int pageSize();
    }

    interface WindowConfig {

        /**
         * @return longest hourly window a single request may cover (default: 96, the provider limit)
         */
        @WithDefault("96")
        @Min(1)
        int maxHours();
    }

    interface RollupConfig {

        /**
         * @return zone defining calendar days for rollups and usage stats (default: UTC)
         */
        @WithDefault("UTC")
        @NotBlank
        String zone();
    }

    interface UsageConfig {

        /**
         * @return upstream calls allowed per day (default: 333)
         */
        @WithDefault("333")
        @Min(1)
        int dailyLimit();
    }

    interface UpstreamConfig {

        @WithDefault("https://airquality.googleapis.com/v1")
        @NotBlank
        String baseUrl();

        Optional<String> apiKey();

        @WithDefault("en")
        String languageCode();
    }
}
