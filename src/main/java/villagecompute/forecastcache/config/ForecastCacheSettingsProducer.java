package villagecompute.forecastcache.config;

import java.net.URI;
import java.time.Clock;
import java.time.ZoneId;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import villagecompute.forecastcache.api.types.Granularity;

/**
 * CDI producer turning {@link ForecastCacheConfig} into the immutable settings records injected into engine
 * components, plus the shared {@link Clock}.
 */
@ApplicationScoped
public class ForecastCacheSettingsProducer {

    private static final Logger LOG = Logger.getLogger(ForecastCacheSettingsProducer.class);

    @Inject
    ForecastCacheConfig config;

    @Produces
    @Singleton
    TtlSettings ttlSettings() {
        ForecastCacheConfig.TtlConfig ttl = config.ttl();
        TtlSettings settings = new TtlSettings(ttl.base(), ttl.dailyMultiplier(), ttl.weeklyMultiplier());
        LOG.infof("Forecast TTLs: hourly=%s, daily=%s, weekly=%s", settings.base(),
                settings.ttl(Granularity.DAILY),
                settings.ttl(Granularity.WEEKLY));
        return settings;
    }

    @Produces
    @Singleton
    RetrySettings retrySettings() {
        ForecastCacheConfig.RetryConfig retry = config.retry();
        return new RetrySettings(retry.maxRetries(), retry.baseDelay(), retry.multiplier(), retry.maxDelay(),
                config.fetch().timeout());
    }

    @Produces
    @Singleton
    PaginationSettings paginationSettings() {
        return new PaginationSettings(config.pagination().maxPages(), config.pagination().pageSize(),
                config.window().maxHours());
    }

    @Produces
    @Singleton
    RollupSettings rollupSettings() {
        return new RollupSettings(ZoneId.of(config.rollup().zone()), config.usage().dailyLimit());
    }

    @Produces
    @Singleton
    UpstreamSettings upstreamSettings() {
        String apiKey = config.upstream().apiKey().orElse("");
        if (apiKey.isBlank()) {
            LOG.warn("No upstream API key configured; forecast fetches will be rejected by the provider");
        }
        return new UpstreamSettings(URI.create(config.upstream().baseUrl()), apiKey, config.upstream().languageCode(),
                config.pagination().pageSize());
    }

    @Produces
    @Singleton
    Clock clock() {
        return Clock.systemUTC();
    }
}
