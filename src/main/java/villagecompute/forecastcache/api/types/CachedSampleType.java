package villagecompute.forecastcache.api.types;

import java.time.Instant;

/**
 * A forecast sample as persisted in the cache, with the keys and timestamps stamped by the upsert store.
 */
public record CachedSampleType(ForecastIdentityType identity, ForecastSampleType sample, String cacheKey,
        Instant fetchedAt, Instant expiresAt) {

    public boolean isExpired(Instant asOf) {
        return !expiresAt.isAfter(asOf);
    }
}
