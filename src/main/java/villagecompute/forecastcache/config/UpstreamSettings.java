package villagecompute.forecastcache.config;

import java.net.URI;

/**
 * Connection settings of the air-quality forecast provider.
 */
public record UpstreamSettings(URI baseUrl, String apiKey, String languageCode, int pageSize) {
}
