/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecastcache.integration.airquality;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.forecastcache.api.types.ForecastIdentityType;
import villagecompute.forecastcache.api.types.ForecastMetric;
import villagecompute.forecastcache.api.types.ForecastSampleType;
import villagecompute.forecastcache.api.types.ForecastWindowType;
import villagecompute.forecastcache.api.types.UpstreamPageType;
import villagecompute.forecastcache.config.UpstreamSettings;
import villagecompute.forecastcache.exceptions.UpstreamStatusException;

/**
 * HTTP client for the Google Air Quality hourly forecast API.
 *
 * <h2>API Details</h2>
 * <ul>
 * <li>Endpoint: POST {base}/forecast:lookup?key={apiKey}</li>
 * <li>Forecast horizon: 96 hours</li>
 * <li>Paged: {@code pageSize}/{@code pageToken} in the request, {@code nextPageToken} in the response</li>
 * <li>Pollutant concentrations and the universal and Korean (CAI) indexes are requested as extra computations</li>
 * </ul>
 *
 * <h2>Usage</h2>
 *
 * <pre>
 * {@code
 * @Inject
 * UpstreamForecastProvider provider;
 *
 * UpstreamPageType page = provider.fetchPage(identity, window, null);
 * }
 * </pre>
 *
 * @see <a href="https://developers.google.com/maps/documentation/air-quality">Air Quality API Documentation</a>
 */
@ApplicationScoped
public class GoogleAirQualityClient implements UpstreamForecastProvider {

    private static final Logger LOG = Logger.getLogger(GoogleAirQualityClient.class);

    private static final String PROVIDER = "google_air_quality";
    private static final String LOOKUP_PATH = "/forecast:lookup";
    private static final List<String> EXTRA_COMPUTATIONS = List.of("POLLUTANT_CONCENTRATION",
            "LOCAL_AQI", "POLLUTANT_ADDITIONAL_INFO");

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final UpstreamSettings settings;

    @Inject
    public GoogleAirQualityClient(ObjectMapper objectMapper, UpstreamSettings settings) {
        this.objectMapper = objectMapper;
        this.settings = settings;
        this.httpClient = HttpClient.newBuilder().version(HttpClient.Version.HTTP_2)
                .followRedirects(HttpClient.Redirect.NORMAL).connectTimeout(Duration.ofSeconds(5)).build();
    }

    @Override
    public String providerName() {
        return PROVIDER;
    }

    @Override
    public String endpoint() {
        return settings.baseUrl() + LOOKUP_PATH;
    }

    /**
     * Fetches one page of hourly forecasts.
     *
     * @throws UpstreamStatusException
     *             if the API answers with a non-200 status
     * @throws IOException
     *             on transport failure or unparseable response
     */
    @Override
    public UpstreamPageType fetchPage(ForecastIdentityType identity, ForecastWindowType window, String pageToken)
            throws IOException, InterruptedException {
        LOG.debugf("Fetching air quality forecast for %.4f,%.4f [%s, %s) page=%s", identity.latitude(),
                identity.longitude(), window.from(), window.to(), pageToken == null ? "first" : pageToken);

        String body = objectMapper.writeValueAsString(buildRequestBody(identity, window, pageToken));
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(endpoint() + "?key=" + settings.apiKey()))
                .header("Content-Type", "application/json").POST(HttpRequest.BodyPublishers.ofString(body)).build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        if (response.statusCode() != 200) {
            throw new UpstreamStatusException(response.statusCode(), response.body());
        }

        return parsePage(response.body());
    }

    /**
     * Builds the forecast:lookup request body.
     */
    ObjectNode buildRequestBody(ForecastIdentityType identity, ForecastWindowType window, String pageToken) {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode location = root.putObject("location");
        location.put("latitude", identity.latitude());
        location.put("longitude", identity.longitude());

        ObjectNode period = root.putObject("period");
        period.put("startTime", window.from().toString());
        period.put("endTime", window.to().toString());

        root.put("pageSize", settings.pageSize());
        if (pageToken != null && !pageToken.isBlank()) {
            root.put("pageToken", pageToken);
        }
        ArrayNode extraComputations = root.putArray("extraComputations");
        for (String computation : EXTRA_COMPUTATIONS) {
            extraComputations.add(computation);
        }
        root.put("languageCode", settings.languageCode());
        return root;
    }

    /**
     * Parses a forecast:lookup response into a page of samples.
     */
    UpstreamPageType parsePage(String json) throws IOException {
        JsonNode root = objectMapper.readTree(json);
        List<ForecastSampleType> samples = new ArrayList<>();

        for (JsonNode hourly : root.path("hourlyForecasts")) {
            String dateTime = hourly.path("dateTime").asText(null);
            if (dateTime == null) {
                LOG.warn("Skipping hourly forecast without dateTime");
                continue;
            }

            Map<ForecastMetric, Double> metrics = new EnumMap<>(ForecastMetric.class);
            for (JsonNode pollutant : hourly.path("pollutants")) {
                ForecastMetric metric = ForecastMetric.fromUpstreamCode(pollutant.path("code").asText());
                JsonNode value = pollutant.path("concentration").path("value");
                if (metric != null && value.isNumber()) {
                    metrics.put(metric, value.asDouble());
                }
            }
            for (JsonNode index : hourly.path("indexes")) {
                ForecastMetric metric = ForecastMetric.fromUpstreamCode(index.path("code").asText());
                JsonNode aqi = index.path("aqi");
                if (metric != null && aqi.isNumber()) {
                    metrics.put(metric, aqi.asDouble());
                }
            }

            Map<String, Object> rawPayload = objectMapper.convertValue(hourly, new TypeReference<Map<String, Object>>() {
            });
            samples.add(new ForecastSampleType(Instant.parse(dateTime), metrics, rawPayload));
        }

        String nextPageToken = root.path("nextPageToken").asText(null);
        return new UpstreamPageType(samples, nextPageToken);
    }
}
