/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecastcache.api.rest;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import jakarta.inject.Inject;
import jakarta.validation.constraints.Min;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.forecastcache.api.types.ApiUsageStatsType;
import villagecompute.forecastcache.api.types.ForecastErrorKind;
import villagecompute.forecastcache.api.types.ForecastErrorType;
import villagecompute.forecastcache.api.types.ForecastIdentityType;
import villagecompute.forecastcache.api.types.ForecastResultType;
import villagecompute.forecastcache.api.types.ForecastWindowType;
import villagecompute.forecastcache.api.types.Granularity;
import villagecompute.forecastcache.api.types.RefreshResultType;
import villagecompute.forecastcache.exceptions.StorageException;
import villagecompute.forecastcache.exceptions.ValidationException;
import villagecompute.forecastcache.observability.LoggingConfig;
import villagecompute.forecastcache.services.ForecastCacheService;

/**
 * REST endpoints for cached air-quality forecasts.
 *
 * <p>
 * Responses carrying data (fresh or stale) answer 200; stale answers add {@code X-Forecast-Served-From: stale}.
 * Errors map to HTTP status by kind: 400 validation/bad request, 404 no data, 429 rate limited, 502 upstream
 * unavailable, 503 storage, 504 timeout.
 */
@Path("/api/forecast")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Forecast",
        description = "Cached air-quality forecast operations")
public class ForecastResource {

    private static final Logger LOG = Logger.getLogger(ForecastResource.class);

    static final String SERVED_FROM_HEADER = "X-Forecast-Served-From";

    @Inject
    ForecastCacheService forecastCacheService;

    @Inject
    Clock clock;

    /**
     * Retrieves hourly samples (and rollups for daily/weekly granularity) for a location.
     */
    @GET
    @Operation(
            summary = "Get forecast",
            description = "Serve cached forecast data, refreshing from upstream on a coverage gap")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Fresh or stale forecast returned",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = ForecastResultType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid request"),
                    @APIResponse(
                            responseCode = "404",
                            description = "No forecast data available"),
                    @APIResponse(
                            responseCode = "429",
                            description = "Upstream rate limit exceeded and nothing cached")})
    public Response getForecast(@QueryParam("lat") String lat, @QueryParam("lon") String lon,
            @QueryParam("subject") String subject, @QueryParam("from") String from,
            @QueryParam("hours") @DefaultValue("24") @Min(1) int hours,
            @QueryParam("granularity") @DefaultValue("hourly") String granularity) {
        LoggingConfig.setRequestOrigin("/api/forecast");
        try {
            ForecastIdentityType identity = parseIdentity(lat, lon, subject);
            ForecastWindowType window = parseWindow(from, hours);
            ForecastResultType result = forecastCacheService.getForecast(identity, window,
                    Granularity.fromTag(granularity));

            if (result.hasData()) {
                return Response.ok(result)
                        .header(SERVED_FROM_HEADER, result.servedFrom().name().toLowerCase(Locale.ROOT)).build();
            }
            return Response.status(statusFor(result.error())).entity(result).build();

        } catch (ValidationException e) {
            LOG.debugf("Rejected forecast request: %s", e.getMessage());
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    /**
     * Forces an upstream refresh for a location.
     */
    @POST
    @Path("/refresh")
    @Operation(
            summary = "Refresh forecast",
            description = "Fetch the window from upstream now and persist it")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Refresh landed, or stale data is still available",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = RefreshResultType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid request")})
    public Response refresh(@QueryParam("lat") String lat, @QueryParam("lon") String lon,
            @QueryParam("subject") String subject, @QueryParam("from") String from,
            @QueryParam("hours") @DefaultValue("24") @Min(1) int hours,
            @QueryParam("granularity") @DefaultValue("hourly") String granularity) {
        LoggingConfig.setRequestOrigin("/api/forecast/refresh");
        try {
            RefreshResultType result = forecastCacheService.refreshNow(parseIdentity(lat, lon, subject),
                    parseWindow(from, hours), Granularity.fromTag(granularity));
            if (result.servedFrom() != null) {
                return Response.ok(result)
                        .header(SERVED_FROM_HEADER, result.servedFrom().name().toLowerCase(Locale.ROOT)).build();
            }
            return Response.status(statusFor(result.error())).entity(result).build();
        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    /**
     * Upstream call statistics for a day (today by default).
     */
    @GET
    @Path("/usage")
    @Operation(
            summary = "Get upstream usage",
            description = "Daily upstream call counts against the configured limit")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Usage statistics returned",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = ApiUsageStatsType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid date"),
                    @APIResponse(
                            responseCode = "503",
                            description = "Usage log unavailable")})
    public Response getUsage(@QueryParam("date") String date) {
        try {
            LocalDate day = date == null || date.isBlank() ? null : LocalDate.parse(date);
            return Response.ok(forecastCacheService.getUsageStats(day)).build();
        } catch (DateTimeParseException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse("Invalid date: " + date))
                    .build();
        } catch (StorageException e) {
            LOG.errorf(e, "Failed to read upstream usage for %s", date);
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(new ErrorResponse("Usage statistics unavailable")).build();
        }
    }

    private static ForecastIdentityType parseIdentity(String lat, String lon, String subject) {
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("lat", lat);
        parameters.put("lon", lon);
        parameters.put("subject", subject);
        return ForecastIdentityType.fromParameters(parameters);
    }

    private ForecastWindowType parseWindow(String from, int hours) {
        Instant start;
        try {
            start = from == null || from.isBlank() ? clock.instant() : Instant.parse(from);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid 'from' instant: " + from, e);
        }
        return ForecastWindowType.ofHours(start, hours);
    }

    static int statusFor(ForecastErrorType error) {
        ForecastErrorKind kind = error == null ? ForecastErrorKind.UNKNOWN : error.kind();
        return switch (kind) {
            case VALIDATION_ERROR, BAD_REQUEST -> 400;
            case NO_DATA_AVAILABLE -> 404;
            case RATE_LIMITED -> 429;
            case UPSTREAM_UNAVAILABLE -> 502;
            case STORAGE_ERROR -> 503;
            case TIMEOUT -> 504;
            case UNKNOWN -> 500;
        };
    }

    /**
     * Error response DTO.
     */
    public record ErrorResponse(String error) {
    }
}
