package villagecompute.forecastcache.api.types;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import villagecompute.forecastcache.exceptions.ValidationException;

/**
 * Identity of a cached forecast series: optional owner scope plus a location.
 *
 * <p>
 * Coordinates are rounded to {@value #COORDINATE_SCALE} decimal places (HALF_UP) at construction so that requests for
 * the same place collide on the same cache rows.
 *
 * @param subjectId
 *            optional owner scope (null for shared location data)
 * @param latitude
 *            latitude in [-90, 90]
 * @param longitude
 *            longitude in [-180, 180]
 */
public record ForecastIdentityType(@JsonProperty("subject_id") String subjectId, double latitude, double longitude) {

    public static final int COORDINATE_SCALE = 4;

    public ForecastIdentityType {
        if (Double.isNaN(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new ValidationException("Latitude must be between -90 and 90: " + latitude);
        }
        if (Double.isNaN(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw new ValidationException("Longitude must be between -180 and 180: " + longitude);
        }
        subjectId = subjectId == null || subjectId.isBlank() ? null : subjectId.trim();
        latitude = round(latitude);
        longitude = round(longitude);
    }

    /**
     * Builds an identity from loosely typed request parameters ("lat", "lon", optional "subject").
     *
     * @throws ValidationException
     *             if coordinates are missing or not numeric
     */
    public static ForecastIdentityType fromParameters(Map<String, ?> parameters) {
        Object lat = parameters.get("lat");
        Object lon = parameters.get("lon");
        if (lat == null || lon == null) {
            throw new ValidationException("Parameters 'lat' and 'lon' are required");
        }
        Object subject = parameters.get("subject");
        return new ForecastIdentityType(subject == null ? null : subject.toString(), toDouble("lat", lat),
                toDouble("lon", lon));
    }

    /**
     * Returns a coordinate as a fixed-scale plain string (e.g. "37.7700").
     */
    public static String formatCoordinate(double value) {
        return BigDecimal.valueOf(value).setScale(COORDINATE_SCALE, RoundingMode.HALF_UP).toPlainString();
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(COORDINATE_SCALE, RoundingMode.HALF_UP).doubleValue();
    }

    private static double toDouble(String name, Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Parameter '" + name + "' is not a number: " + value, e);
        }
    }
}
