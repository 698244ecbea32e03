package villagecompute.forecastcache.api.types;

import java.util.Locale;

import villagecompute.forecastcache.exceptions.ValidationException;

/**
 * Time resolution of a forecast request.
 *
 * <p>
 * Samples are always cached hourly. {@link #DAILY} and {@link #WEEKLY} requests are answered with rollups computed from
 * those hourly samples, and their rows are stamped with a longer TTL.
 */
public enum Granularity {

    HOURLY("hourly"),

    DAILY("daily"),

    WEEKLY("weekly");

    private final String tag;

    Granularity(String tag) {
        this.tag = tag;
    }

    /**
     * Returns the lowercase tag used in cache keys and query parameters.
     */
    public String getTag() {
        return tag;
    }

    /**
     * Parses a granularity tag (case-insensitive).
     *
     * @param value
     *            tag such as "hourly"
     * @return matching granularity
     * @throws ValidationException
     *             if the tag is unknown
     */
    public static Granularity fromTag(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Granularity is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Granularity granularity : values()) {
            if (granularity.tag.equals(normalized)) {
                return granularity;
            }
        }
        throw new ValidationException("Unknown granularity: " + value);
    }
}
