package villagecompute.forecastcache.config;

import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Calendar settings for rollups and daily usage accounting.
 *
 * @param zone
 *            zone defining where a calendar day starts
 * @param dailyCallLimit
 *            upstream calls allowed per calendar day
 */
public record RollupSettings(ZoneId zone, int dailyCallLimit) {

    public static final RollupSettings DEFAULTS = new RollupSettings(ZoneOffset.UTC, 333);

    public RollupSettings {
        if (zone == null) {
            throw new IllegalArgumentException("Rollup zone is required");
        }
        if (dailyCallLimit < 1) {
            throw new IllegalArgumentException("Daily call limit must be positive");
        }
    }
}
