package villagecompute.forecastcache.config;

import java.time.Duration;

import villagecompute.forecastcache.api.types.Granularity;

/**
 * TTL per granularity: {@code HOURLY = base}, {@code DAILY = base × dailyMultiplier},
 * {@code WEEKLY = base × weeklyMultiplier}.
 *
 * <p>
 * Construction rejects multipliers that would let a coarser granularity expire sooner than a finer one.
 */
public record TtlSettings(Duration base, long dailyMultiplier, long weeklyMultiplier) {

    public static final TtlSettings DEFAULTS = new TtlSettings(Duration.ofMinutes(60), 6, 24);

    public TtlSettings {
        if (base == null || base.isZero() || base.isNegative()) {
            throw new IllegalArgumentException("TTL base must be positive");
        }
        if (dailyMultiplier < 1 || weeklyMultiplier < dailyMultiplier) {
            throw new IllegalArgumentException("TTL multipliers must satisfy 1 <= daily <= weekly, got daily="
                    + dailyMultiplier + ", weekly=" + weeklyMultiplier);
        }
    }

    public Duration ttl(Granularity granularity) {
        return switch (granularity) {
            case HOURLY -> base;
            case DAILY -> base.multipliedBy(dailyMultiplier);
            case WEEKLY -> base.multipliedBy(weeklyMultiplier);
        };
    }
}
