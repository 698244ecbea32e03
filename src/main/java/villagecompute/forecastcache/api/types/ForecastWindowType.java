package villagecompute.forecastcache.api.types;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import villagecompute.forecastcache.exceptions.ValidationException;

/**
 * Half-open time range {@code [from, to)} of a forecast request.
 *
 * @param from
 *            inclusive start
 * @param to
 *            exclusive end, strictly after {@code from}
 */
public record ForecastWindowType(Instant from, Instant to) {

    public ForecastWindowType {
        if (from == null || to == null) {
            throw new ValidationException("Window start and end are required");
        }
        if (!to.isAfter(from)) {
            throw new ValidationException("Window end " + to + " must be after start " + from);
        }
    }

    /**
     * Window of {@code hours} whole hours starting at the hour containing {@code start}.
     */
    public static ForecastWindowType ofHours(Instant start, int hours) {
        if (hours < 1) {
            throw new ValidationException("Window must cover at least one hour");
        }
        Instant from = start.truncatedTo(ChronoUnit.HOURS);
        return new ForecastWindowType(from, from.plus(hours, ChronoUnit.HOURS));
    }

    /**
     * Widens the window to whole hours: start floored, end ceiled.
     */
    public ForecastWindowType toWholeHours() {
        Instant flooredFrom = from.truncatedTo(ChronoUnit.HOURS);
        Instant flooredTo = to.truncatedTo(ChronoUnit.HOURS);
        Instant ceiledTo = flooredTo.equals(to) ? to : flooredTo.plus(1, ChronoUnit.HOURS);
        return new ForecastWindowType(flooredFrom, ceiledTo);
    }

    /**
     * Number of whole hours covered by this window, without narrowing.
     */
    public long hourCount() {
        ForecastWindowType whole = toWholeHours();
        return Duration.between(whole.from, whole.to).toHours();
    }

    /**
     * Number of hourly samples that fully cover this window.
     *
     * @throws ArithmeticException
     *             if the window spans more hours than fit in an {@code int}; check {@link #hourCount()} first
     */
    public int expectedHours() {
        return Math.toIntExact(hourCount());
    }

    public boolean contains(Instant timestamp) {
        return !timestamp.isBefore(from) && timestamp.isBefore(to);
    }
}
