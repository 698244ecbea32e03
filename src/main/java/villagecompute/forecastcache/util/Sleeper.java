package villagecompute.forecastcache.util;

import java.time.Duration;

/**
 * Blocking pause between retries. Injected so tests can record delays instead of waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
