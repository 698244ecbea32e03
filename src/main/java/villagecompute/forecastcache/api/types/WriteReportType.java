package villagecompute.forecastcache.api.types;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of a batch upsert: rows written plus the rows that failed and were skipped.
 */
public record WriteReportType(int written, List<PartialWriteFailure> failures) {

    public WriteReportType {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * A sample that could not be persisted.
     */
    public record PartialWriteFailure(Instant timestamp, String cacheKey, String reason) {
    }
}
