package villagecompute.forecastcache.config;

/**
 * Paging limits for upstream aggregation and request windows.
 */
public record PaginationSettings(int maxPages, int pageSize, int maxWindowHours) {

    public static final PaginationSettings DEFAULTS = new PaginationSettings(10, 24, 96);

    public PaginationSettings {
        if (maxPages < 1 || pageSize < 1 || maxWindowHours < 1) {
            throw new IllegalArgumentException("Pagination settings must be positive");
        }
    }
}
