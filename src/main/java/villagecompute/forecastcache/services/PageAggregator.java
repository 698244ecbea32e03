/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecastcache.services;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.forecastcache.api.types.FetchOutcome;
import villagecompute.forecastcache.api.types.ForecastSampleType;
import villagecompute.forecastcache.api.types.ForecastWindowType;
import villagecompute.forecastcache.api.types.PageAggregationType;
import villagecompute.forecastcache.api.types.UpstreamPageType;
import villagecompute.forecastcache.config.PaginationSettings;

/**
 * Follows upstream continuation tokens and flattens the pages into one deduplicated sample list.
 *
 * <p>
 * Aggregation stops at the first of: the window's expected hourly count is reached, a page carries no continuation
 * token, or {@link PaginationSettings#maxPages()} pages were requested. Samples outside the window are dropped and
 * duplicate timestamps keep their first occurrence.
 *
 * <p>
 * A failing first page fails the aggregation. A failing later page leaves the samples collected so far as a partial
 * result, with the error attached.
 */
@ApplicationScoped
public class PageAggregator {

    private static final Logger LOG = Logger.getLogger(PageAggregator.class);

    private final PaginationSettings settings;

    @Inject
    public PageAggregator(PaginationSettings settings) {
        this.settings = settings;
    }

    /**
     * Aggregates pages for a window.
     *
     * @param window
     *            whole-hour window being filled
     * @param pageFetcher
     *            fetches the page for a continuation token (null for the first page)
     * @return flattened samples plus pagination outcome
     */
    public PageAggregationType aggregate(ForecastWindowType window,
            Function<String, FetchOutcome<UpstreamPageType>> pageFetcher) {
        int expected = window.expectedHours();
        Map<Instant, ForecastSampleType> byTimestamp = new LinkedHashMap<>();
        String token = null;
        int pages = 0;

        while (true) {
            FetchOutcome<UpstreamPageType> outcome = pageFetcher.apply(token);
            pages++;

            if (!outcome.isSuccess()) {
                if (pages > 1) {
                    LOG.warnf("Page %d failed with %s, keeping %d samples from earlier pages", pages,
                            outcome.errorKind(), byTimestamp.size());
                }
                return new PageAggregationType(new ArrayList<>(byTimestamp.values()), pages, false,
                        outcome.toError());
            }

            UpstreamPageType page = outcome.value();
            for (ForecastSampleType sample : page.samples()) {
                if (window.contains(sample.timestamp())) {
                    byTimestamp.putIfAbsent(sample.timestamp(), sample);
                }
            }

            if (byTimestamp.size() >= expected || !page.hasNextPage()) {
                break;
            }
            if (pages >= settings.maxPages()) {
                LOG.warnf("Page ceiling %d reached with %d/%d samples, continuation dropped", settings.maxPages(),
                        byTimestamp.size(), expected);
                return new PageAggregationType(new ArrayList<>(byTimestamp.values()), pages, true, null);
            }
            token = page.nextPageToken();
        }

        LOG.debugf("Aggregated %d/%d samples over %d pages", byTimestamp.size(), expected, pages);
        return new PageAggregationType(new ArrayList<>(byTimestamp.values()), pages, false, null);
    }
}
