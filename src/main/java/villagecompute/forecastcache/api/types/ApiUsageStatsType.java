package villagecompute.forecastcache.api.types;

import java.time.LocalDate;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Upstream call statistics for one day.
 *
 * @param date
 *            calendar day in the configured zone
 * @param totalCalls
 *            calls attempted
 * @param successfulCalls
 *            calls that returned a page
 * @param failedCalls
 *            calls that failed
 * @param avgResponseTimeMs
 *            mean duration in milliseconds, 0 when no calls were made
 * @param dailyLimit
 *            configured daily call budget
 * @param remainingCalls
 *            budget left, never negative
 * @param usagePercentage
 *            share of the budget used, rounded to a whole percent
 */
public record ApiUsageStatsType(LocalDate date, @JsonProperty("total_calls") long totalCalls,
        @JsonProperty("successful_calls") long successfulCalls, @JsonProperty("failed_calls") long failedCalls,
        @JsonProperty("avg_response_time_ms") long avgResponseTimeMs, @JsonProperty("daily_limit") int dailyLimit,
        @JsonProperty("remaining_calls") long remainingCalls, @JsonProperty("usage_percentage") int usagePercentage) {
}
