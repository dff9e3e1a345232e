package io.b2mash.hms.hmsadmin.usage;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Counter for one (tenant, metric, period), stored under {@code
 * usage:<tenantId>:<period>:<metric>}.
 *
 * @param id the store key
 * @param period billing month, {@code yyyy-MM}
 * @param percentage {@code current / limit} as a whole percentage capped at 100
 * @param daily ISO date to the value recorded on that day
 */
public record UsageRecord(
    String id,
    String tenantId,
    String metric,
    String period,
    long current,
    long limit,
    int percentage,
    Map<String, Long> daily,
    Instant updatedAt) {

  public UsageRecord {
    daily = Collections.unmodifiableMap(new TreeMap<>(daily != null ? daily : Map.of()));
  }

  /**
   * Whole percentage of {@code limit} used, capped at 100. A non-positive limit reads as 100 once
   * anything has been used and 0 otherwise.
   */
  public static int percentageOf(long current, long limit) {
    if (limit <= 0) {
      return current > 0 ? 100 : 0;
    }
    return (int) Math.min(100, Math.round(current * 100.0 / limit));
  }

  public UsageRecord withLimit(long newLimit, Instant now) {
    int newPercentage = percentageOf(current, newLimit);
    return new UsageRecord(
        id, tenantId, metric, period, current, newLimit, newPercentage, daily, now);
  }

  public UsageRecord withCurrent(long newCurrent, Instant now) {
    int newPercentage = percentageOf(newCurrent, limit);
    return new UsageRecord(
        id, tenantId, metric, period, newCurrent, limit, newPercentage, daily, now);
  }
}
