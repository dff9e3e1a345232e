package io.b2mash.hms.hmsadmin.usage;

import java.util.List;

/** Per-metric usage of one tenant for one period, default metrics first. */
public record UsageSummary(String tenantId, String plan, String period, List<UsageLine> metrics) {

  public record UsageLine(String metric, long current, long limit, int percentage, String unit) {

    static UsageLine of(UsageRecord record) {
      return new UsageLine(
          record.metric(),
          record.current(),
          record.limit(),
          record.percentage(),
          UsageMetrics.unitOf(record.metric()));
    }
  }
}
