package io.b2mash.hms.hmsadmin.tenant;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Aggregate view over all tenants.
 *
 * @param totalMrr sum of MRR over tenants whose status is active or trial
 */
public record TenantStats(
    long total,
    Map<String, Long> byStatus,
    Map<String, Long> byPlan,
    BigDecimal totalMrr) {}
