package io.b2mash.hms.hmsadmin.usage;

import java.time.Instant;

/**
 * Threshold alert on one tenant metric, stored under {@code alert:<tenantId>:<alertId>}.
 *
 * @param threshold percentage of the plan limit that raises the alert
 */
public record UsageAlert(
    String id,
    String tenantId,
    String metric,
    int threshold,
    boolean triggered,
    Instant triggeredAt,
    Instant resolvedAt,
    boolean notified,
    Instant createdAt) {}
