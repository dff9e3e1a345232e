package io.b2mash.hms.hmsadmin.audit;

import java.time.Instant;

/**
 * Query filter for {@link AuditService#findEntries}. Null fields are not filtered on.
 *
 * @param resourceType exact resource kind
 * @param resourceId exact resource identifier
 * @param tenantId exact tenant external code
 * @param actionPrefix prefix match, {@code "tenant."} matches every tenant action
 * @param from inclusive lower bound of {@code occurredAt}
 * @param to exclusive upper bound of {@code occurredAt}
 */
public record AuditLogFilter(
    String resourceType,
    String resourceId,
    String tenantId,
    String actionPrefix,
    Instant from,
    Instant to) {}
