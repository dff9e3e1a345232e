package io.b2mash.hms.hmsadmin.audit;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditLogRecord)}. Built by {@link AuditLogBuilder},
 * which fills in the actor from the security context.
 *
 * @param action {@code {resource}.{verb}}, e.g. {@code tenant.created}
 * @param resourceType kind of resource audited ({@code tenant}, {@code plan}, {@code feature_flag})
 * @param resourceId identifier of the resource; not a foreign key, the resource may be deleted
 * @param tenantId external code of the affected tenant; null for global resources
 * @param actor principal that performed the action, {@code system} outside a request
 * @param beforeState snapshot before the change, any JSON-serializable value; null for creations
 * @param afterState snapshot after the change; null for deletions
 */
public record AuditLogRecord(
    String action,
    String resourceType,
    String resourceId,
    String tenantId,
    String actor,
    Object beforeState,
    Object afterState) {}
