package io.b2mash.hms.hmsadmin.audit;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Builder for {@link AuditLogRecord}. The actor defaults to the authenticated principal, or
 * {@code system} when no authentication is bound.
 *
 * <pre>{@code
 * AuditLogRecord record = AuditLogBuilder.builder()
 *     .action("tenant.created")
 *     .resourceType("tenant")
 *     .resourceId(tenant.id())
 *     .tenantId(tenant.id())
 *     .after(snapshot)
 *     .build();
 * }</pre>
 */
public class AuditLogBuilder {

  static final String SYSTEM_ACTOR = "system";

  private String action;
  private String resourceType;
  private String resourceId;
  private String tenantId;
  private String actor;
  private Object before;
  private Object after;

  private AuditLogBuilder() {}

  public static AuditLogBuilder builder() {
    return new AuditLogBuilder();
  }

  public AuditLogBuilder action(String action) {
    this.action = action;
    return this;
  }

  public AuditLogBuilder resourceType(String resourceType) {
    this.resourceType = resourceType;
    return this;
  }

  public AuditLogBuilder resourceId(String resourceId) {
    this.resourceId = resourceId;
    return this;
  }

  public AuditLogBuilder tenantId(String tenantId) {
    this.tenantId = tenantId;
    return this;
  }

  public AuditLogBuilder actor(String actor) {
    this.actor = actor;
    return this;
  }

  public AuditLogBuilder before(Object before) {
    this.before = before;
    return this;
  }

  public AuditLogBuilder after(Object after) {
    this.after = after;
    return this;
  }

  public AuditLogRecord build() {
    if (action == null || resourceType == null) {
      throw new IllegalStateException("action and resourceType are required");
    }
    String resolvedActor = actor != null ? actor : currentActor();
    return new AuditLogRecord(
        action, resourceType, resourceId, tenantId, resolvedActor, before, after);
  }

  private static String currentActor() {
    Authentication auth = SecurityContextHolder.getContext().getAuthentication();
    if (auth != null && auth.isAuthenticated() && auth.getName() != null) {
      return auth.getName();
    }
    return SYSTEM_ACTOR;
  }
}
