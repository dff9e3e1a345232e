package io.b2mash.hms.hmsadmin.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Append-only row of the {@code audit_logs} table. No setters: entries are written once and never
 * updated.
 */
@Entity
@Table(name = "audit_logs")
public class AuditLogEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "action", nullable = false, length = 100)
  private String action;

  @Column(name = "resource_type", nullable = false, length = 50)
  private String resourceType;

  @Column(name = "resource_id", length = 100)
  private String resourceId;

  @Column(name = "tenant_id", length = 100)
  private String tenantId;

  @Column(name = "actor", nullable = false, length = 100)
  private String actor;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "before_state", columnDefinition = "jsonb")
  private Map<String, Object> beforeState;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "after_state", columnDefinition = "jsonb")
  private Map<String, Object> afterState;

  @Column(name = "occurred_at", nullable = false, updatable = false)
  private Instant occurredAt;

  protected AuditLogEntry() {}

  public AuditLogEntry(
      AuditLogRecord record,
      Map<String, Object> beforeState,
      Map<String, Object> afterState,
      Instant occurredAt) {
    this.action = record.action();
    this.resourceType = record.resourceType();
    this.resourceId = record.resourceId();
    this.tenantId = record.tenantId();
    this.actor = record.actor();
    this.beforeState = beforeState;
    this.afterState = afterState;
    this.occurredAt = occurredAt;
  }

  public UUID getId() {
    return id;
  }

  public String getAction() {
    return action;
  }

  public String getResourceType() {
    return resourceType;
  }

  public String getResourceId() {
    return resourceId;
  }

  public String getTenantId() {
    return tenantId;
  }

  public String getActor() {
    return actor;
  }

  public Map<String, Object> getBeforeState() {
    return beforeState;
  }

  public Map<String, Object> getAfterState() {
    return afterState;
  }

  public Instant getOccurredAt() {
    return occurredAt;
  }
}
