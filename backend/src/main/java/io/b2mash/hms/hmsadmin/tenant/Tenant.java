package io.b2mash.hms.hmsadmin.tenant;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Relational system-of-record row for a tenant. The external code, plan and most descriptive
 * attributes live in the {@code settings} jsonb bag; see {@link TenantRecordMapper} for the keys.
 */
@Entity
@Table(name = "tenants")
public class Tenant {

  @Id private UUID id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private TenantStatus status;

  @Column(name = "mrr", nullable = false, precision = 12, scale = 2)
  private BigDecimal mrr;

  @Column(name = "email", length = 255)
  private String email;

  @Column(name = "phone", length = 50)
  private String phone;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "settings", columnDefinition = "jsonb")
  private Map<String, Object> settings;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Tenant() {}

  public Tenant(
      UUID id,
      String name,
      TenantStatus status,
      BigDecimal mrr,
      String email,
      String phone,
      Map<String, Object> settings,
      Instant now) {
    this.id = id;
    this.name = name;
    this.status = status;
    this.mrr = mrr;
    this.email = email;
    this.phone = phone;
    this.settings = new HashMap<>(settings);
    this.createdAt = now;
    this.updatedAt = now;
  }

  /** Overwrites the mutable attributes. The external code inside {@code settings} is preserved. */
  public void apply(
      String name,
      TenantStatus status,
      BigDecimal mrr,
      String email,
      String phone,
      Map<String, Object> settings,
      Instant now) {
    String externalId = getExternalId();
    this.name = name;
    this.status = status;
    this.mrr = mrr;
    this.email = email;
    this.phone = phone;
    this.settings = new HashMap<>(settings);
    if (externalId != null) {
      this.settings.put(TenantRecordMapper.EXTERNAL_ID, externalId);
    }
    this.updatedAt = now;
  }

  public String getExternalId() {
    if (settings == null) {
      return null;
    }
    Object value = settings.get(TenantRecordMapper.EXTERNAL_ID);
    return value != null ? value.toString() : null;
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public TenantStatus getStatus() {
    return status;
  }

  public BigDecimal getMrr() {
    return mrr;
  }

  public String getEmail() {
    return email;
  }

  public String getPhone() {
    return phone;
  }

  public Map<String, Object> getSettings() {
    return settings;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
