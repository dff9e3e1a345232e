package io.b2mash.hms.hmsadmin.plan;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "plans")
public class Plan {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, unique = true, length = 50)
  private String name;

  @Column(name = "description", length = 500)
  private String description;

  @Column(name = "price_cents", nullable = false)
  private long priceCents;

  @Column(name = "billing_interval", nullable = false, length = 20)
  private String billingInterval;

  @Column(name = "trial_days", nullable = false)
  private int trialDays;

  @Column(name = "active", nullable = false)
  private boolean active;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "limits", columnDefinition = "jsonb")
  private Map<String, Object> limits;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "features", columnDefinition = "jsonb")
  private List<String> features;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Plan() {}

  public Plan(
      String name,
      String description,
      long priceCents,
      String billingInterval,
      int trialDays,
      boolean active,
      Map<String, Object> limits,
      List<String> features,
      Instant now) {
    this.name = name;
    this.description = description;
    this.priceCents = priceCents;
    this.billingInterval = billingInterval;
    this.trialDays = trialDays;
    this.active = active;
    this.limits = limits;
    this.features = features;
    this.createdAt = now;
    this.updatedAt = now;
  }

  public void update(
      String description,
      long priceCents,
      String billingInterval,
      int trialDays,
      boolean active,
      Map<String, Object> limits,
      List<String> features,
      Instant now) {
    this.description = description;
    this.priceCents = priceCents;
    this.billingInterval = billingInterval;
    this.trialDays = trialDays;
    this.active = active;
    this.limits = limits;
    this.features = features;
    this.updatedAt = now;
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public long getPriceCents() {
    return priceCents;
  }

  public String getBillingInterval() {
    return billingInterval;
  }

  public int getTrialDays() {
    return trialDays;
  }

  public boolean isActive() {
    return active;
  }

  public Map<String, Object> getLimits() {
    return limits;
  }

  public List<String> getFeatures() {
    return features;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
