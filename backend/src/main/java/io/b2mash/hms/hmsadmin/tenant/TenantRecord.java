package io.b2mash.hms.hmsadmin.tenant;

import io.b2mash.hms.hmsadmin.plan.PlanName;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Normalized tenant shape stored under {@code tenant:<id>} and returned by {@link TenantResolver}
 * regardless of which backend answered. Descriptive attributes are flat; {@code settings} holds
 * only the free-form keys that are not lifted to a field.
 *
 * @param id external code ({@code T-<n>}); the UUID text for rows that never had one
 * @param uuid relational primary key; null for tenants that exist only in the fast store
 */
public record TenantRecord(
    String id,
    UUID uuid,
    String name,
    PlanName plan,
    TenantStatus status,
    BigDecimal mrr,
    String email,
    String phone,
    String subdomain,
    String region,
    String billingEntity,
    String timezone,
    String currency,
    Map<String, Object> settings,
    Instant createdAt,
    Instant updatedAt) {

  public static final String DEFAULT_TIMEZONE = "UTC";
  public static final String DEFAULT_CURRENCY = "USD";

  public TenantRecord {
    plan = plan != null ? plan : PlanName.TRIAL;
    timezone = timezone != null ? timezone : DEFAULT_TIMEZONE;
    currency = currency != null ? currency : DEFAULT_CURRENCY;
    mrr = (mrr != null ? mrr : BigDecimal.ZERO).setScale(2, RoundingMode.HALF_UP);
    settings = Collections.unmodifiableMap(new TreeMap<>(settings != null ? settings : Map.of()));
  }
}
