package io.b2mash.hms.hmsadmin.tenant;

import io.b2mash.hms.hmsadmin.plan.PlanName;
import java.util.Map;

/**
 * Partial update of a tenant. Null fields are left unchanged; {@code settings} entries are merged
 * key by key and a null value removes the key.
 */
public record TenantChanges(
    String name,
    String email,
    String phone,
    PlanName plan,
    String subdomain,
    String region,
    String billingEntity,
    String timezone,
    String currency,
    Map<String, Object> settings) {

  /** Changes that touch only the free-form settings bag. */
  public static TenantChanges settingsOnly(Map<String, Object> settings) {
    return new TenantChanges(null, null, null, null, null, null, null, null, null, settings);
  }
}
