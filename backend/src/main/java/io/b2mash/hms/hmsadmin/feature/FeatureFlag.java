package io.b2mash.hms.hmsadmin.feature;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Feature flag stored under {@code flag:<id>}. The three targeting lists are nullable: null means
 * the list was never declared, while an empty {@code enabledForPlans} is a declaration that no plan
 * is entitled.
 *
 * @param key unique, human-chosen lookup key
 * @param enabledForTenants allow-list of tenant identifiers
 * @param disabledForTenants deny-list of tenant identifiers; wins over the allow-list
 * @param enabledForPlans entitled plan display names
 * @param rolloutPercentage 0-100; null when no gradual rollout is configured
 */
public record FeatureFlag(
    String id,
    String key,
    String name,
    String description,
    String category,
    FlagScope scope,
    FlagStatus status,
    List<String> enabledForTenants,
    List<String> disabledForTenants,
    List<String> enabledForPlans,
    Integer rolloutPercentage,
    Instant createdAt,
    Instant updatedAt) {

  public FeatureFlag {
    scope = scope != null ? scope : FlagScope.GLOBAL;
    status = status != null ? status : FlagStatus.ENABLED;
    enabledForTenants = copyOrNull(enabledForTenants);
    disabledForTenants = copyOrNull(disabledForTenants);
    enabledForPlans = copyOrNull(enabledForPlans);
  }

  /**
   * Moves {@code tenantId} to the allow-list (enabled) or the deny-list (disabled). Any of {@code
   * aliases} found on the opposite list is removed as well.
   */
  public FeatureFlag withTenantOverride(
      String tenantId, List<String> aliases, boolean enabled, Instant now) {
    var allow = mutable(enabledForTenants);
    var deny = mutable(disabledForTenants);
    var add = enabled ? allow : deny;
    var remove = enabled ? deny : allow;
    if (!add.contains(tenantId)) {
      add.add(tenantId);
    }
    remove.remove(tenantId);
    remove.removeAll(aliases);
    return new FeatureFlag(
        id,
        key,
        name,
        description,
        category,
        scope,
        status,
        allow,
        deny,
        enabledForPlans,
        rolloutPercentage,
        createdAt,
        now);
  }

  public FeatureFlag withPlanEntitlement(String plan, boolean enabled, Instant now) {
    var plans = mutable(enabledForPlans);
    if (enabled && !plans.contains(plan)) {
      plans.add(plan);
    } else if (!enabled) {
      plans.remove(plan);
    }
    return new FeatureFlag(
        id,
        key,
        name,
        description,
        category,
        scope,
        status,
        enabledForTenants,
        disabledForTenants,
        plans,
        rolloutPercentage,
        createdAt,
        now);
  }

  private static List<String> copyOrNull(List<String> values) {
    return values != null ? List.copyOf(values) : null;
  }

  private static List<String> mutable(List<String> values) {
    return values != null ? new ArrayList<>(values) : new ArrayList<>();
  }
}
