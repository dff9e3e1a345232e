package io.b2mash.hms.hmsadmin.feature;

import io.b2mash.hms.hmsadmin.tenant.TenantRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Decides whether a flag is on for a tenant. Rules are applied in order and the first that matches
 * decides:
 *
 * <ol>
 *   <li>flag missing or {@code disabled}: off
 *   <li>tenant on the deny-list: off
 *   <li>tenant on the allow-list: on
 *   <li>plan given and the declared plan list does not contain it: off
 *   <li>rollout below 100%: on iff the tenant's {@link RolloutBucket} is below the percentage
 *   <li>otherwise on iff the status is {@code enabled}
 * </ol>
 */
@Component
public class FeatureFlagEvaluator {

  private final FeatureFlagStore flagStore;

  public FeatureFlagEvaluator(FeatureFlagStore flagStore) {
    this.flagStore = flagStore;
  }

  public boolean isEnabled(String flagKey, String tenantIdentifier, String planName) {
    return evaluate(flagKey, tenantIdentifier, planName).enabled();
  }

  /** Evaluates against a raw identifier; {@code planName} may be null. */
  public FlagDecision evaluate(String flagKey, String tenantIdentifier, String planName) {
    Objects.requireNonNull(tenantIdentifier, "tenantIdentifier");
    var flag = flagStore.findByKey(flagKey);
    if (flag.isEmpty()) {
      return FlagDecision.of(false, FlagDecision.Rule.FLAG_MISSING);
    }
    return decide(flag.get(), List.of(tenantIdentifier), tenantIdentifier, planName);
  }

  /**
   * Evaluates against a resolved tenant. Deny and allow lists are matched against both the external
   * code and the UUID; the rollout bucket and plan come from the external code and current plan.
   */
  public FlagDecision evaluate(FeatureFlag flag, TenantRecord tenant) {
    return decide(flag, identifiersOf(tenant), tenant.id(), tenant.plan().displayName());
  }

  static List<String> identifiersOf(TenantRecord tenant) {
    var identifiers = new ArrayList<String>(2);
    identifiers.add(tenant.id());
    if (tenant.uuid() != null && !tenant.uuid().toString().equals(tenant.id())) {
      identifiers.add(tenant.uuid().toString());
    }
    return identifiers;
  }

  static FlagDecision decide(
      FeatureFlag flag, List<String> identifiers, String bucketIdentifier, String planName) {
    if (flag == null) {
      return FlagDecision.of(false, FlagDecision.Rule.FLAG_MISSING);
    }
    if (flag.status() == FlagStatus.DISABLED) {
      return FlagDecision.of(false, FlagDecision.Rule.FLAG_DISABLED);
    }
    if (containsAny(flag.disabledForTenants(), identifiers)) {
      return FlagDecision.of(false, FlagDecision.Rule.DENY_LIST);
    }
    if (containsAny(flag.enabledForTenants(), identifiers)) {
      return FlagDecision.of(true, FlagDecision.Rule.ALLOW_LIST);
    }
    if (planName != null
        && flag.enabledForPlans() != null
        && !flag.enabledForPlans().contains(planName)) {
      return FlagDecision.of(false, FlagDecision.Rule.PLAN_NOT_ENTITLED);
    }
    Integer rollout = flag.rolloutPercentage();
    if (rollout != null && rollout < 100) {
      return FlagDecision.of(
          RolloutBucket.of(bucketIdentifier) < rollout, FlagDecision.Rule.ROLLOUT);
    }
    return FlagDecision.of(flag.status() == FlagStatus.ENABLED, FlagDecision.Rule.STATUS);
  }

  private static boolean containsAny(List<String> list, List<String> identifiers) {
    return list != null && identifiers.stream().anyMatch(list::contains);
  }
}
