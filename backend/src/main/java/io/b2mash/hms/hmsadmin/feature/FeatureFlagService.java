package io.b2mash.hms.hmsadmin.feature;

import io.b2mash.hms.hmsadmin.audit.AuditLogBuilder;
import io.b2mash.hms.hmsadmin.audit.AuditService;
import io.b2mash.hms.hmsadmin.common.BestEffort;
import io.b2mash.hms.hmsadmin.common.IdGenerator;
import io.b2mash.hms.hmsadmin.exception.ResourceConflictException;
import io.b2mash.hms.hmsadmin.exception.ResourceNotFoundException;
import io.b2mash.hms.hmsadmin.plan.PlanName;
import io.b2mash.hms.hmsadmin.tenant.TenantRecord;
import io.b2mash.hms.hmsadmin.tenant.TenantResolver;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class FeatureFlagService {

  private static final Logger log = LoggerFactory.getLogger(FeatureFlagService.class);

  static final String ID_PREFIX = "ff";

  private final FeatureFlagStore flagStore;
  private final FeatureFlagEvaluator evaluator;
  private final TenantResolver tenantResolver;
  private final AuditService auditService;
  private final Clock clock;

  public FeatureFlagService(
      FeatureFlagStore flagStore,
      FeatureFlagEvaluator evaluator,
      TenantResolver tenantResolver,
      AuditService auditService,
      Clock clock) {
    this.flagStore = flagStore;
    this.evaluator = evaluator;
    this.tenantResolver = tenantResolver;
    this.auditService = auditService;
    this.clock = clock;
  }

  /** Descriptive and targeting attributes supplied on create and update. */
  public record FlagDefinition(
      String key,
      String name,
      String description,
      String category,
      FlagScope scope,
      FlagStatus status,
      List<String> enabledForTenants,
      List<String> disabledForTenants,
      List<String> enabledForPlans,
      Integer rolloutPercentage) {}

  /** One flag as seen by a tenant. */
  public record TenantFeature(
      String id,
      String key,
      String name,
      String description,
      String category,
      FlagScope scope,
      boolean enabled,
      FlagDecision.Rule rule,
      boolean planLocked) {}

  public record TenantFeatureToggle(String key, boolean enabled) {}

  public List<FeatureFlag> listFlags(String category, FlagStatus status) {
    return flagStore.findAll().stream()
        .filter(f -> category == null || category.equalsIgnoreCase(f.category()))
        .filter(f -> status == null || status == f.status())
        .toList();
  }

  public FeatureFlag getFlag(String key) {
    return flagStore
        .findByKey(key)
        .orElseThrow(() -> new ResourceNotFoundException("Feature flag", key));
  }

  public FeatureFlag createFlag(FlagDefinition definition) {
    if (flagStore.findByKey(definition.key()).isPresent()) {
      throw new ResourceConflictException(
          "Feature flag already exists",
          "A flag with key '" + definition.key() + "' already exists");
    }
    var now = clock.instant();
    var flag =
        new FeatureFlag(
            IdGenerator.generate(ID_PREFIX, clock),
            definition.key(),
            definition.name(),
            definition.description(),
            definition.category(),
            definition.scope(),
            definition.status(),
            definition.enabledForTenants(),
            definition.disabledForTenants(),
            definition.enabledForPlans(),
            definition.rolloutPercentage(),
            now,
            now);
    flagStore.save(flag);
    log.info(
        "Created feature flag: key={}, id={}, status={}", flag.key(), flag.id(), flag.status());
    audit("feature_flag.created", flag, null, flag);
    return flag;
  }

  /** Replaces the flag's attributes; a null targeting list clears the declaration. */
  public FeatureFlag updateFlag(String key, FlagDefinition definition) {
    var existing = getFlag(key);
    var updated =
        new FeatureFlag(
            existing.id(),
            existing.key(),
            definition.name() != null ? definition.name() : existing.name(),
            definition.description(),
            definition.category(),
            definition.scope() != null ? definition.scope() : existing.scope(),
            definition.status() != null ? definition.status() : existing.status(),
            definition.enabledForTenants(),
            definition.disabledForTenants(),
            definition.enabledForPlans(),
            definition.rolloutPercentage(),
            existing.createdAt(),
            clock.instant());
    flagStore.save(updated);
    log.info("Updated feature flag: key={}", key);
    audit("feature_flag.updated", updated, existing, updated);
    return updated;
  }

  public void deleteFlag(String key) {
    var existing = getFlag(key);
    flagStore.delete(existing);
    log.info("Deleted feature flag: key={}", key);
    audit("feature_flag.deleted", existing, existing, null);
  }

  /**
   * Enables or disables the flag for one tenant by moving the tenant's canonical code between the
   * allow and deny lists.
   */
  public FeatureFlag setTenantOverride(String key, String tenantIdentifier, boolean enabled) {
    var flag = getFlag(key);
    var tenant = tenantResolver.require(tenantIdentifier);
    var updated =
        flag.withTenantOverride(
            tenant.id(), FeatureFlagEvaluator.identifiersOf(tenant), enabled, clock.instant());
    flagStore.save(updated);
    log.info("Set tenant flag override: key={}, tenant={}, enabled={}", key, tenant.id(), enabled);
    audit("feature_flag.tenant_override", updated, flag, updated);
    return updated;
  }

  public FeatureFlag setPlanEntitlement(String key, PlanName plan, boolean enabled) {
    var flag = getFlag(key);
    var updated = flag.withPlanEntitlement(plan.displayName(), enabled, clock.instant());
    flagStore.save(updated);
    log.info(
        "Set plan flag entitlement: key={}, plan={}, enabled={}",
        key,
        plan.displayName(),
        enabled);
    audit("feature_flag.plan_entitlement", updated, flag, updated);
    return updated;
  }

  /**
   * Evaluates {@code key} for {@code tenantIdentifier}. A resolvable tenant is evaluated with its
   * canonical identity; {@code planOverride}, when given, replaces its plan. An unknown identifier
   * is evaluated as given.
   */
  public FlagDecision evaluate(String key, String tenantIdentifier, String planOverride) {
    var identity = tenantResolver.resolve(tenantIdentifier);
    if (!identity.isResolved()) {
      return evaluator.evaluate(key, tenantIdentifier, planOverride);
    }
    var flag = flagStore.findByKey(key);
    if (flag.isEmpty()) {
      return FlagDecision.of(false, FlagDecision.Rule.FLAG_MISSING);
    }
    TenantRecord tenant = identity.tenant();
    if (planOverride == null) {
      return evaluator.evaluate(flag.get(), tenant);
    }
    return FeatureFlagEvaluator.decide(
        flag.get(), FeatureFlagEvaluator.identifiersOf(tenant), tenant.id(), planOverride);
  }

  public List<TenantFeature> tenantFeatures(String tenantIdentifier) {
    var tenant = tenantResolver.require(tenantIdentifier);
    return flagStore.findAll().stream()
        .map(
            flag -> {
              var decision = evaluator.evaluate(flag, tenant);
              return new TenantFeature(
                  flag.id(),
                  flag.key(),
                  flag.name(),
                  flag.description(),
                  flag.category(),
                  flag.scope(),
                  decision.enabled(),
                  decision.rule(),
                  flag.scope() == FlagScope.PLAN);
            })
        .toList();
  }

  /** Applies per-tenant toggles in bulk. Plan-locked flags and unknown keys are skipped. */
  public List<TenantFeature> updateTenantFeatures(
      String tenantIdentifier, List<TenantFeatureToggle> toggles) {
    var tenant = tenantResolver.require(tenantIdentifier);
    for (TenantFeatureToggle toggle : toggles) {
      var flag = flagStore.findByKey(toggle.key());
      if (flag.isEmpty()) {
        log.warn(
            "Skipping unknown flag in bulk update: tenant={}, key={}", tenant.id(), toggle.key());
        continue;
      }
      if (flag.get().scope() == FlagScope.PLAN) {
        log.debug("Skipping plan-locked flag: tenant={}, key={}", tenant.id(), toggle.key());
        continue;
      }
      setTenantOverride(toggle.key(), tenant.id(), toggle.enabled());
    }
    return tenantFeatures(tenant.id());
  }

  private void audit(String action, FeatureFlag flag, Object before, Object after) {
    BestEffort.run(
        "audit " + action,
        () ->
            auditService.log(
                AuditLogBuilder.builder()
                    .action(action)
                    .resourceType("feature_flag")
                    .resourceId(flag.key())
                    .before(before)
                    .after(after)
                    .build()));
  }
}
