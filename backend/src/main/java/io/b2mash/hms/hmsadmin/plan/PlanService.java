package io.b2mash.hms.hmsadmin.plan;

import io.b2mash.hms.hmsadmin.audit.AuditLogBuilder;
import io.b2mash.hms.hmsadmin.audit.AuditService;
import io.b2mash.hms.hmsadmin.common.BestEffort;
import io.b2mash.hms.hmsadmin.exception.ResourceConflictException;
import io.b2mash.hms.hmsadmin.exception.ResourceNotFoundException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class PlanService {

  private static final Logger log = LoggerFactory.getLogger(PlanService.class);

  private final PlanRepository planRepository;
  private final AuditService auditService;
  private final Clock clock;

  public PlanService(PlanRepository planRepository, AuditService auditService, Clock clock) {
    this.planRepository = planRepository;
    this.auditService = auditService;
    this.clock = clock;
  }

  /** Parameters shared by create and update. */
  public record PlanDefinition(
      String name,
      String description,
      long priceCents,
      String billingInterval,
      int trialDays,
      Boolean active,
      Map<String, Object> limits,
      List<String> features) {}

  @Transactional(readOnly = true)
  public List<Plan> listPlans() {
    return planRepository.findAllByOrderByPriceCentsAsc();
  }

  @Transactional(readOnly = true)
  public Plan getPlan(String name) {
    return planRepository
        .findByNameIgnoreCase(name)
        .orElseThrow(() -> new ResourceNotFoundException("Plan", name));
  }

  @Transactional
  public Plan createPlan(PlanDefinition definition) {
    if (planRepository.existsByNameIgnoreCase(definition.name())) {
      throw new ResourceConflictException(
          "Plan already exists", "A plan named '" + definition.name() + "' already exists");
    }
    var plan =
        new Plan(
            definition.name(),
            definition.description(),
            definition.priceCents(),
            definition.billingInterval(),
            definition.trialDays(),
            !Boolean.FALSE.equals(definition.active()),
            normalizedLimits(definition.limits()),
            definition.features(),
            clock.instant());
    var saved = planRepository.save(plan);
    log.info("Created plan: name={}, priceCents={}", saved.getName(), saved.getPriceCents());

    BestEffort.run(
        "audit plan.created",
        () ->
            auditService.log(
                AuditLogBuilder.builder()
                    .action("plan.created")
                    .resourceType("plan")
                    .resourceId(saved.getName())
                    .after(PlanSnapshot.of(saved))
                    .build()));
    return saved;
  }

  @Transactional
  public Plan updatePlan(String name, PlanDefinition definition) {
    var plan = getPlan(name);
    var before = PlanSnapshot.of(plan);
    plan.update(
        definition.description(),
        definition.priceCents(),
        definition.billingInterval(),
        definition.trialDays(),
        definition.active() != null ? definition.active() : plan.isActive(),
        normalizedLimits(definition.limits()),
        definition.features(),
        clock.instant());
    var saved = planRepository.save(plan);
    log.info("Updated plan: name={}", saved.getName());

    BestEffort.run(
        "audit plan.updated",
        () ->
            auditService.log(
                AuditLogBuilder.builder()
                    .action("plan.updated")
                    .resourceType("plan")
                    .resourceId(saved.getName())
                    .before(before)
                    .after(PlanSnapshot.of(saved))
                    .build()));
    return saved;
  }

  @Transactional
  public void deletePlan(String name) {
    var plan = getPlan(name);
    var before = PlanSnapshot.of(plan);
    planRepository.delete(plan);
    log.info("Deleted plan: name={}", plan.getName());

    BestEffort.run(
        "audit plan.deleted",
        () ->
            auditService.log(
                AuditLogBuilder.builder()
                    .action("plan.deleted")
                    .resourceType("plan")
                    .resourceId(plan.getName())
                    .before(before)
                    .build()));
  }

  /**
   * Limit table for {@code plan}: the stored table when the plan row declares one, otherwise the
   * built-in profile. A relational failure degrades to the built-in profile.
   */
  public Map<String, Long> limitsFor(PlanName plan) {
    var effective = plan != null ? plan : PlanName.TRIAL;
    try {
      var stored =
          planRepository
              .findByNameIgnoreCase(effective.displayName())
              .map(p -> PlanLimits.normalize(p.getLimits()))
              .filter(limits -> !limits.isEmpty());
      if (stored.isPresent()) {
        return stored.get();
      }
    } catch (DataAccessException e) {
      log.warn(
          "Plan limit lookup failed, using built-in profile: plan={}, error={}",
          effective.displayName(),
          e.getMessage());
    }
    return PlanLimits.defaultsFor(effective);
  }

  private static Map<String, Object> normalizedLimits(Map<String, Object> limits) {
    if (limits == null) {
      return null;
    }
    return new LinkedHashMap<String, Object>(PlanLimits.normalize(limits));
  }

  /** Audit snapshot of a plan row. */
  record PlanSnapshot(
      String name,
      String description,
      long priceCents,
      String billingInterval,
      int trialDays,
      boolean active,
      Map<String, Object> limits,
      List<String> features) {

    static PlanSnapshot of(Plan plan) {
      return new PlanSnapshot(
          plan.getName(),
          plan.getDescription(),
          plan.getPriceCents(),
          plan.getBillingInterval(),
          plan.getTrialDays(),
          plan.isActive(),
          plan.getLimits(),
          plan.getFeatures());
    }
  }
}
