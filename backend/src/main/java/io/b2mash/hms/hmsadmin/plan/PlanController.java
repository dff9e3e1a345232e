package io.b2mash.hms.hmsadmin.plan;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/plans")
public class PlanController {

  private final PlanService planService;

  public PlanController(PlanService planService) {
    this.planService = planService;
  }

  @GetMapping
  public ResponseEntity<List<PlanResponse>> listPlans() {
    return ResponseEntity.ok(planService.listPlans().stream().map(PlanResponse::from).toList());
  }

  @GetMapping("/{name}")
  public ResponseEntity<PlanResponse> getPlan(@PathVariable String name) {
    return ResponseEntity.ok(PlanResponse.from(planService.getPlan(name)));
  }

  @PostMapping
  public ResponseEntity<PlanResponse> createPlan(@Valid @RequestBody PlanRequest request) {
    var plan = planService.createPlan(request.toDefinition(request.name()));
    return ResponseEntity.created(URI.create("/internal/plans/" + plan.getName()))
        .body(PlanResponse.from(plan));
  }

  @PutMapping("/{name}")
  public ResponseEntity<PlanResponse> updatePlan(
      @PathVariable String name, @Valid @RequestBody PlanRequest request) {
    var plan = planService.updatePlan(name, request.toDefinition(name));
    return ResponseEntity.ok(PlanResponse.from(plan));
  }

  @DeleteMapping("/{name}")
  public ResponseEntity<Void> deletePlan(@PathVariable String name) {
    planService.deletePlan(name);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record PlanRequest(
      @NotBlank @Size(max = 50) String name,
      @Size(max = 500) String description,
      @Min(0) long priceCents,
      @Pattern(regexp = "month|year", message = "billingInterval must be 'month' or 'year'")
          String billingInterval,
      @Min(0) int trialDays,
      Boolean active,
      Map<String, Object> limits,
      List<String> features) {

    PlanService.PlanDefinition toDefinition(String planName) {
      return new PlanService.PlanDefinition(
          planName,
          description,
          priceCents,
          billingInterval != null ? billingInterval : "month",
          trialDays,
          active,
          limits,
          features);
    }
  }

  public record PlanResponse(
      UUID id,
      String name,
      String description,
      long priceCents,
      String billingInterval,
      int trialDays,
      boolean active,
      Map<String, Long> limits,
      List<String> features,
      Instant createdAt,
      Instant updatedAt) {

    public static PlanResponse from(Plan plan) {
      return new PlanResponse(
          plan.getId(),
          plan.getName(),
          plan.getDescription(),
          plan.getPriceCents(),
          plan.getBillingInterval(),
          plan.getTrialDays(),
          plan.isActive(),
          PlanLimits.normalize(plan.getLimits()),
          plan.getFeatures() != null ? plan.getFeatures() : List.of(),
          plan.getCreatedAt(),
          plan.getUpdatedAt());
    }
  }
}
