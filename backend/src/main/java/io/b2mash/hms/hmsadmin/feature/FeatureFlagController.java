package io.b2mash.hms.hmsadmin.feature;

import com.fasterxml.jackson.annotation.JsonAlias;
import io.b2mash.hms.hmsadmin.exception.InvalidStateException;
import io.b2mash.hms.hmsadmin.plan.PlanName;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class FeatureFlagController {

  private final FeatureFlagService featureFlagService;

  public FeatureFlagController(FeatureFlagService featureFlagService) {
    this.featureFlagService = featureFlagService;
  }

  @GetMapping("/internal/feature-flags")
  public ResponseEntity<List<FeatureFlag>> listFlags(
      @RequestParam(required = false) String category,
      @RequestParam(required = false) String status) {
    var statusFilter = status != null ? FlagStatus.parse(status) : null;
    return ResponseEntity.ok(featureFlagService.listFlags(category, statusFilter));
  }

  @PostMapping("/internal/feature-flags")
  public ResponseEntity<FeatureFlag> createFlag(@Valid @RequestBody FlagRequest request) {
    if (request.key() == null) {
      throw new InvalidStateException("Missing flag key", "A key is required to create a flag");
    }
    var flag = featureFlagService.createFlag(request.toDefinition(request.key()));
    return ResponseEntity.created(URI.create("/internal/feature-flags/" + flag.key())).body(flag);
  }

  @GetMapping("/internal/feature-flags/{key}")
  public ResponseEntity<FeatureFlag> getFlag(@PathVariable String key) {
    return ResponseEntity.ok(featureFlagService.getFlag(key));
  }

  @PutMapping("/internal/feature-flags/{key}")
  public ResponseEntity<FeatureFlag> updateFlag(
      @PathVariable String key, @Valid @RequestBody FlagRequest request) {
    return ResponseEntity.ok(featureFlagService.updateFlag(key, request.toDefinition(key)));
  }

  @DeleteMapping("/internal/feature-flags/{key}")
  public ResponseEntity<Void> deleteFlag(@PathVariable String key) {
    featureFlagService.deleteFlag(key);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/internal/feature-flags/{key}/tenants")
  public ResponseEntity<FeatureFlag> toggleTenant(
      @PathVariable String key, @Valid @RequestBody TenantToggleRequest request) {
    return ResponseEntity.ok(
        featureFlagService.setTenantOverride(key, request.tenantId(), request.enabled()));
  }

  @PostMapping("/internal/feature-flags/{key}/plans")
  public ResponseEntity<FeatureFlag> togglePlan(
      @PathVariable String key, @Valid @RequestBody PlanToggleRequest request) {
    return ResponseEntity.ok(
        featureFlagService.setPlanEntitlement(key, request.plan(), request.enabled()));
  }

  @GetMapping("/internal/feature-flags/{key}/evaluate")
  public ResponseEntity<EvaluationResponse> evaluate(
      @PathVariable String key,
      @RequestParam String tenant,
      @RequestParam(required = false) String plan) {
    var decision = featureFlagService.evaluate(key, tenant, plan);
    return ResponseEntity.ok(
        new EvaluationResponse(key, tenant, plan, decision.enabled(), decision.rule()));
  }

  @GetMapping("/internal/tenants/{id}/features")
  public ResponseEntity<List<FeatureFlagService.TenantFeature>> tenantFeatures(
      @PathVariable String id) {
    return ResponseEntity.ok(featureFlagService.tenantFeatures(id));
  }

  @PutMapping("/internal/tenants/{id}/features")
  public ResponseEntity<List<FeatureFlagService.TenantFeature>> updateTenantFeatures(
      @PathVariable String id, @Valid @RequestBody TenantFeaturesRequest request) {
    var toggles =
        request.features().stream()
            .map(f -> new FeatureFlagService.TenantFeatureToggle(f.key(), f.enabled()))
            .toList();
    return ResponseEntity.ok(featureFlagService.updateTenantFeatures(id, toggles));
  }

  // --- DTOs ---

  public record FlagRequest(
      @Pattern(
              regexp = "^[a-z0-9][a-z0-9_.-]{0,99}$",
              message = "key must be lowercase letters, digits, '_', '.' or '-'")
          String key,
      @NotBlank @Size(max = 200) String name,
      @Size(max = 1000) String description,
      @Size(max = 100) String category,
      FlagScope scope,
      FlagStatus status,
      List<String> enabledForTenants,
      List<String> disabledForTenants,
      List<String> enabledForPlans,
      @Min(0) @Max(100) Integer rolloutPercentage) {

    FeatureFlagService.FlagDefinition toDefinition(String flagKey) {
      return new FeatureFlagService.FlagDefinition(
          flagKey,
          name,
          description,
          category,
          scope,
          status,
          enabledForTenants,
          disabledForTenants,
          enabledForPlans,
          rolloutPercentage);
    }
  }

  public record TenantToggleRequest(
      @NotBlank @JsonAlias("tenant_id") String tenantId, boolean enabled) {}

  public record PlanToggleRequest(@NotNull PlanName plan, boolean enabled) {}

  public record TenantFeaturesRequest(@NotNull List<@Valid FeatureToggle> features) {}

  public record FeatureToggle(@NotBlank String key, boolean enabled) {}

  public record EvaluationResponse(
      String key, String tenant, String plan, boolean enabled, FlagDecision.Rule rule) {}
}
