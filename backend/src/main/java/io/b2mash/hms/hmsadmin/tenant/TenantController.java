package io.b2mash.hms.hmsadmin.tenant;

import io.b2mash.hms.hmsadmin.common.PageQuery;
import io.b2mash.hms.hmsadmin.common.PagedResult;
import io.b2mash.hms.hmsadmin.common.SortSpec;
import io.b2mash.hms.hmsadmin.plan.PlanName;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/tenants")
public class TenantController {

  private final TenantService tenantService;

  public TenantController(TenantService tenantService) {
    this.tenantService = tenantService;
  }

  @GetMapping
  public ResponseEntity<PagedResult<TenantRecord>> listTenants(
      @RequestParam(required = false) String status,
      @RequestParam(required = false) String plan,
      @RequestParam(required = false) String region,
      @RequestParam(required = false) String search,
      @RequestParam(required = false) Instant createdFrom,
      @RequestParam(required = false) Instant createdTo,
      @RequestParam(required = false) String sort,
      @RequestParam(required = false) String order,
      @RequestParam(defaultValue = "1") int page,
      @RequestParam(defaultValue = "50") int limit) {

    var filter =
        new TenantListFilter(
            status != null ? TenantStatus.parse(status) : null,
            plan != null ? PlanName.parse(plan) : null,
            region,
            search,
            createdFrom,
            createdTo);
    return ResponseEntity.ok(
        tenantService.list(filter, SortSpec.parse(sort, order), new PageQuery(page, limit)));
  }

  @GetMapping("/stats")
  public ResponseEntity<TenantStats> stats() {
    return ResponseEntity.ok(tenantService.stats());
  }

  /** 201 when both stores accepted the tenant, 207 when only one did. */
  @PostMapping
  public ResponseEntity<TenantCreationResponse> createTenant(
      @Valid @RequestBody CreateTenantRequest request) {
    var result =
        tenantService.create(
            new TenantService.NewTenant(
                request.name(),
                request.email(),
                request.phone(),
                request.plan(),
                request.subdomain(),
                request.region(),
                request.billingEntity(),
                request.timezone(),
                request.currency(),
                request.settings()));

    var body = TenantCreationResponse.from(result);
    var location = URI.create("/internal/tenants/" + result.tenant().id());
    if (result.isComplete()) {
      return ResponseEntity.created(location).body(body);
    }
    return ResponseEntity.status(HttpStatus.MULTI_STATUS).location(location).body(body);
  }

  @GetMapping("/{id}")
  public ResponseEntity<TenantRecord> getTenant(@PathVariable String id) {
    return ResponseEntity.ok(tenantService.get(id));
  }

  @PutMapping("/{id}")
  public ResponseEntity<TenantRecord> updateTenant(
      @PathVariable String id, @Valid @RequestBody UpdateTenantRequest request) {
    var changes =
        new TenantChanges(
            request.name(),
            request.email(),
            request.phone(),
            request.plan(),
            request.subdomain(),
            request.region(),
            request.billingEntity(),
            request.timezone(),
            request.currency(),
            request.settings());
    return ResponseEntity.ok(tenantService.update(id, changes));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteTenant(@PathVariable String id) {
    tenantService.delete(id);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{id}/suspend")
  public ResponseEntity<TenantRecord> suspend(
      @PathVariable String id, @RequestBody(required = false) StatusChangeRequest request) {
    return ResponseEntity.ok(
        tenantService.changeStatus(id, TenantStatusAction.SUSPEND, reasonOf(request)));
  }

  @PostMapping("/{id}/unsuspend")
  public ResponseEntity<TenantRecord> unsuspend(
      @PathVariable String id, @RequestBody(required = false) StatusChangeRequest request) {
    return ResponseEntity.ok(
        tenantService.changeStatus(id, TenantStatusAction.UNSUSPEND, reasonOf(request)));
  }

  @PostMapping("/{id}/cancel")
  public ResponseEntity<TenantRecord> cancel(
      @PathVariable String id, @RequestBody(required = false) StatusChangeRequest request) {
    return ResponseEntity.ok(
        tenantService.changeStatus(id, TenantStatusAction.CANCEL, reasonOf(request)));
  }

  @GetMapping("/{id}/settings")
  public ResponseEntity<Map<String, Object>> getSettings(@PathVariable String id) {
    return ResponseEntity.ok(tenantService.getSettings(id));
  }

  /**
   * Merges settings. A body of the form {@code {"category": "...", "data": {...}}} is stored under
   * the category key; any other body is merged as is.
   */
  @PutMapping("/{id}/settings")
  public ResponseEntity<Map<String, Object>> updateSettings(
      @PathVariable String id, @RequestBody Map<String, Object> body) {
    Map<String, Object> settings = body;
    if (body.get("category") instanceof String category && body.get("data") != null) {
      settings = Map.of(category, body.get("data"));
    }
    tenantService.updateSettings(id, settings);
    return ResponseEntity.ok(tenantService.getSettings(id));
  }

  private static String reasonOf(StatusChangeRequest request) {
    return request != null ? request.reason() : null;
  }

  // --- DTOs ---

  public record CreateTenantRequest(
      @NotBlank @Size(max = 255) String name,
      @NotBlank @Email @Size(max = 255) String email,
      @Size(max = 50) String phone,
      @NotNull PlanName plan,
      @NotBlank
          @Pattern(
              regexp = "^[a-z0-9](?:[a-z0-9-]{0,61}[a-z0-9])?$",
              message = "subdomain must be lowercase letters, digits and hyphens")
          String subdomain,
      @Size(max = 50) String region,
      @Size(max = 255) String billingEntity,
      @Size(max = 64) String timezone,
      @Size(min = 3, max = 3) String currency,
      Map<String, Object> settings) {}

  public record UpdateTenantRequest(
      @Size(min = 1, max = 255) String name,
      @Email @Size(max = 255) String email,
      @Size(max = 50) String phone,
      PlanName plan,
      @Pattern(
              regexp = "^[a-z0-9](?:[a-z0-9-]{0,61}[a-z0-9])?$",
              message = "subdomain must be lowercase letters, digits and hyphens")
          String subdomain,
      @Size(max = 50) String region,
      @Size(max = 255) String billingEntity,
      @Size(max = 64) String timezone,
      @Size(min = 3, max = 3) String currency,
      Map<String, Object> settings) {}

  public record StatusChangeRequest(@Size(max = 500) String reason) {}

  public record TenantCreationResponse(
      TenantRecord tenant,
      boolean relationalStored,
      boolean fastStoreStored,
      List<String> warnings) {

    static TenantCreationResponse from(TenantCreationResult result) {
      return new TenantCreationResponse(
          result.tenant(), result.relationalStored(), result.fastStoreStored(), result.warnings());
    }
  }
}
