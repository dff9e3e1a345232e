package io.b2mash.hms.hmsadmin.usage;

import io.b2mash.hms.hmsadmin.common.ListQueries;
import io.b2mash.hms.hmsadmin.common.PageQuery;
import io.b2mash.hms.hmsadmin.common.PagedResult;
import io.b2mash.hms.hmsadmin.tenant.TenantResolver;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/usage")
public class UsageController {

  private final UsageLedger usageLedger;
  private final TenantResolver tenantResolver;

  public UsageController(UsageLedger usageLedger, TenantResolver tenantResolver) {
    this.usageLedger = usageLedger;
    this.tenantResolver = tenantResolver;
  }

  /** Global view over every usage record, optionally narrowed by tenant, metric and period. */
  @GetMapping
  public ResponseEntity<PagedResult<UsageRecord>> listUsage(
      @RequestParam(required = false) String tenant,
      @RequestParam(required = false) String metric,
      @RequestParam(required = false) String period,
      @RequestParam(defaultValue = "false") boolean overLimitOnly,
      @RequestParam(defaultValue = "1") int page,
      @RequestParam(defaultValue = "50") int limit) {

    Predicate<UsageRecord> predicate = r -> true;
    if (tenant != null) {
      predicate = predicate.and(r -> tenant.equals(r.tenantId()));
    }
    if (metric != null) {
      predicate = predicate.and(r -> metric.equals(r.metric()));
    }
    if (period != null) {
      String validPeriod = BillingPeriods.requireValid(period);
      predicate = predicate.and(r -> validPeriod.equals(r.period()));
    }
    if (overLimitOnly) {
      predicate = predicate.and(r -> r.current() >= r.limit());
    }

    var records = ListQueries.filter(usageLedger.listAll(), predicate);
    var sorted =
        records.stream()
            .sorted(
                Comparator.comparing(UsageRecord::period)
                    .reversed()
                    .thenComparing(UsageRecord::tenantId)
                    .thenComparing(UsageRecord::metric))
            .toList();
    return ResponseEntity.ok(ListQueries.paginate(sorted, new PageQuery(page, limit)));
  }

  @GetMapping("/alerts")
  public ResponseEntity<List<UsageAlert>> listAlerts(
      @RequestParam(required = false) String tenant) {
    String tenantId = tenant != null ? tenantResolver.require(tenant).id() : null;
    return ResponseEntity.ok(usageLedger.listAlerts(tenantId));
  }

  @GetMapping("/tenants/{id}")
  public ResponseEntity<UsageSummary> getTenantUsage(
      @PathVariable String id, @RequestParam(required = false) String period) {
    var tenant = tenantResolver.require(id);
    return ResponseEntity.ok(usageLedger.summarize(tenant, period));
  }

  @PostMapping("/tenants/{id}/{metric}/increment")
  public ResponseEntity<UsageRecord> increment(
      @PathVariable String id,
      @PathVariable String metric,
      @Valid @RequestBody(required = false) IncrementRequest request) {
    var tenant = tenantResolver.require(id);
    long amount = request != null && request.amount() != null ? request.amount() : 1L;
    return ResponseEntity.ok(usageLedger.track(tenant, metric, amount));
  }

  @PostMapping("/tenants/{id}/{metric}/set")
  public ResponseEntity<UsageRecord> set(
      @PathVariable String id,
      @PathVariable String metric,
      @Valid @RequestBody SetRequest request) {
    var tenant = tenantResolver.require(id);
    return ResponseEntity.ok(usageLedger.set(tenant, metric, request.value()));
  }

  @GetMapping("/tenants/{id}/{metric}/over-limit")
  public ResponseEntity<OverLimitResponse> overLimit(
      @PathVariable String id,
      @PathVariable String metric,
      @RequestParam(required = false) String period) {
    var tenant = tenantResolver.require(id);
    String effectivePeriod = period != null ? period : usageLedger.currentPeriod();
    var record = usageLedger.get(tenant.id(), metric, effectivePeriod);
    return ResponseEntity.ok(
        new OverLimitResponse(
            tenant.id(),
            metric,
            effectivePeriod,
            usageLedger.isOverLimit(tenant.id(), metric, effectivePeriod),
            record.map(UsageRecord::current).orElse(0L),
            record.map(UsageRecord::limit).orElse(null)));
  }

  @PostMapping("/tenants/{id}/reset")
  public ResponseEntity<UsageMutationResponse> reset(
      @PathVariable String id, @RequestParam(required = false) String period) {
    var tenant = tenantResolver.require(id);
    int count = usageLedger.reset(tenant.id(), period);
    return ResponseEntity.ok(new UsageMutationResponse(tenant.id(), effective(period), count));
  }

  @DeleteMapping("/tenants/{id}")
  public ResponseEntity<UsageMutationResponse> delete(
      @PathVariable String id, @RequestParam(required = false) String period) {
    var tenant = tenantResolver.require(id);
    int count = usageLedger.delete(tenant.id(), period);
    return ResponseEntity.ok(new UsageMutationResponse(tenant.id(), effective(period), count));
  }

  private String effective(String period) {
    return period != null ? period : usageLedger.currentPeriod();
  }

  // --- DTOs ---

  public record IncrementRequest(@Positive Long amount) {}

  public record SetRequest(@NotNull @PositiveOrZero Long value) {}

  public record OverLimitResponse(
      String tenantId, String metric, String period, boolean overLimit, long current, Long limit) {}

  public record UsageMutationResponse(String tenantId, String period, int records) {}
}
