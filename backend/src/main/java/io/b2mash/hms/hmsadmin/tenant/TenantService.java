package io.b2mash.hms.hmsadmin.tenant;

import io.b2mash.hms.hmsadmin.audit.AuditLogBuilder;
import io.b2mash.hms.hmsadmin.audit.AuditService;
import io.b2mash.hms.hmsadmin.common.BestEffort;
import io.b2mash.hms.hmsadmin.common.ListQueries;
import io.b2mash.hms.hmsadmin.common.PageQuery;
import io.b2mash.hms.hmsadmin.common.PagedResult;
import io.b2mash.hms.hmsadmin.common.SortSpec;
import io.b2mash.hms.hmsadmin.exception.BackendUnavailableException;
import io.b2mash.hms.hmsadmin.exception.InvalidStateException;
import io.b2mash.hms.hmsadmin.exception.ResourceConflictException;
import io.b2mash.hms.hmsadmin.kvstore.KeyPrefixStore;
import io.b2mash.hms.hmsadmin.kvstore.KeyValueStoreException;
import io.b2mash.hms.hmsadmin.kvstore.StoreKeys;
import io.b2mash.hms.hmsadmin.plan.PlanName;
import io.b2mash.hms.hmsadmin.usage.UsageLedger;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Tenant lifecycle across both stores. Writes are sequential and not atomic across backends: the
 * outcome of each backend write is either reported to the caller or logged.
 */
@Service
public class TenantService {

  private static final Logger log = LoggerFactory.getLogger(TenantService.class);

  private static final Map<String, Comparator<TenantRecord>> SORTABLE_FIELDS =
      Map.of(
          "id",
          Comparator.comparingLong(TenantService::codeNumber).thenComparing(TenantRecord::id),
          "name",
          Comparator.comparing(
              TenantRecord::name, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER)),
          "plan",
          Comparator.comparing(TenantRecord::plan),
          "status",
          Comparator.comparing(TenantRecord::status),
          "mrr",
          Comparator.comparing(TenantRecord::mrr),
          "createdAt",
          Comparator.comparing(
              TenantRecord::createdAt, Comparator.nullsLast(Comparator.naturalOrder())));

  private final TenantRepository tenantRepository;
  private final KeyPrefixStore store;
  private final TenantResolver tenantResolver;
  private final ExternalCodeAllocator codeAllocator;
  private final UsageLedger usageLedger;
  private final AuditService auditService;
  private final Clock clock;

  public TenantService(
      TenantRepository tenantRepository,
      KeyPrefixStore store,
      TenantResolver tenantResolver,
      ExternalCodeAllocator codeAllocator,
      UsageLedger usageLedger,
      AuditService auditService,
      Clock clock) {
    this.tenantRepository = tenantRepository;
    this.store = store;
    this.tenantResolver = tenantResolver;
    this.codeAllocator = codeAllocator;
    this.usageLedger = usageLedger;
    this.auditService = auditService;
    this.clock = clock;
  }

  /** Attributes of a tenant being created. */
  public record NewTenant(
      String name,
      String email,
      String phone,
      PlanName plan,
      String subdomain,
      String region,
      String billingEntity,
      String timezone,
      String currency,
      Map<String, Object> settings) {}

  public TenantCreationResult create(NewTenant request) {
    String code = codeAllocator.next();
    if (tenantResolver.resolve(code).isResolved()) {
      throw new ResourceConflictException(
          "Tenant code in use", "Tenant code " + code + " is already assigned to a live tenant");
    }

    PlanName plan = request.plan() != null ? request.plan() : PlanName.TRIAL;
    TenantStatus status = plan == PlanName.TRIAL ? TenantStatus.TRIAL : TenantStatus.ACTIVE;
    Instant now = now();

    var settings =
        TenantRecordMapper.mergeSettings(
            Map.of(),
            new TenantChanges(
                null,
                null,
                null,
                plan,
                request.subdomain(),
                request.region(),
                request.billingEntity() != null ? request.billingEntity() : request.name(),
                request.timezone(),
                request.currency(),
                request.settings()));
    settings.put(TenantRecordMapper.EXTERNAL_ID, code);

    var entity =
        new Tenant(
            UUID.randomUUID(),
            request.name(),
            status,
            plan.defaultMrr(),
            request.email(),
            request.phone(),
            settings,
            now);
    var record = TenantRecordMapper.toRecord(entity);
    var warnings = new ArrayList<String>();

    boolean relationalStored = false;
    DataAccessException relationalFailure = null;
    try {
      tenantRepository.saveAndFlush(entity);
      relationalStored = true;
    } catch (DataIntegrityViolationException e) {
      throw new ResourceConflictException(
          "Tenant code in use", "Tenant code " + code + " is already assigned to a live tenant");
    } catch (DataAccessException e) {
      relationalFailure = e;
      warnings.add("Relational store write failed: " + e.getMostSpecificCause().getMessage());
      log.warn("Tenant relational insert failed: code={}, error={}", code, e.getMessage());
    }

    boolean fastStoreStored = false;
    try {
      store.set(StoreKeys.tenant(code), record);
      fastStoreStored = true;
    } catch (KeyValueStoreException e) {
      warnings.add("Fast store write failed: " + e.getMessage());
      log.warn("Tenant fast-store write failed: code={}, error={}", code, e.getMessage());
      if (!relationalStored) {
        throw new BackendUnavailableException(
            "Tenant " + code + " could not be written to either store",
            relationalFailure != null ? relationalFailure : e);
      }
    }

    log.info(
        "Created tenant: code={}, uuid={}, plan={}, relational={}, fastStore={}",
        code,
        record.uuid(),
        plan.displayName(),
        relationalStored,
        fastStoreStored);
    audit("tenant.created", record, null, record);
    return new TenantCreationResult(
        record, relationalStored, fastStoreStored, List.copyOf(warnings));
  }

  public TenantRecord get(String identifier) {
    return tenantResolver.require(identifier);
  }

  /**
   * Applies {@code changes}. The fast-store record is the primary write; the relational row is
   * synchronized afterwards and a failure there is only logged. The external code never changes.
   * A plan change resets MRR to the new plan's price.
   */
  public TenantRecord update(String identifier, TenantChanges changes) {
    var current = tenantResolver.require(identifier);
    BigDecimal mrr =
        changes.plan() != null && changes.plan() != current.plan()
            ? changes.plan().defaultMrr()
            : current.mrr();
    var updated =
        rebuild(
            current,
            changes.name() != null ? changes.name() : current.name(),
            current.status(),
            mrr,
            changes.email() != null ? changes.email() : current.email(),
            changes.phone() != null ? changes.phone() : current.phone(),
            changes);

    persist(updated, changes);
    log.info("Updated tenant: code={}", updated.id());
    audit("tenant.updated", updated, current, updated);
    return updated;
  }

  public TenantRecord changeStatus(String identifier, TenantStatusAction action, String reason) {
    var current = tenantResolver.require(identifier);
    if (!action.isAllowedFrom(current.status())) {
      throw new InvalidStateException(
          "Invalid status transition",
          "Cannot "
              + action.name().toLowerCase()
              + " tenant "
              + current.id()
              + " in status "
              + current.status().value());
    }

    var metadata = new HashMap<String, Object>();
    metadata.put(action.timestampKey(), now().toString());
    if (action == TenantStatusAction.SUSPEND) {
      metadata.put("suspension_reason", reason);
    } else if (action == TenantStatusAction.CANCEL) {
      metadata.put("cancellation_reason", reason);
    }
    var changes = TenantChanges.settingsOnly(metadata);
    var updated =
        rebuild(
            current,
            current.name(),
            action.target(),
            current.mrr(),
            current.email(),
            current.phone(),
            changes);

    persist(updated, changes);
    log.info(
        "Changed tenant status: code={}, from={}, to={}",
        updated.id(),
        current.status().value(),
        updated.status().value());
    audit(action.auditAction(), updated, current, updated);
    return updated;
  }

  /**
   * Deletes the tenant. The relational delete must succeed; the fast-store record and every usage
   * key of the tenant are then removed best-effort.
   */
  public void delete(String identifier) {
    var current = tenantResolver.require(identifier);
    audit("tenant.deleted", current, current, null);

    if (current.uuid() != null) {
      tenantRepository.deleteById(current.uuid());
    }
    BestEffort.run(
        "delete fast-store tenant " + current.id(),
        () -> store.delete(StoreKeys.tenant(current.id())));
    BestEffort.run("purge usage of tenant " + current.id(), () -> usageLedger.purge(current.id()));
    log.info("Deleted tenant: code={}, uuid={}", current.id(), current.uuid());
  }

  /** Free-form settings plus the lifted attributes, in the relational layout. */
  public Map<String, Object> getSettings(String identifier) {
    return new TreeMap<>(TenantRecordMapper.toSettings(tenantResolver.require(identifier)));
  }

  public TenantRecord updateSettings(String identifier, Map<String, Object> settings) {
    return update(identifier, TenantChanges.settingsOnly(settings));
  }

  public PagedResult<TenantRecord> list(TenantListFilter filter, SortSpec sort, PageQuery page) {
    var filtered =
        ListQueries.filter(
            loadAll(), (filter != null ? filter : TenantListFilter.none()).toPredicate());
    var effectiveSort = sort != null ? sort : new SortSpec("id", SortSpec.Direction.ASC);
    var sorted = ListQueries.sort(filtered, effectiveSort, SORTABLE_FIELDS);
    return ListQueries.paginate(sorted, page);
  }

  public TenantStats stats() {
    var tenants = loadAll();
    var byStatus = new LinkedHashMap<String, Long>();
    for (TenantStatus status : TenantStatus.values()) {
      byStatus.put(status.value(), 0L);
    }
    var byPlan = new LinkedHashMap<String, Long>();
    for (PlanName plan : PlanName.values()) {
      byPlan.put(plan.displayName(), 0L);
    }
    BigDecimal totalMrr = BigDecimal.ZERO;
    for (TenantRecord tenant : tenants) {
      byStatus.merge(tenant.status().value(), 1L, Long::sum);
      byPlan.merge(tenant.plan().displayName(), 1L, Long::sum);
      if (tenant.status() == TenantStatus.ACTIVE || tenant.status() == TenantStatus.TRIAL) {
        totalMrr = totalMrr.add(tenant.mrr());
      }
    }
    return new TenantStats(tenants.size(), byStatus, byPlan, totalMrr);
  }

  /**
   * Union of both stores keyed by external code. A fast-store record replaces the relational view
   * of the same tenant. One store failing degrades the listing; both failing is a 503.
   */
  private List<TenantRecord> loadAll() {
    var byCode = new LinkedHashMap<String, TenantRecord>();
    RuntimeException relationalFailure = null;
    try {
      tenantRepository.findAll().stream()
          .map(TenantRecordMapper::toRecord)
          .forEach(t -> byCode.put(t.id(), t));
    } catch (DataAccessException e) {
      relationalFailure = e;
      log.warn("Relational tenant listing failed: error={}", e.getMessage());
    }
    try {
      store
          .getByPrefix(StoreKeys.TENANT_PREFIX, TenantRecord.class)
          .forEach(t -> byCode.put(t.id(), t));
    } catch (KeyValueStoreException e) {
      log.warn("Fast-store tenant listing failed: error={}", e.getMessage());
      if (relationalFailure != null) {
        throw new BackendUnavailableException("Tenants could not be listed from either store", e);
      }
    }
    return new ArrayList<>(byCode.values());
  }

  private TenantRecord rebuild(
      TenantRecord current,
      String name,
      TenantStatus status,
      BigDecimal mrr,
      String email,
      String phone,
      TenantChanges changes) {
    var settings =
        TenantRecordMapper.mergeSettings(TenantRecordMapper.toSettings(current), changes);
    return TenantRecordMapper.fromParts(
        current.uuid(),
        name,
        status,
        mrr,
        email,
        phone,
        settings,
        current.createdAt(),
        now());
  }

  private void persist(TenantRecord updated, TenantChanges changes) {
    store.set(StoreKeys.tenant(updated.id()), updated);
    if (updated.uuid() == null) {
      return;
    }
    BestEffort.run(
        "relational sync of tenant " + updated.id(),
        () ->
            tenantRepository
                .findById(updated.uuid())
                .ifPresentOrElse(
                    entity -> {
                      entity.apply(
                          updated.name(),
                          updated.status(),
                          updated.mrr(),
                          updated.email(),
                          updated.phone(),
                          TenantRecordMapper.mergeSettings(entity.getSettings(), changes),
                          updated.updatedAt());
                      tenantRepository.save(entity);
                    },
                    () ->
                        log.warn(
                            "Relational row missing during sync: code={}, uuid={}",
                            updated.id(),
                            updated.uuid())));
  }

  private void audit(String action, TenantRecord tenant, Object before, Object after) {
    BestEffort.run(
        "audit " + action,
        () ->
            auditService.log(
                AuditLogBuilder.builder()
                    .action(action)
                    .resourceType("tenant")
                    .resourceId(tenant.id())
                    .tenantId(tenant.id())
                    .before(before)
                    .after(after)
                    .build()));
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MICROS);
  }

  private static long codeNumber(TenantRecord tenant) {
    String id = tenant.id();
    if (id != null && id.startsWith(ExternalCodeAllocator.CODE_PREFIX)) {
      try {
        return Long.parseLong(id.substring(ExternalCodeAllocator.CODE_PREFIX.length()));
      } catch (NumberFormatException e) {
        return Long.MAX_VALUE;
      }
    }
    return Long.MAX_VALUE;
  }
}
