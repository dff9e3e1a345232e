package io.b2mash.hms.hmsadmin.usage;

import io.b2mash.hms.hmsadmin.kvstore.KeyPrefixStore;
import io.b2mash.hms.hmsadmin.kvstore.StoreKeys;
import io.b2mash.hms.hmsadmin.plan.PlanName;
import io.b2mash.hms.hmsadmin.plan.PlanService;
import io.b2mash.hms.hmsadmin.tenant.TenantRecord;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

/**
 * Per-tenant, per-metric, per-month usage counters kept in the fast store.
 *
 * <p>The period defaults to the current UTC month of the injected {@link Clock}, evaluated once at
 * the start of each call. Rollover needs no job: the first write after a month boundary simply
 * lands on a new key.
 *
 * <p>Limits are sticky. A record's limit is derived from the tenant's plan when the record is first
 * written and is left alone by later writes, even after a plan change. {@link #summarize} is the
 * one path that re-derives limits and rewrites records that drifted.
 */
@Service
@EnableConfigurationProperties(UsageProperties.class)
public class UsageLedger {

  private static final Logger log = LoggerFactory.getLogger(UsageLedger.class);

  private static final Comparator<UsageRecord> DISPLAY_ORDER =
      Comparator.comparingInt(
              (UsageRecord r) -> {
                int index = UsageMetrics.DEFAULTS.indexOf(r.metric());
                return index >= 0 ? index : UsageMetrics.DEFAULTS.size();
              })
          .thenComparing(UsageRecord::metric);

  private final KeyPrefixStore store;
  private final PlanService planService;
  private final UsageProperties properties;
  private final Clock clock;

  public UsageLedger(
      KeyPrefixStore store, PlanService planService, UsageProperties properties, Clock clock) {
    this.store = store;
    this.planService = planService;
    this.properties = properties;
    this.clock = clock;
  }

  public Optional<UsageRecord> get(String tenantId, String metric) {
    return get(tenantId, metric, null);
  }

  public Optional<UsageRecord> get(String tenantId, String metric, String period) {
    return store.get(
        StoreKeys.usage(tenantId, periodOrCurrent(period), UsageMetrics.requireValid(metric)),
        UsageRecord.class);
  }

  public UsageRecord record(String tenantId, String metric, long value, long limit) {
    return record(tenantId, metric, value, limit, null);
  }

  /**
   * Overwrites the counter with {@code value} and {@code limit}, stamping today's date into the
   * daily breakdown (a second write on the same day replaces the first).
   */
  public UsageRecord record(String tenantId, String metric, long value, long limit, String period) {
    LocalDate today = LocalDate.now(clock);
    String effectivePeriod =
        period != null ? BillingPeriods.requireValid(period) : BillingPeriods.of(today);
    String key = StoreKeys.usage(tenantId, effectivePeriod, UsageMetrics.requireValid(metric));

    var daily = new HashMap<String, Long>();
    store.get(key, UsageRecord.class).ifPresent(existing -> daily.putAll(existing.daily()));
    daily.put(today.toString(), value);

    var record =
        new UsageRecord(
            key,
            tenantId,
            metric,
            effectivePeriod,
            value,
            limit,
            UsageRecord.percentageOf(value, limit),
            daily,
            clock.instant());
    store.set(key, record);
    log.debug(
        "Recorded usage: tenant={}, metric={}, period={}, current={}, limit={}",
        tenantId,
        metric,
        effectivePeriod,
        value,
        limit);
    return record;
  }

  public UsageRecord increment(String tenantId, String metric, long amount, long limit) {
    return increment(tenantId, metric, amount, limit, null);
  }

  /**
   * Adds {@code amount} to the counter. This reads the current value and writes the new total with
   * no compare-and-set, so two concurrent increments of the same key can lose one update.
   */
  public UsageRecord increment(
      String tenantId, String metric, long amount, long limit, String period) {
    String effectivePeriod = periodOrCurrent(period);
    long current = get(tenantId, metric, effectivePeriod).map(UsageRecord::current).orElse(0L);
    return record(tenantId, metric, current + amount, limit, effectivePeriod);
  }

  public boolean isOverLimit(String tenantId, String metric) {
    return isOverLimit(tenantId, metric, null);
  }

  /** {@code current >= limit}; false when nothing has been recorded. */
  public boolean isOverLimit(String tenantId, String metric, String period) {
    return get(tenantId, metric, period).map(r -> r.current() >= r.limit()).orElse(false);
  }

  /** Increments, deriving the limit from the tenant's plan only if the record is new. */
  public UsageRecord track(TenantRecord tenant, String metric, long amount) {
    String period = BillingPeriods.current(clock);
    var existing = get(tenant.id(), metric, period);
    long limit =
        existing.map(UsageRecord::limit).orElseGet(() -> limitFor(tenant.plan(), metric));
    long current = existing.map(UsageRecord::current).orElse(0L);
    return record(tenant.id(), metric, current + amount, limit, period);
  }

  /** Overwrites the value, keeping the existing limit or deriving it on first write. */
  public UsageRecord set(TenantRecord tenant, String metric, long value) {
    String period = BillingPeriods.current(clock);
    long limit =
        get(tenant.id(), metric, period)
            .map(UsageRecord::limit)
            .orElseGet(() -> limitFor(tenant.plan(), metric));
    return record(tenant.id(), metric, value, limit, period);
  }

  /**
   * Summary of every metric of the period. Limits are re-derived from the tenant's current plan
   * and records whose stored limit differs are rewritten; default metrics with no record are
   * seeded at zero. Default metrics come first, then any others alphabetically.
   */
  public UsageSummary summarize(TenantRecord tenant, String period) {
    String effectivePeriod = periodOrCurrent(period);
    Instant now = clock.instant();
    Map<String, Long> planLimits = planService.limitsFor(tenant.plan());

    var byMetric = new LinkedHashMap<String, UsageRecord>();
    for (UsageRecord record : listForPeriod(tenant.id(), effectivePeriod)) {
      byMetric.put(record.metric(), record);
    }

    for (String metric : UsageMetrics.DEFAULTS) {
      if (!byMetric.containsKey(metric)) {
        long limit = reconciledLimit(planLimits, metric, properties.defaultLimit());
        String key = StoreKeys.usage(tenant.id(), effectivePeriod, metric);
        var seeded =
            new UsageRecord(
                key,
                tenant.id(),
                metric,
                effectivePeriod,
                0,
                limit,
                UsageRecord.percentageOf(0, limit),
                Map.of(),
                now);
        store.set(key, seeded);
        byMetric.put(metric, seeded);
      }
    }

    var reconciled = new ArrayList<UsageRecord>(byMetric.size());
    for (UsageRecord record : byMetric.values()) {
      long limit = reconciledLimit(planLimits, record.metric(), record.limit());
      if (limit != record.limit()) {
        log.info(
            "Reconciled usage limit: tenant={}, metric={}, period={}, from={}, to={}",
            tenant.id(),
            record.metric(),
            effectivePeriod,
            record.limit(),
            limit);
        record = record.withLimit(limit, now);
        store.set(record.id(), record);
      }
      reconciled.add(record);
    }

    reconciled.sort(DISPLAY_ORDER);
    return new UsageSummary(
        tenant.id(),
        tenant.plan().displayName(),
        effectivePeriod,
        reconciled.stream().map(UsageSummary.UsageLine::of).toList());
  }

  /** Sets {@code current} to zero on every record of the period; returns how many were reset. */
  public int reset(String tenantId, String period) {
    String effectivePeriod = periodOrCurrent(period);
    Instant now = clock.instant();
    var entries = new LinkedHashMap<String, UsageRecord>();
    listForPeriod(tenantId, effectivePeriod)
        .forEach(r -> entries.put(r.id(), r.withCurrent(0, now)));
    store.mset(entries);
    log.info(
        "Reset usage: tenant={}, period={}, records={}", tenantId, effectivePeriod, entries.size());
    return entries.size();
  }

  /** Removes every record of the period; returns how many were removed. */
  public int delete(String tenantId, String period) {
    String effectivePeriod = periodOrCurrent(period);
    var keys = listForPeriod(tenantId, effectivePeriod).stream().map(UsageRecord::id).toList();
    store.mdel(keys);
    log.info(
        "Deleted usage: tenant={}, period={}, records={}", tenantId, effectivePeriod, keys.size());
    return keys.size();
  }

  /** Removes every usage record of the tenant across all periods. */
  public int purge(String tenantId) {
    var keys =
        store.getByPrefix(StoreKeys.usageTenantPrefix(tenantId), UsageRecord.class).stream()
            .map(UsageRecord::id)
            .toList();
    store.mdel(keys);
    log.info("Purged usage: tenant={}, records={}", tenantId, keys.size());
    return keys.size();
  }

  public List<UsageRecord> listForPeriod(String tenantId, String period) {
    return store.getByPrefix(
        StoreKeys.usagePeriodPrefix(tenantId, periodOrCurrent(period)), UsageRecord.class);
  }

  public List<UsageRecord> listAll() {
    return store.getByPrefix(StoreKeys.USAGE_PREFIX, UsageRecord.class);
  }

  /** Every stored usage alert, or only those of {@code tenantId} when it is given. */
  public List<UsageAlert> listAlerts(String tenantId) {
    String prefix =
        tenantId != null ? StoreKeys.alertTenantPrefix(tenantId) : StoreKeys.ALERT_PREFIX;
    return store.getByPrefix(prefix, UsageAlert.class);
  }

  /** Plan limit for {@code metric}, or the configured default when the plan does not list it. */
  public long limitFor(PlanName plan, String metric) {
    Long limit = planService.limitsFor(plan).get(metric);
    return limit != null ? limit : properties.defaultLimit();
  }

  public String currentPeriod() {
    return BillingPeriods.current(clock);
  }

  private String periodOrCurrent(String period) {
    return period != null ? BillingPeriods.requireValid(period) : BillingPeriods.current(clock);
  }

  /** The plan's limit when it declares a positive one, otherwise {@code fallback}. */
  private static long reconciledLimit(Map<String, Long> planLimits, String metric, long fallback) {
    Long planLimit = planLimits.get(metric);
    return planLimit != null && planLimit > 0 ? planLimit : fallback;
  }
}
