package io.b2mash.hms.hmsadmin.tenant;

import io.b2mash.hms.hmsadmin.plan.PlanName;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Translates between the relational layout (columns plus a nested {@code settings} bag) and the
 * flat {@link TenantRecord}. Lifted keys are written in snake case; the camel-case spellings found
 * in older rows are read as aliases.
 */
public final class TenantRecordMapper {

  static final String EXTERNAL_ID = "external_id";
  static final String PLAN = "plan";
  static final String SUBDOMAIN = "subdomain";
  static final String REGION = "region";
  static final String BILLING_ENTITY = "billing_entity";
  static final String TIMEZONE = "timezone";
  static final String CURRENCY = "currency";
  static final String TENANT_EMAIL = "tenant_email";
  static final String TENANT_PHONE = "tenant_phone";

  private static final Map<String, String> ALIASES =
      Map.of(
          "billingEntity", BILLING_ENTITY,
          "tenantEmail", TENANT_EMAIL,
          "tenantPhone", TENANT_PHONE,
          "externalId", EXTERNAL_ID);

  private static final List<String> LIFTED_KEYS =
      List.of(
          EXTERNAL_ID,
          PLAN,
          SUBDOMAIN,
          REGION,
          BILLING_ENTITY,
          TIMEZONE,
          CURRENCY,
          TENANT_EMAIL,
          TENANT_PHONE);

  private TenantRecordMapper() {}

  public static TenantRecord toRecord(Tenant tenant) {
    return fromParts(
        tenant.getId(),
        tenant.getName(),
        tenant.getStatus(),
        tenant.getMrr(),
        tenant.getEmail(),
        tenant.getPhone(),
        tenant.getSettings(),
        tenant.getCreatedAt(),
        tenant.getUpdatedAt());
  }

  /**
   * Builds a record from relational parts. The plan defaults to Trial, the external code falls back
   * to the UUID text, and the email and phone columns fall back to their settings copies.
   */
  public static TenantRecord fromParts(
      UUID uuid,
      String name,
      TenantStatus status,
      BigDecimal mrr,
      String email,
      String phone,
      Map<String, Object> settings,
      Instant createdAt,
      Instant updatedAt) {
    var normalized = canonicalKeys(settings);
    String externalId = text(normalized, EXTERNAL_ID);
    if (externalId == null && uuid != null) {
      externalId = uuid.toString();
    }
    var remainder = new TreeMap<>(normalized);
    LIFTED_KEYS.forEach(remainder::remove);

    return new TenantRecord(
        externalId,
        uuid,
        name,
        PlanName.fromValueOrTrial(text(normalized, PLAN)),
        status != null ? status : TenantStatus.ACTIVE,
        mrr,
        email != null ? email : text(normalized, TENANT_EMAIL),
        phone != null ? phone : text(normalized, TENANT_PHONE),
        text(normalized, SUBDOMAIN),
        text(normalized, REGION),
        text(normalized, BILLING_ENTITY),
        text(normalized, TIMEZONE),
        text(normalized, CURRENCY),
        remainder,
        createdAt,
        updatedAt);
  }

  /** Flattens a record back into the relational settings layout. Null attributes are omitted. */
  public static Map<String, Object> toSettings(TenantRecord record) {
    var settings = new HashMap<String, Object>(record.settings());
    putIfPresent(settings, EXTERNAL_ID, record.id());
    putIfPresent(settings, PLAN, record.plan().displayName());
    putIfPresent(settings, SUBDOMAIN, record.subdomain());
    putIfPresent(settings, REGION, record.region());
    putIfPresent(settings, BILLING_ENTITY, record.billingEntity());
    putIfPresent(settings, TIMEZONE, record.timezone());
    putIfPresent(settings, CURRENCY, record.currency());
    return settings;
  }

  /**
   * Applies {@code changes} on top of {@code current}. Explicit attributes are written to their
   * lifted keys, free-form entries are merged key by key (a null value removes the key). The
   * external code and the plan are never taken from the free-form entries.
   */
  public static Map<String, Object> mergeSettings(
      Map<String, Object> current, TenantChanges changes) {
    var merged = canonicalKeys(current);
    String externalId = text(merged, EXTERNAL_ID);

    if (changes.settings() != null) {
      for (var entry : changes.settings().entrySet()) {
        String key = ALIASES.getOrDefault(entry.getKey(), entry.getKey());
        // plan only moves through the typed field so price and MRR stay in step
        if (PLAN.equals(key)) {
          continue;
        }
        if (entry.getValue() == null) {
          merged.remove(key);
        } else {
          merged.put(key, entry.getValue());
        }
      }
    }
    putIfPresent(merged, PLAN, changes.plan() != null ? changes.plan().displayName() : null);
    putIfPresent(merged, SUBDOMAIN, changes.subdomain());
    putIfPresent(merged, REGION, changes.region());
    putIfPresent(merged, BILLING_ENTITY, changes.billingEntity());
    putIfPresent(merged, TIMEZONE, changes.timezone());
    putIfPresent(merged, CURRENCY, changes.currency());

    if (externalId != null) {
      merged.put(EXTERNAL_ID, externalId);
    } else {
      merged.remove(EXTERNAL_ID);
    }
    return merged;
  }

  private static HashMap<String, Object> canonicalKeys(Map<String, Object> settings) {
    var canonical = new HashMap<String, Object>();
    if (settings == null) {
      return canonical;
    }
    settings.forEach(
        (key, value) -> {
          String target = ALIASES.get(key);
          if (target == null) {
            canonical.put(key, value);
          } else if (!settings.containsKey(target)) {
            canonical.put(target, value);
          }
        });
    return canonical;
  }

  private static String text(Map<String, Object> settings, String key) {
    Object value = settings.get(key);
    if (value == null) {
      return null;
    }
    String text = Objects.toString(value);
    return text.isBlank() ? null : text;
  }

  private static void putIfPresent(Map<String, Object> settings, String key, String value) {
    if (value != null) {
      settings.put(key, value);
    }
  }
}
