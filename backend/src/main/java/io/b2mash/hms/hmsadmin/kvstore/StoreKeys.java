package io.b2mash.hms.hmsadmin.kvstore;

/**
 * Key naming for the fast store. All keys are colon-delimited; prefix helpers end with the
 * separator so scans never run into a neighbouring identifier.
 */
public final class StoreKeys {

  public static final String SEPARATOR = ":";
  public static final String TENANT_PREFIX = "tenant:";
  public static final String USAGE_PREFIX = "usage:";
  public static final String FLAG_PREFIX = "flag:";
  public static final String ALERT_PREFIX = "alert:";
  public static final String TENANT_COUNTER = "system:tenant_counter";

  private StoreKeys() {}

  public static String tenant(String externalCode) {
    return TENANT_PREFIX + externalCode;
  }

  public static String usage(String tenantId, String period, String metric) {
    return usagePeriodPrefix(tenantId, period) + metric;
  }

  /** {@code usage:<tenantId>:} covering every period of one tenant. */
  public static String usageTenantPrefix(String tenantId) {
    return USAGE_PREFIX + tenantId + SEPARATOR;
  }

  /** {@code usage:<tenantId>:<period>:} covering every metric of one tenant and period. */
  public static String usagePeriodPrefix(String tenantId, String period) {
    return usageTenantPrefix(tenantId) + period + SEPARATOR;
  }

  public static String flag(String flagId) {
    return FLAG_PREFIX + flagId;
  }

  public static String alert(String tenantId, String alertId) {
    return alertTenantPrefix(tenantId) + alertId;
  }

  /** {@code alert:<tenantId>:} covering every alert of one tenant. */
  public static String alertTenantPrefix(String tenantId) {
    return ALERT_PREFIX + tenantId + SEPARATOR;
  }
}
