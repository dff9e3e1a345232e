package io.b2mash.hms.hmsadmin.tenant;

import java.util.EnumSet;
import java.util.Set;

/** Administrative lifecycle transitions and the statuses each may start from. */
public enum TenantStatusAction {
  SUSPEND(
      TenantStatus.SUSPENDED,
      "tenant.suspended",
      "suspended_at",
      EnumSet.of(TenantStatus.ACTIVE, TenantStatus.TRIAL, TenantStatus.PENDING)),
  UNSUSPEND(
      TenantStatus.ACTIVE,
      "tenant.unsuspended",
      "unsuspended_at",
      EnumSet.of(TenantStatus.SUSPENDED)),
  CANCEL(
      TenantStatus.CANCELLED,
      "tenant.cancelled",
      "cancelled_at",
      EnumSet.complementOf(EnumSet.of(TenantStatus.CANCELLED)));

  private final TenantStatus target;
  private final String auditAction;
  private final String timestampKey;
  private final Set<TenantStatus> allowedFrom;

  TenantStatusAction(
      TenantStatus target, String auditAction, String timestampKey, Set<TenantStatus> allowedFrom) {
    this.target = target;
    this.auditAction = auditAction;
    this.timestampKey = timestampKey;
    this.allowedFrom = allowedFrom;
  }

  public TenantStatus target() {
    return target;
  }

  public String auditAction() {
    return auditAction;
  }

  /** Settings key stamped with the transition time. */
  public String timestampKey() {
    return timestampKey;
  }

  public boolean isAllowedFrom(TenantStatus current) {
    return allowedFrom.contains(current);
  }
}
