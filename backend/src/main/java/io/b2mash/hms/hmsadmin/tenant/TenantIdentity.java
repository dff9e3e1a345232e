package io.b2mash.hms.hmsadmin.tenant;

/**
 * Outcome of {@link TenantResolver#resolve(String)}: the canonical tenant together with the backend
 * that produced it. An unresolved identity carries no tenant.
 */
public record TenantIdentity(String identifier, Source source, TenantRecord tenant) {

  public enum Source {
    UNRESOLVED,
    FAST_STORE,
    RELATIONAL
  }

  public static TenantIdentity unresolved(String identifier) {
    return new TenantIdentity(identifier, Source.UNRESOLVED, null);
  }

  public boolean isResolved() {
    return source != Source.UNRESOLVED;
  }
}
