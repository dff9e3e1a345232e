package io.b2mash.hms.hmsadmin.security;

/** Granted authorities used by the security chain. */
public final class Roles {

  public static final String AUTHORITY_INTERNAL = "ROLE_INTERNAL_SERVICE";

  /** Principal name recorded as the actor of requests authenticated by API key. */
  public static final String INTERNAL_PRINCIPAL = "internal-service";

  private Roles() {}
}
