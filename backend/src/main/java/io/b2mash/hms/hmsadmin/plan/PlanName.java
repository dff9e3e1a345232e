package io.b2mash.hms.hmsadmin.plan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.b2mash.hms.hmsadmin.exception.InvalidStateException;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Optional;

/** Subscription tiers a tenant can be on. Serialized by display name ({@code "Pro"}). */
public enum PlanName {
  TRIAL("Trial", 0),
  BASIC("Basic", 99),
  PRO("Pro", 299),
  ENTERPRISE("Enterprise", 999);

  private final String displayName;
  private final BigDecimal defaultMrr;

  PlanName(String displayName, int defaultMrr) {
    this.displayName = displayName;
    this.defaultMrr = BigDecimal.valueOf(defaultMrr);
  }

  @JsonValue
  public String displayName() {
    return displayName;
  }

  /** Monthly recurring revenue assigned to a tenant created on this plan. */
  public BigDecimal defaultMrr() {
    return defaultMrr;
  }

  /** Case-insensitive lookup by display name or constant name. */
  public static Optional<PlanName> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    return Arrays.stream(values())
        .filter(p -> p.displayName.equalsIgnoreCase(trimmed) || p.name().equalsIgnoreCase(trimmed))
        .findFirst();
  }

  /** Unknown or missing names resolve to {@link #TRIAL}. */
  public static PlanName fromValueOrTrial(String value) {
    return fromValue(value).orElse(TRIAL);
  }

  @JsonCreator
  public static PlanName parse(String value) {
    return fromValue(value)
        .orElseThrow(
            () ->
                new InvalidStateException(
                    "Invalid plan",
                    "Unknown plan '" + value + "'; expected one of Trial, Basic, Pro, Enterprise"));
  }
}
