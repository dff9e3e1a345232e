package io.b2mash.hms.hmsadmin.feature;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.b2mash.hms.hmsadmin.exception.InvalidStateException;
import java.util.Arrays;

/** Administrative scope of a flag. {@code PLAN} flags are shown as plan-locked to tenants. */
public enum FlagScope {
  GLOBAL,
  PLAN,
  TENANT;

  @JsonValue
  public String value() {
    return name().toLowerCase();
  }

  @JsonCreator
  public static FlagScope parse(String value) {
    return Arrays.stream(values())
        .filter(s -> s.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(
            () -> new InvalidStateException("Invalid flag scope", "Unknown scope '" + value + "'"));
  }
}
