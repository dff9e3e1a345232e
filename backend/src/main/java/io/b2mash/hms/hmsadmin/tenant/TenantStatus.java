package io.b2mash.hms.hmsadmin.tenant;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.b2mash.hms.hmsadmin.exception.InvalidStateException;
import java.util.Arrays;
import java.util.Optional;

/** Tenant lifecycle status. Serialized in lower case ({@code "active"}). */
public enum TenantStatus {
  ACTIVE,
  TRIAL,
  SUSPENDED,
  CANCELLED,
  PENDING;

  @JsonValue
  public String value() {
    return name().toLowerCase();
  }

  public static Optional<TenantStatus> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(s -> s.name().equalsIgnoreCase(value.trim())).findFirst();
  }

  @JsonCreator
  public static TenantStatus parse(String value) {
    return fromValue(value)
        .orElseThrow(
            () ->
                new InvalidStateException(
                    "Invalid tenant status", "Unknown tenant status '" + value + "'"));
  }
}
