package io.b2mash.hms.hmsadmin.feature;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.b2mash.hms.hmsadmin.exception.InvalidStateException;
import java.util.Arrays;

public enum FlagStatus {
  ENABLED,
  DISABLED,
  BETA;

  @JsonValue
  public String value() {
    return name().toLowerCase();
  }

  @JsonCreator
  public static FlagStatus parse(String value) {
    return Arrays.stream(values())
        .filter(s -> s.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(
            () ->
                new InvalidStateException("Invalid flag status", "Unknown status '" + value + "'"));
  }
}
