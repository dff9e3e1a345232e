package io.b2mash.hms.hmsadmin.common;

import io.b2mash.hms.hmsadmin.exception.InvalidStateException;

public record SortSpec(String field, Direction direction) {

  public enum Direction {
    ASC,
    DESC
  }

  /** Parses request parameters; returns {@code null} when no sort field was requested. */
  public static SortSpec parse(String field, String order) {
    if (field == null || field.isBlank()) {
      return null;
    }
    if (order == null || order.isBlank() || order.equalsIgnoreCase("asc")) {
      return new SortSpec(field, Direction.ASC);
    }
    if (order.equalsIgnoreCase("desc")) {
      return new SortSpec(field, Direction.DESC);
    }
    throw new InvalidStateException("Invalid sort order", "Sort order must be 'asc' or 'desc'");
  }
}
