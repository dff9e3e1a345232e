package io.b2mash.hms.hmsadmin.usage;

import io.b2mash.hms.hmsadmin.exception.InvalidStateException;
import java.util.List;
import java.util.regex.Pattern;

/** Metric names known to the ledger and their display units. */
public final class UsageMetrics {

  public static final String ROOMS = "rooms";
  public static final String USERS = "users";
  public static final String PROPERTIES = "properties";
  public static final String API_CALLS = "api_calls";
  public static final String STORAGE = "storage";

  /** Seeded into every usage summary, in display order. */
  public static final List<String> DEFAULTS = List.of(ROOMS, USERS, PROPERTIES, API_CALLS, STORAGE);

  private static final Pattern NAME = Pattern.compile("^[a-z][a-z0-9_]{0,63}$");

  private UsageMetrics() {}

  public static String unitOf(String metric) {
    if (STORAGE.equals(metric)) {
      return "GB";
    }
    if (API_CALLS.equals(metric)) {
      return "/month";
    }
    return "";
  }

  /** Metric names become key segments, so they are restricted to {@code [a-z0-9_]}. */
  public static String requireValid(String metric) {
    if (metric == null || !NAME.matcher(metric).matches()) {
      throw new InvalidStateException(
          "Invalid metric",
          "Metric names use lowercase letters, digits and underscores, got '" + metric + "'");
    }
    return metric;
  }
}
