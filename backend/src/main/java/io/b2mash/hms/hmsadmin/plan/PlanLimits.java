package io.b2mash.hms.hmsadmin.plan;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/** Default per-plan limit profiles and normalization of stored limit tables. */
public final class PlanLimits {

  static final String API_CALLS_ALIAS = "apiCalls";
  static final String API_CALLS = "api_calls";

  private static final Map<PlanName, Map<String, Long>> DEFAULTS = new EnumMap<>(PlanName.class);

  static {
    DEFAULTS.put(PlanName.TRIAL, profile(10, 3, 1, 1_000, 1));
    DEFAULTS.put(PlanName.BASIC, profile(25, 5, 1, 10_000, 10));
    DEFAULTS.put(PlanName.PRO, profile(35, 10, 2, 100_000, 50));
    DEFAULTS.put(PlanName.ENTERPRISE, profile(50, 15, 3, 999_999, 500));
  }

  private PlanLimits() {}

  public static Map<String, Long> defaultsFor(PlanName plan) {
    return DEFAULTS.get(plan != null ? plan : PlanName.TRIAL);
  }

  /**
   * Converts a stored limit table to {@code metric -> limit}. Non-numeric values are dropped and
   * {@code apiCalls} is folded into {@code api_calls} (an explicit {@code api_calls} wins).
   */
  public static Map<String, Long> normalize(Map<String, ?> raw) {
    var normalized = new LinkedHashMap<String, Long>();
    if (raw == null) {
      return normalized;
    }
    raw.forEach(
        (metric, value) -> {
          Long limit = toLong(value);
          if (limit == null) {
            return;
          }
          if (API_CALLS_ALIAS.equals(metric)) {
            normalized.putIfAbsent(API_CALLS, limit);
          } else {
            normalized.put(metric, limit);
          }
        });
    return normalized;
  }

  private static Long toLong(Object value) {
    if (value instanceof Number number) {
      return number.longValue();
    }
    if (value instanceof String text) {
      try {
        return Long.parseLong(text.trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  private static Map<String, Long> profile(
      long rooms, long users, long properties, long apiCalls, long storage) {
    var limits = new LinkedHashMap<String, Long>();
    limits.put("rooms", rooms);
    limits.put("users", users);
    limits.put("properties", properties);
    limits.put(API_CALLS, apiCalls);
    limits.put("storage", storage);
    return Map.copyOf(limits);
  }
}
