package io.b2mash.hms.hmsadmin.tenant;

import io.b2mash.hms.hmsadmin.plan.PlanName;
import java.time.Instant;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Optional criteria for tenant listings. {@code search} matches name, subdomain, email and external
 * code, case-insensitively. {@code createdTo} is exclusive.
 */
public record TenantListFilter(
    TenantStatus status,
    PlanName plan,
    String region,
    String search,
    Instant createdFrom,
    Instant createdTo) {

  public static TenantListFilter none() {
    return new TenantListFilter(null, null, null, null, null, null);
  }

  public Predicate<TenantRecord> toPredicate() {
    Predicate<TenantRecord> predicate = t -> true;
    if (status != null) {
      predicate = predicate.and(t -> t.status() == status);
    }
    if (plan != null) {
      predicate = predicate.and(t -> t.plan() == plan);
    }
    if (region != null && !region.isBlank()) {
      predicate = predicate.and(t -> region.equalsIgnoreCase(t.region()));
    }
    if (search != null && !search.isBlank()) {
      String needle = search.trim().toLowerCase(Locale.ROOT);
      predicate =
          predicate.and(
              t ->
                  contains(t.name(), needle)
                      || contains(t.subdomain(), needle)
                      || contains(t.email(), needle)
                      || contains(t.id(), needle));
    }
    if (createdFrom != null) {
      predicate = predicate.and(t -> t.createdAt() != null && !t.createdAt().isBefore(createdFrom));
    }
    if (createdTo != null) {
      predicate = predicate.and(t -> t.createdAt() != null && t.createdAt().isBefore(createdTo));
    }
    return predicate;
  }

  private static boolean contains(String value, String needle) {
    return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
  }
}
