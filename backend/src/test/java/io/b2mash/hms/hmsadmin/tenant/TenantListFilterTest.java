package io.b2mash.hms.hmsadmin.tenant;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.hms.hmsadmin.plan.PlanName;
import java.time.Instant;
import java.util.Map;
import java.util.function.Predicate;
import org.junit.jupiter.api.Test;

class TenantListFilterTest {

  private final TenantRecord harbour =
      tenant(
          "T-1", "Harbour Hotel", PlanName.PRO, TenantStatus.ACTIVE, "eu", "2024-05-01T00:00:00Z");
  private final TenantRecord summit =
      tenant(
          "T-2", "Summit Lodge", PlanName.TRIAL, TenantStatus.TRIAL, "us", "2024-06-01T00:00:00Z");

  @Test
  void none_matchesEverything() {
    var predicate = TenantListFilter.none().toPredicate();

    assertThat(predicate.test(harbour)).isTrue();
    assertThat(predicate.test(summit)).isTrue();
  }

  @Test
  void statusPlanAndRegion_combineWithAnd() {
    var predicate =
        new TenantListFilter(TenantStatus.ACTIVE, PlanName.PRO, "EU", null, null, null)
            .toPredicate();

    assertThat(predicate.test(harbour)).isTrue();
    assertThat(predicate.test(summit)).isFalse();
  }

  @Test
  void search_matchesNameSubdomainEmailAndCode() {
    assertThat(filterBySearch("harb").test(harbour)).isTrue();
    assertThat(filterBySearch("summit-lodge").test(summit)).isTrue();
    assertThat(filterBySearch("OPS@T-2").test(summit)).isTrue();
    assertThat(filterBySearch("t-1").test(harbour)).isTrue();
    assertThat(filterBySearch("nowhere").test(harbour)).isFalse();
  }

  @Test
  void createdRange_isHalfOpen() {
    var predicate =
        new TenantListFilter(
                null,
                null,
                null,
                null,
                Instant.parse("2024-05-01T00:00:00Z"),
                Instant.parse("2024-06-01T00:00:00Z"))
            .toPredicate();

    assertThat(predicate.test(harbour)).isTrue();
    assertThat(predicate.test(summit)).isFalse();
  }

  private static Predicate<TenantRecord> filterBySearch(String search) {
    return new TenantListFilter(null, null, null, search, null, null).toPredicate();
  }

  private static TenantRecord tenant(
      String code,
      String name,
      PlanName plan,
      TenantStatus status,
      String region,
      String createdAt) {
    String subdomain = name.toLowerCase().replace(' ', '-');
    Instant created = Instant.parse(createdAt);
    return new TenantRecord(
        code,
        null,
        name,
        plan,
        status,
        plan.defaultMrr(),
        "ops@" + code.toLowerCase() + ".example",
        null,
        subdomain,
        region,
        name,
        null,
        null,
        Map.of(),
        created,
        created);
  }
}
