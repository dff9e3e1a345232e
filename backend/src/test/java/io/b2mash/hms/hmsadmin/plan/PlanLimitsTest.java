package io.b2mash.hms.hmsadmin.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.hms.hmsadmin.exception.InvalidStateException;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PlanLimitsTest {

  @Test
  void defaultsFor_eachTierHasFullProfile() {
    assertThat(PlanLimits.defaultsFor(PlanName.TRIAL))
        .containsEntry("rooms", 10L)
        .containsEntry("users", 3L)
        .containsEntry("properties", 1L)
        .containsEntry("api_calls", 1_000L)
        .containsEntry("storage", 1L);
    assertThat(PlanLimits.defaultsFor(PlanName.ENTERPRISE))
        .containsEntry("rooms", 50L)
        .containsEntry("api_calls", 999_999L)
        .containsEntry("storage", 500L);
  }

  @Test
  void defaultsFor_nullPlan_isTrial() {
    assertThat(PlanLimits.defaultsFor(null)).isEqualTo(PlanLimits.defaultsFor(PlanName.TRIAL));
  }

  @Test
  void normalize_foldsCamelCaseApiCallsAndParsesNumbers() {
    var raw = new LinkedHashMap<String, Object>();
    raw.put("rooms", 30);
    raw.put("apiCalls", "5000");
    raw.put("storage", 12.0);
    raw.put("notes", "unlimited");

    assertThat(PlanLimits.normalize(raw))
        .containsExactly(
            Map.entry("rooms", 30L), Map.entry("api_calls", 5_000L), Map.entry("storage", 12L));
  }

  @Test
  void normalize_explicitSnakeCaseWinsOverAlias() {
    var raw = new LinkedHashMap<String, Object>();
    raw.put("api_calls", 200);
    raw.put("apiCalls", 999);

    assertThat(PlanLimits.normalize(raw)).containsEntry("api_calls", 200L).hasSize(1);
  }

  @Test
  void normalize_null_isEmpty() {
    assertThat(PlanLimits.normalize(null)).isEmpty();
  }

  @Test
  void planName_parsesDisplayOrConstantNameCaseInsensitively() {
    assertThat(PlanName.fromValue("pro")).contains(PlanName.PRO);
    assertThat(PlanName.fromValue("ENTERPRISE")).contains(PlanName.ENTERPRISE);
    assertThat(PlanName.fromValueOrTrial("platinum")).isEqualTo(PlanName.TRIAL);
    assertThat(PlanName.BASIC.defaultMrr()).isEqualByComparingTo(BigDecimal.valueOf(99));
    assertThatThrownBy(() -> PlanName.parse("platinum"))
        .isInstanceOf(InvalidStateException.class);
  }
}
