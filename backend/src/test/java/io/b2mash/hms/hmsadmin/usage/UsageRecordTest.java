package io.b2mash.hms.hmsadmin.usage;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class UsageRecordTest {

  @Test
  void percentageOf_roundsAndCapsAtHundred() {
    assertThat(UsageRecord.percentageOf(1, 3)).isEqualTo(33);
    assertThat(UsageRecord.percentageOf(2, 3)).isEqualTo(67);
    assertThat(UsageRecord.percentageOf(15, 10)).isEqualTo(100);
  }

  @Test
  void percentageOf_nonPositiveLimit() {
    assertThat(UsageRecord.percentageOf(0, 0)).isZero();
    assertThat(UsageRecord.percentageOf(1, 0)).isEqualTo(100);
    assertThat(UsageRecord.percentageOf(5, -1)).isEqualTo(100);
  }

  @Test
  void withLimit_recomputesPercentageAndKeepsDaily() {
    var record =
        new UsageRecord(
            "usage:T-1:2024-05:rooms",
            "T-1",
            "rooms",
            "2024-05",
            5,
            10,
            50,
            Map.of("2024-05-02", 5L),
            Instant.EPOCH);
    var later = Instant.parse("2024-05-03T00:00:00Z");

    var widened = record.withLimit(20, later);

    assertThat(widened.percentage()).isEqualTo(25);
    assertThat(widened.daily()).isEqualTo(record.daily());
    assertThat(widened.updatedAt()).isEqualTo(later);
    assertThat(record.withCurrent(0, later).percentage()).isZero();
  }
}
