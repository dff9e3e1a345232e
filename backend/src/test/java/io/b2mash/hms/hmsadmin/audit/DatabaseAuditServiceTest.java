package io.b2mash.hms.hmsadmin.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

import io.b2mash.hms.hmsadmin.testutil.MutableClock;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tools.jackson.databind.json.JsonMapper;

@ExtendWith(MockitoExtension.class)
class DatabaseAuditServiceTest {

  record Snapshot(String name, long priceCents, List<String> features) {}

  @Mock private AuditLogRepository auditLogRepository;

  private MutableClock clock;
  private DatabaseAuditService service;

  @BeforeEach
  void setUp() {
    clock = MutableClock.at("2024-05-15T10:00:00Z");
    service = new DatabaseAuditService(auditLogRepository, JsonMapper.builder().build(), clock);
  }

  @Test
  void log_convertsStatesToMapsAndStampsTime() {
    service.log(
        new AuditLogRecord(
            "plan.updated",
            "plan",
            "Pro",
            null,
            "internal-service",
            new Snapshot("Pro", 29_900, List.of("loyalty")),
            new Snapshot("Pro", 24_900, List.of("loyalty"))));

    var captor = ArgumentCaptor.forClass(AuditLogEntry.class);
    verify(auditLogRepository).save(captor.capture());
    var entry = captor.getValue();
    assertThat(entry.getAction()).isEqualTo("plan.updated");
    assertThat(entry.getActor()).isEqualTo("internal-service");
    assertThat(entry.getBeforeState()).containsEntry("name", "Pro").containsKey("features");
    assertThat(((Number) entry.getBeforeState().get("priceCents")).longValue()).isEqualTo(29_900L);
    assertThat(((Number) entry.getAfterState().get("priceCents")).longValue()).isEqualTo(24_900L);
    assertThat(entry.getOccurredAt()).isEqualTo(clock.instant());
  }

  @Test
  void log_nullStates_storedAsNull() {
    service.log(new AuditLogRecord("tenant.deleted", "tenant", "T-1", "T-1", "system", null, null));

    var captor = ArgumentCaptor.forClass(AuditLogEntry.class);
    verify(auditLogRepository).save(captor.capture());
    assertThat(captor.getValue().getBeforeState()).isNull();
    assertThat(captor.getValue().getAfterState()).isNull();
  }
}
