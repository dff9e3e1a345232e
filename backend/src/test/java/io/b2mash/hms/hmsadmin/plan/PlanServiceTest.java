package io.b2mash.hms.hmsadmin.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.hms.hmsadmin.audit.AuditService;
import io.b2mash.hms.hmsadmin.exception.ResourceConflictException;
import io.b2mash.hms.hmsadmin.exception.ResourceNotFoundException;
import io.b2mash.hms.hmsadmin.testutil.MutableClock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class PlanServiceTest {

  @Mock private PlanRepository planRepository;
  @Mock private AuditService auditService;

  private MutableClock clock;
  private PlanService service;

  @BeforeEach
  void setUp() {
    clock = MutableClock.at("2024-05-15T10:00:00Z");
    service = new PlanService(planRepository, auditService, clock);
  }

  @Test
  void createPlan_normalizesLimitsAndAudits() {
    when(planRepository.save(any(Plan.class))).thenAnswer(inv -> inv.getArgument(0));

    var plan =
        service.createPlan(definition("Pro", Map.of("rooms", 35, "apiCalls", 100_000), null));

    assertThat(plan.getName()).isEqualTo("Pro");
    assertThat(plan.isActive()).isTrue();
    assertThat(plan.getLimits()).containsEntry("rooms", 35L).containsEntry("api_calls", 100_000L);
    assertThat(plan.getCreatedAt()).isEqualTo(clock.instant());
    verify(auditService).log(argThat(r -> "plan.created".equals(r.action())));
  }

  @Test
  void createPlan_duplicateName_isConflict() {
    when(planRepository.existsByNameIgnoreCase("pro")).thenReturn(true);

    assertThatThrownBy(() -> service.createPlan(definition("pro", null, null)))
        .isInstanceOf(ResourceConflictException.class);
    verify(planRepository, never()).save(any());
  }

  @Test
  void createPlan_auditFailure_doesNotFailCreation() {
    when(planRepository.save(any(Plan.class))).thenAnswer(inv -> inv.getArgument(0));
    doThrow(new IllegalStateException("audit table locked")).when(auditService).log(any());

    var plan = service.createPlan(definition("Basic", null, false));

    assertThat(plan.isActive()).isFalse();
  }

  @Test
  void updatePlan_nullActive_keepsCurrentFlag() {
    var existing = plan("Basic", Map.of("rooms", 25L));
    when(planRepository.findByNameIgnoreCase("basic")).thenReturn(Optional.of(existing));
    when(planRepository.save(existing)).thenReturn(existing);

    var updated = service.updatePlan("basic", definition("Basic", Map.of("rooms", 30), null));

    assertThat(updated.isActive()).isTrue();
    assertThat(updated.getLimits()).containsEntry("rooms", 30L);
    verify(auditService).log(argThat(r -> "plan.updated".equals(r.action())));
  }

  @Test
  void getPlan_missing_throwsNotFound() {
    assertThatThrownBy(() -> service.getPlan("Platinum"))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void deletePlan_removesRow() {
    var existing = plan("Trial", null);
    when(planRepository.findByNameIgnoreCase("Trial")).thenReturn(Optional.of(existing));

    service.deletePlan("Trial");

    verify(planRepository).delete(existing);
  }

  @Test
  void limitsFor_storedTable_winsOverDefaults() {
    when(planRepository.findByNameIgnoreCase("Pro"))
        .thenReturn(Optional.of(plan("Pro", Map.of("rooms", 40, "apiCalls", 5))));

    assertThat(service.limitsFor(PlanName.PRO))
        .containsEntry("rooms", 40L)
        .containsEntry("api_calls", 5L)
        .doesNotContainKey("users");
  }

  @Test
  void limitsFor_emptyStoredTable_usesBuiltInProfile() {
    when(planRepository.findByNameIgnoreCase("Basic"))
        .thenReturn(Optional.of(plan("Basic", Map.of())));

    assertThat(service.limitsFor(PlanName.BASIC)).isEqualTo(PlanLimits.defaultsFor(PlanName.BASIC));
  }

  @Test
  void limitsFor_noPlanRow_usesBuiltInProfile() {
    assertThat(service.limitsFor(PlanName.ENTERPRISE))
        .isEqualTo(PlanLimits.defaultsFor(PlanName.ENTERPRISE));
  }

  @Test
  void limitsFor_databaseDown_usesBuiltInProfile() {
    when(planRepository.findByNameIgnoreCase("Trial"))
        .thenThrow(new DataAccessResourceFailureException("db down"));

    assertThat(service.limitsFor(null)).isEqualTo(PlanLimits.defaultsFor(PlanName.TRIAL));
  }

  private Plan plan(String name, Map<String, Object> limits) {
    return new Plan(name, null, 0, "month", 0, true, limits, List.of(), clock.instant());
  }

  private static PlanService.PlanDefinition definition(
      String name, Map<String, Object> limits, Boolean active) {
    return new PlanService.PlanDefinition(
        name, name + " tier", 9_900, "month", 0, active, limits, List.of("reservations"));
  }
}
