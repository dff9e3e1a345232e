package io.b2mash.hms.hmsadmin.tenant;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.hms.hmsadmin.plan.PlanName;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class TenantRecordMapperTest {

  private static final UUID ID = UUID.fromString("3f2b8c1e-9d4a-4b7e-8f00-1a2b3c4d5e6f");
  private static final Instant CREATED = Instant.parse("2024-05-01T08:00:00Z");

  @Test
  void fromParts_liftsSnakeCaseKeysAndKeepsRemainder() {
    var settings = new HashMap<String, Object>();
    settings.put("external_id", "T-5");
    settings.put("plan", "Pro");
    settings.put("subdomain", "harbour");
    settings.put("region", "eu-west");
    settings.put("billing_entity", "Harbour Hotels Ltd");
    settings.put("currency", "EUR");
    settings.put("theme", "dark");

    var record =
        TenantRecordMapper.fromParts(
            ID,
            "Harbour Hotel",
            TenantStatus.ACTIVE,
            new BigDecimal("299"),
            "ops@harbour.example",
            null,
            settings,
            CREATED,
            CREATED);

    assertThat(record.id()).isEqualTo("T-5");
    assertThat(record.uuid()).isEqualTo(ID);
    assertThat(record.plan()).isEqualTo(PlanName.PRO);
    assertThat(record.subdomain()).isEqualTo("harbour");
    assertThat(record.billingEntity()).isEqualTo("Harbour Hotels Ltd");
    assertThat(record.currency()).isEqualTo("EUR");
    assertThat(record.timezone()).isEqualTo(TenantRecord.DEFAULT_TIMEZONE);
    assertThat(record.mrr()).isEqualByComparingTo("299.00");
    assertThat(record.mrr().scale()).isEqualTo(2);
    assertThat(record.settings()).containsOnlyKeys("theme");
  }

  @Test
  void fromParts_readsCamelCaseAliases() {
    var settings =
        Map.<String, Object>of(
            "externalId", "T-6",
            "billingEntity", "Old Style Ltd",
            "tenantEmail", "legacy@example.com",
            "tenantPhone", "+44 20 0000 0000");

    var record =
        TenantRecordMapper.fromParts(
            ID, "Legacy", TenantStatus.TRIAL, null, null, null, settings, CREATED, CREATED);

    assertThat(record.id()).isEqualTo("T-6");
    assertThat(record.billingEntity()).isEqualTo("Old Style Ltd");
    assertThat(record.email()).isEqualTo("legacy@example.com");
    assertThat(record.phone()).isEqualTo("+44 20 0000 0000");
    assertThat(record.settings()).isEmpty();
  }

  @Test
  void fromParts_snakeCaseWinsOverAlias() {
    var settings =
        Map.<String, Object>of("billing_entity", "Current Ltd", "billingEntity", "Stale Ltd");

    var record =
        TenantRecordMapper.fromParts(
            ID, "Both", TenantStatus.ACTIVE, null, null, null, settings, CREATED, CREATED);

    assertThat(record.billingEntity()).isEqualTo("Current Ltd");
  }

  @Test
  void fromParts_missingExternalIdAndPlan_fallBackToUuidAndTrial() {
    var record =
        TenantRecordMapper.fromParts(
            ID, "Bare", null, null, null, null, null, CREATED, CREATED);

    assertThat(record.id()).isEqualTo(ID.toString());
    assertThat(record.plan()).isEqualTo(PlanName.TRIAL);
    assertThat(record.status()).isEqualTo(TenantStatus.ACTIVE);
    assertThat(record.mrr()).isEqualByComparingTo(BigDecimal.ZERO);
  }

  @Test
  void toSettings_thenFromParts_reproducesRecord() {
    var original =
        TenantRecordMapper.fromParts(
            ID,
            "Round",
            TenantStatus.SUSPENDED,
            new BigDecimal("99.5"),
            "a@b.example",
            "123",
            Map.of("external_id", "T-8", "plan", "Basic", "region", "us", "color", "blue"),
            CREATED,
            CREATED);

    var rebuilt =
        TenantRecordMapper.fromParts(
            original.uuid(),
            original.name(),
            original.status(),
            original.mrr(),
            original.email(),
            original.phone(),
            TenantRecordMapper.toSettings(original),
            original.createdAt(),
            original.updatedAt());

    assertThat(rebuilt).isEqualTo(original);
  }

  @Test
  void mergeSettings_nullValueRemovesKey_andExplicitFieldsOverride() {
    var current = Map.<String, Object>of("external_id", "T-1", "theme", "dark", "region", "eu");
    var extra = new HashMap<String, Object>();
    extra.put("theme", null);
    extra.put("locale", "fr");
    var changes =
        new TenantChanges(null, null, null, PlanName.BASIC, null, "us", null, null, null, extra);

    var merged = TenantRecordMapper.mergeSettings(current, changes);

    assertThat(merged)
        .containsEntry("external_id", "T-1")
        .containsEntry("locale", "fr")
        .containsEntry("region", "us")
        .containsEntry("plan", "Basic")
        .doesNotContainKey("theme");
  }

  @Test
  void mergeSettings_neverTakesExternalIdFromChanges() {
    var current = Map.<String, Object>of("external_id", "T-1");

    var merged =
        TenantRecordMapper.mergeSettings(
            current, TenantChanges.settingsOnly(Map.of("external_id", "T-99", "externalId", "X")));

    assertThat(merged).containsEntry("external_id", "T-1").doesNotContainKey("externalId");
  }

  @Test
  void mergeSettings_withoutCurrentExternalId_dropsInjectedOne() {
    var merged =
        TenantRecordMapper.mergeSettings(
            Map.of(), TenantChanges.settingsOnly(Map.of("external_id", "T-99")));

    assertThat(merged).doesNotContainKey("external_id");
  }

  @Test
  void mergeSettings_freeFormPlan_isIgnored() {
    var current = Map.<String, Object>of("external_id", "T-1", "plan", "Basic");

    var merged =
        TenantRecordMapper.mergeSettings(
            current, TenantChanges.settingsOnly(Map.of("plan", "Enterprise", "theme", "dark")));

    assertThat(merged).containsEntry("plan", "Basic").containsEntry("theme", "dark");
  }
}
