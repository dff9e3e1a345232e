package io.b2mash.hms.hmsadmin.tenant;

import io.b2mash.hms.hmsadmin.plan.PlanName;
import java.time.Instant;
import java.util.HashMap;
import java.util.UUID;

/** Builds relational tenant rows for tests. */
final class TenantFixtures {

  static final Instant CREATED_AT = Instant.parse("2024-05-01T09:00:00Z");

  private TenantFixtures() {}

  static Tenant entity(String code, String name, PlanName plan, TenantStatus status) {
    var settings = new HashMap<String, Object>();
    settings.put(TenantRecordMapper.EXTERNAL_ID, code);
    settings.put(TenantRecordMapper.PLAN, plan.displayName());
    settings.put(TenantRecordMapper.SUBDOMAIN, name.toLowerCase().replace(' ', '-'));
    return new Tenant(
        UUID.randomUUID(),
        name,
        status,
        plan.defaultMrr(),
        "ops@" + code.toLowerCase() + ".example",
        null,
        settings,
        CREATED_AT);
  }

  static TenantRecord record(String code, String name, PlanName plan, TenantStatus status) {
    return TenantRecordMapper.toRecord(entity(code, name, plan, status));
  }
}
