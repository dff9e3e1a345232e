package io.b2mash.hms.hmsadmin.tenant;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TenantRepository extends JpaRepository<Tenant, UUID> {

  /** Looks up a tenant by the external code stored in {@code settings->>'external_id'}. */
  @Query(
      value = "SELECT * FROM tenants WHERE settings->>'external_id' = :externalId",
      nativeQuery = true)
  Optional<Tenant> findByExternalId(@Param("externalId") String externalId);
}
