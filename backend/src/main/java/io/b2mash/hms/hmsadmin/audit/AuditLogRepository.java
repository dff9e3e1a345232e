package io.b2mash.hms.hmsadmin.audit;

import java.time.Instant;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AuditLogRepository extends JpaRepository<AuditLogEntry, UUID> {

  /**
   * Nullable-parameter filter; each clause collapses to true when its parameter is null. Ordering
   * comes from the {@link Pageable}.
   */
  @Query(
      """
      SELECT e FROM AuditLogEntry e
      WHERE (CAST(:resourceType AS string) IS NULL OR e.resourceType = :resourceType)
        AND (CAST(:resourceId AS string) IS NULL OR e.resourceId = :resourceId)
        AND (CAST(:tenantId AS string) IS NULL OR e.tenantId = :tenantId)
        AND (CAST(:actionPrefix AS string) IS NULL
             OR e.action LIKE CONCAT(CAST(:actionPrefix AS string), '%'))
        AND (CAST(:from AS timestamp) IS NULL OR e.occurredAt >= :from)
        AND (CAST(:to AS timestamp) IS NULL OR e.occurredAt < :to)
      """)
  Page<AuditLogEntry> findByFilter(
      @Param("resourceType") String resourceType,
      @Param("resourceId") String resourceId,
      @Param("tenantId") String tenantId,
      @Param("actionPrefix") String actionPrefix,
      @Param("from") Instant from,
      @Param("to") Instant to,
      Pageable pageable);
}
