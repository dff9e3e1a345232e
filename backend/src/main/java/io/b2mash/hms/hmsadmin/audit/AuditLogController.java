package io.b2mash.hms.hmsadmin.audit;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/audit-logs")
public class AuditLogController {

  private static final int MAX_PAGE_SIZE = 200;

  private final AuditService auditService;

  public AuditLogController(AuditService auditService) {
    this.auditService = auditService;
  }

  @GetMapping
  public ResponseEntity<Page<AuditLogResponse>> listAuditLogs(
      @RequestParam(required = false) String resourceType,
      @RequestParam(required = false) String resourceId,
      @RequestParam(required = false) String tenantId,
      @RequestParam(required = false) String action,
      @RequestParam(required = false) Instant from,
      @RequestParam(required = false) Instant to,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "50") int size) {

    var filter = new AuditLogFilter(resourceType, resourceId, tenantId, action, from, to);
    var pageable =
        PageRequest.of(
            Math.max(page, 0),
            Math.min(Math.max(size, 1), MAX_PAGE_SIZE),
            Sort.by(Sort.Direction.DESC, "occurredAt"));

    return ResponseEntity.ok(
        auditService.findEntries(filter, pageable).map(AuditLogResponse::from));
  }

  public record AuditLogResponse(
      UUID id,
      String action,
      String resourceType,
      String resourceId,
      String tenantId,
      String actor,
      Map<String, Object> beforeState,
      Map<String, Object> afterState,
      Instant occurredAt) {

    public static AuditLogResponse from(AuditLogEntry entry) {
      return new AuditLogResponse(
          entry.getId(),
          entry.getAction(),
          entry.getResourceType(),
          entry.getResourceId(),
          entry.getTenantId(),
          entry.getActor(),
          entry.getBeforeState(),
          entry.getAfterState(),
          entry.getOccurredAt());
    }
  }
}
