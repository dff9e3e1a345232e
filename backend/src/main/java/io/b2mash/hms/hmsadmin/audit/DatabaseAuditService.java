package io.b2mash.hms.hmsadmin.audit;

import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/** {@link AuditService} backed by {@link AuditLogRepository}. */
@Service
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  private static final TypeReference<Map<String, Object>> STATE_TYPE = new TypeReference<>() {};

  private final AuditLogRepository auditLogRepository;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public DatabaseAuditService(
      AuditLogRepository auditLogRepository, ObjectMapper objectMapper, Clock clock) {
    this.auditLogRepository = auditLogRepository;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public void log(AuditLogRecord record) {
    var entry =
        new AuditLogEntry(
            record, snapshot(record.beforeState()), snapshot(record.afterState()), clock.instant());
    auditLogRepository.save(entry);
    log.debug(
        "Recorded audit entry: action={}, resource={}/{}, tenant={}, actor={}",
        record.action(),
        record.resourceType(),
        record.resourceId(),
        record.tenantId(),
        record.actor());
  }

  @Override
  @Transactional(readOnly = true)
  public Page<AuditLogEntry> findEntries(AuditLogFilter filter, Pageable pageable) {
    return auditLogRepository.findByFilter(
        filter.resourceType(),
        filter.resourceId(),
        filter.tenantId(),
        filter.actionPrefix(),
        filter.from(),
        filter.to(),
        pageable);
  }

  private Map<String, Object> snapshot(Object state) {
    if (state == null) {
      return null;
    }
    return objectMapper.convertValue(state, STATE_TYPE);
  }
}
