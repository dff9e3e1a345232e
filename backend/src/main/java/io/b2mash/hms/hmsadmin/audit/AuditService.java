package io.b2mash.hms.hmsadmin.audit;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

/** Records and queries administrative audit entries. */
public interface AuditService {

  /**
   * Persists one entry in a transaction of its own, so a failing insert never marks the caller's
   * transaction rollback-only. Callers wrap this in {@code BestEffort.run}.
   */
  void log(AuditLogRecord record);

  /** Entries matching {@code filter}, ordered by {@code pageable}. */
  Page<AuditLogEntry> findEntries(AuditLogFilter filter, Pageable pageable);
}
