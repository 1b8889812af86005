package com.parish.governance.domain.ports;

import com.parish.governance.domain.model.AuditLogQuery;
import com.parish.governance.domain.model.AuditLogRecord;
import com.parish.governance.domain.model.PageRequest;
import com.parish.governance.domain.model.PageResult;
import java.util.Optional;

/**
 * Read side of the audit trail. Writes go through
 * {@link com.parish.security.audit.AuditSink}.
 */
public interface AuditLogRepository {

    /** Newest first. */
    PageResult<AuditLogRecord> find(AuditLogQuery query, PageRequest page);

    Optional<AuditLogRecord> findById(String id);
}
