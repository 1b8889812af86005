package com.parish.governance.domain.services;

import com.parish.governance.domain.model.AuditLogQuery;
import com.parish.governance.domain.model.AuditLogRecord;
import com.parish.governance.domain.model.PageRequest;
import com.parish.governance.domain.model.PageResult;
import com.parish.governance.domain.ports.AuditLogRepository;
import com.parish.security.BadRequestException;
import com.parish.security.NotFoundException;
import com.parish.security.audit.AuditAction;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Read access to the audit trail for platform administrators. */
@Service
public class AuditLogService {

    private final AuditLogRepository auditLogs;

    public AuditLogService(AuditLogRepository auditLogs) {
        this.auditLogs = auditLogs;
    }

    @Transactional(readOnly = true)
    public PageResult<AuditLogRecord> list(AuditLogQuery query, PageRequest page) {
        if (query.from() != null && query.to() != null && query.from().isAfter(query.to())) {
            throw new BadRequestException("from must not be after to.");
        }
        return auditLogs.find(query, page);
    }

    @Transactional(readOnly = true)
    public PageResult<AuditLogRecord> listImpersonations(AuditLogQuery query, PageRequest page) {
        return list(query.withActionPrefix(AuditAction.IMPERSONATION_PREFIX), page);
    }

    @Transactional(readOnly = true)
    public AuditLogRecord get(String id) {
        return auditLogs.findById(id).orElseThrow(() -> NotFoundException.of("Audit entry", id));
    }
}
