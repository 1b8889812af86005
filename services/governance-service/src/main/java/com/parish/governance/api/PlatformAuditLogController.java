package com.parish.governance.api;

import com.parish.governance.domain.model.AuditLogQuery;
import com.parish.governance.domain.model.AuditLogRecord;
import com.parish.governance.domain.model.PageRequest;
import com.parish.governance.domain.model.PageResult;
import com.parish.governance.domain.services.AuditLogService;
import com.parish.governance.infrastructure.web.PlatformAdminOnly;
import java.time.Instant;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/platform/audit-logs")
@PlatformAdminOnly
public class PlatformAuditLogController {

    private final AuditLogService auditLogService;

    public PlatformAuditLogController(AuditLogService auditLogService) {
        this.auditLogService = auditLogService;
    }

    @GetMapping
    public PageResult<AuditLogRecord> list(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String tenantId,
            @RequestParam(required = false) String action,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(required = false) String search) {
        return auditLogService.list(new AuditLogQuery(tenantId, action, null, from, to, search),
                PageRequest.of(page, limit));
    }

    @GetMapping("/impersonations")
    public PageResult<AuditLogRecord> impersonations(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String tenantId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(required = false) String search) {
        return auditLogService.listImpersonations(new AuditLogQuery(tenantId, null, null, from, to, search),
                PageRequest.of(page, limit));
    }

    @GetMapping("/{auditLogId}")
    public AuditLogRecord get(@PathVariable String auditLogId) {
        return auditLogService.get(auditLogId);
    }
}
