package com.parish.governance.domain.model;

import java.time.Instant;
import java.util.Map;

/**
 * A stored audit entry as read back by platform administrators.
 */
public record AuditLogRecord(
        String id,
        String tenantId,
        String action,
        String resource,
        Map<String, Object> details,
        String actorEmail,
        Instant createdAt) {
}
