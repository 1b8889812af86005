package com.parish.governance.domain.model;

import java.time.Instant;

/**
 * Filters for audit log listings. Null fields do not filter.
 *
 * @param tenantId     exact tenant
 * @param action       substring of the action, ignoring case
 * @param actionPrefix exact action prefix (e.g. {@code IMPERSONATION_})
 * @param from         inclusive lower bound on creation time
 * @param to           inclusive upper bound on creation time
 * @param search       substring of action, resource or actor email, ignoring case
 */
public record AuditLogQuery(
        String tenantId,
        String action,
        String actionPrefix,
        Instant from,
        Instant to,
        String search) {

    public AuditLogQuery withActionPrefix(String prefix) {
        return new AuditLogQuery(tenantId, action, prefix, from, to, search);
    }
}
