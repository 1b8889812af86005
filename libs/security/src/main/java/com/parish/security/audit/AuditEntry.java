package com.parish.security.audit;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One append-only audit record.
 *
 * @param tenantId   affected tenant, null for platform-scope events
 * @param action     what happened
 * @param resource   kind of resource affected (e.g. "Branch", "User")
 * @param details    structured details, already redacted
 * @param actorEmail email of the person who performed the action
 * @param createdAt  when the entry was recorded
 */
public record AuditEntry(
        String tenantId,
        AuditAction action,
        String resource,
        Map<String, Object> details,
        String actorEmail,
        Instant createdAt
) {

    public AuditEntry {
        if (action == null) {
            throw new IllegalArgumentException("action must not be null");
        }
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("resource must not be null or blank");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt must not be null");
        }
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
