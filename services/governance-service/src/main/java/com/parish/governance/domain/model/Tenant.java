package com.parish.governance.domain.model;

import java.time.Instant;

/**
 * @param id        tenant identifier
 * @param name      display name
 * @param status    billing status
 * @param planId    subscribed plan, may be null
 * @param createdAt creation time
 */
public record Tenant(String id, String name, TenantStatus status, String planId, Instant createdAt) {
}
