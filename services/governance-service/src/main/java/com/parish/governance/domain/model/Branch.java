package com.parish.governance.domain.model;

import java.time.Instant;

/**
 * A physical or organizational location of a tenant.
 *
 * @param id        branch identifier
 * @param tenantId  owning tenant
 * @param name      display name, unique among the tenant's active branches ignoring case
 * @param location  free-form address, may be null
 * @param active    false once archived
 * @param createdAt creation time
 */
public record Branch(String id, String tenantId, String name, String location, boolean active, Instant createdAt) {
}
