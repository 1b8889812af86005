package com.parish.governance.domain.model;

import com.parish.security.UserStatus;

/**
 * Filters for user listings. Null fields do not filter.
 *
 * @param tenantId tenant to list (null lists across tenants, platform only)
 * @param status   exact status
 * @param roleId   exact role
 * @param search   substring of name or email, ignoring case
 */
public record UserQuery(String tenantId, UserStatus status, String roleId, String search) {
}
