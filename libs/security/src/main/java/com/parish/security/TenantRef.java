package com.parish.security;

/**
 * Minimal view of a tenant needed to build a security context.
 *
 * @param id     tenant identifier
 * @param name   display name
 * @param status billing status (e.g. "Active", "Past Due")
 */
public record TenantRef(String id, String name, String status) {
}
