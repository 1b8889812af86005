package com.parish.security;

/**
 * Enforces the tenant boundary of a request.
 * <p>
 * Tenant-scoped operations call {@link #requireTenant(SecurityContext)} before anything
 * else; operations on a loaded record additionally call {@link #enforce(SecurityContext, String)}
 * with the record's tenant.
 */
public final class TenantIsolationEnforcer {

    static final String PLATFORM_ADMIN_MUST_IMPERSONATE =
            "Super-admins must use explicit impersonation to access church-admin routes.";

    private TenantIsolationEnforcer() {
        // utility class
    }

    /**
     * Returns the tenant the request acts on.
     *
     * @throws ForbiddenException for platform-admin contexts and contexts without a tenant
     */
    public static String requireTenant(SecurityContext context) {
        if (context.isPlatformAdmin()) {
            throw new ForbiddenException(PLATFORM_ADMIN_MUST_IMPERSONATE);
        }
        String tenantId = context.tenantId();
        if (tenantId == null || tenantId.isBlank()) {
            throw new ForbiddenException("Tenant context is required.");
        }
        return tenantId;
    }

    /**
     * Rejects non platform-admin contexts, including impersonation sessions.
     */
    public static void requirePlatformAdmin(SecurityContext context) {
        if (!context.isPlatformAdmin()) {
            throw new ForbiddenException("Platform administrator access is required.");
        }
    }

    /**
     * Verifies that the resource belongs to the tenant of the request.
     *
     * @param context          the resolved context
     * @param resourceTenantId the tenant ID of the resource being accessed
     * @throws TenantMismatchException if the tenants do not match
     */
    public static void enforce(SecurityContext context, String resourceTenantId) {
        String contextTenantId = requireTenant(context);
        if (!contextTenantId.equals(resourceTenantId)) {
            throw new TenantMismatchException(contextTenantId, resourceTenantId);
        }
    }
}
