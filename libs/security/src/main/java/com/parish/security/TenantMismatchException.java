package com.parish.security;

/**
 * Thrown when a request touches a resource that belongs to a different tenant.
 * <p>
 * The message shown to the caller does not name either tenant; both ids stay available
 * for logging.
 */
public class TenantMismatchException extends ForbiddenException {

    private final String expectedTenantId;
    private final String actualTenantId;

    public TenantMismatchException(String expectedTenantId, String actualTenantId) {
        super("Resource is outside your tenant.");
        this.expectedTenantId = expectedTenantId;
        this.actualTenantId = actualTenantId;
    }

    public String expectedTenantId() {
        return expectedTenantId;
    }

    public String actualTenantId() {
        return actualTenantId;
    }
}
