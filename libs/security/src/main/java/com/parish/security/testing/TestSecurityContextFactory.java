package com.parish.security.testing;

import com.parish.security.BranchScopeMode;
import com.parish.security.IdentityClaims;
import com.parish.security.LinkedAccount;
import com.parish.security.SecurityContext;
import com.parish.security.TenantRef;
import com.parish.security.UserStatus;
import com.parish.security.impersonation.ImpersonationGrant;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Builds {@link SecurityContext} instances for tests.
 * <p>
 * Lives in the main source set so other modules can use it from their test scope through
 * a regular dependency.
 */
public final class TestSecurityContextFactory {

    public static final String DEFAULT_TENANT_ID = "test-tenant-001";

    private TestSecurityContextFactory() {
        // utility class
    }

    /**
     * Active, unrestricted tenant user holding the given permissions.
     */
    public static SecurityContext tenantUser(String tenantId, String... permissions) {
        return tenantUser(tenantId, "test-user-001", BranchScopeMode.ALL, List.of(), permissions);
    }

    /**
     * Active tenant user restricted to the given branches.
     */
    public static SecurityContext restrictedUser(String tenantId, List<String> branchIds, String... permissions) {
        return tenantUser(tenantId, "test-user-001", BranchScopeMode.RESTRICTED, branchIds, permissions);
    }

    public static SecurityContext tenantUser(String tenantId, String userId, BranchScopeMode mode,
                                             List<String> branchIds, String... permissions) {
        String email = userId + "@parish.test";
        LinkedAccount account = new LinkedAccount(
                userId, tenantId, "Test Tenant", email, UserStatus.ACTIVE,
                "role-" + userId, "Staff", Set.of(permissions), mode, branchIds, null);
        return SecurityContext.tenantUser(new IdentityClaims("sub-" + userId, email, "password"), email, account);
    }

    public static SecurityContext platformAdmin(String email) {
        return SecurityContext.platformAdmin(new IdentityClaims("sub-" + email, email, "password"), email);
    }

    /**
     * Impersonation context on the tenant with a 30 minute window starting now.
     */
    public static SecurityContext impersonation(String tenantId, String superAdminEmail) {
        Instant now = Instant.now();
        ImpersonationGrant grant = new ImpersonationGrant(
                UUID.randomUUID().toString(), superAdminEmail, tenantId, now, now.plus(Duration.ofMinutes(30)));
        return SecurityContext.impersonation(grant, new TenantRef(tenantId, "Test Tenant", "Active"));
    }
}
