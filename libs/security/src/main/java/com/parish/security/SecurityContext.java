package com.parish.security;

import com.parish.security.impersonation.ImpersonationGrant;

import java.util.List;
import java.util.Set;

/**
 * The per-request security context. Built by {@link SessionResolver} before any business
 * data is touched and never persisted.
 * <p>
 * {@link #kind()} makes the three shapes mutually exclusive: a platform-admin context
 * carries no tenant and no permissions, a tenant-user context carries exactly one tenant
 * and the permissions of the user's role, and an impersonation context carries the
 * impersonated tenant, the wildcard permission and the grant it was derived from.
 *
 * @param kind              session shape
 * @param subjectId         identity-provider subject, or a synthetic id for impersonation
 * @param email             normalized email of the human behind the request
 * @param tenantId          tenant the request acts on (null for platform admins)
 * @param tenantName        tenant display name (null for platform admins)
 * @param userId            tenant user id (null unless {@link SessionKind#TENANT_USER})
 * @param roleId            role id (null unless {@link SessionKind#TENANT_USER})
 * @param roleName          role name, "Impersonation" for impersonation sessions
 * @param permissions       granted permissions, possibly containing {@link PermissionAuthorizer#WILDCARD}
 * @param userStatus        status of the tenant user
 * @param branchScopeMode   branch scope mode
 * @param allowedBranchIds  granted branches in grant order, meaningful only when restricted
 * @param defaultBranchId   preferred branch, may be null
 * @param identityProvider  sign-in provider, "impersonation" for impersonation sessions
 * @param impersonation     the grant behind an impersonation session, otherwise null
 */
public record SecurityContext(
        SessionKind kind,
        String subjectId,
        String email,
        String tenantId,
        String tenantName,
        String userId,
        String roleId,
        String roleName,
        Set<String> permissions,
        UserStatus userStatus,
        BranchScopeMode branchScopeMode,
        List<String> allowedBranchIds,
        String defaultBranchId,
        String identityProvider,
        ImpersonationGrant impersonation
) {

    /** Role name reported for impersonation sessions. */
    public static final String IMPERSONATION_ROLE_NAME = "Impersonation";

    /** Identity provider reported for impersonation sessions. */
    public static final String IMPERSONATION_PROVIDER = "impersonation";

    public SecurityContext {
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
        allowedBranchIds = allowedBranchIds == null ? List.of() : List.copyOf(allowedBranchIds);
        branchScopeMode = branchScopeMode == null ? BranchScopeMode.ALL : branchScopeMode;
    }

    /**
     * Context for a user linked to a tenant.
     */
    public static SecurityContext tenantUser(IdentityClaims claims, String normalizedEmail, LinkedAccount account) {
        return new SecurityContext(
                SessionKind.TENANT_USER,
                claims.subjectId(),
                normalizedEmail,
                account.tenantId(),
                account.tenantName(),
                account.userId(),
                account.roleId(),
                account.roleName(),
                account.permissions(),
                account.status(),
                account.branchScopeMode(),
                account.allowedBranchIds(),
                account.defaultBranchId(),
                claims.signInProvider(),
                null);
    }

    /**
     * Context for a platform operator outside any tenant.
     */
    public static SecurityContext platformAdmin(IdentityClaims claims, String normalizedEmail) {
        return new SecurityContext(
                SessionKind.PLATFORM_ADMIN,
                claims.subjectId(),
                normalizedEmail,
                null,
                null,
                null,
                null,
                null,
                Set.of(),
                UserStatus.ACTIVE,
                BranchScopeMode.ALL,
                List.of(),
                null,
                claims.signInProvider(),
                null);
    }

    /**
     * Full-authority tenant context derived from a valid impersonation grant.
     */
    public static SecurityContext impersonation(ImpersonationGrant grant, TenantRef tenant) {
        return new SecurityContext(
                SessionKind.IMPERSONATION,
                "impersonation:" + grant.tenantId(),
                grant.superAdminEmail(),
                tenant.id(),
                tenant.name(),
                null,
                null,
                IMPERSONATION_ROLE_NAME,
                Set.of(PermissionAuthorizer.WILDCARD),
                UserStatus.ACTIVE,
                BranchScopeMode.ALL,
                List.of(),
                null,
                IMPERSONATION_PROVIDER,
                grant);
    }

    /**
     * Copy of this context with a different user status, used after a first sign-in claim.
     */
    public SecurityContext withUserStatus(UserStatus status) {
        return new SecurityContext(kind, subjectId, email, tenantId, tenantName, userId, roleId, roleName,
                permissions, status, branchScopeMode, allowedBranchIds, defaultBranchId, identityProvider,
                impersonation);
    }

    public boolean isPlatformAdmin() {
        return kind == SessionKind.PLATFORM_ADMIN;
    }

    public boolean isImpersonation() {
        return kind == SessionKind.IMPERSONATION;
    }

    public boolean isRestricted() {
        return branchScopeMode == BranchScopeMode.RESTRICTED;
    }

    /**
     * The identifier written to logs and audit rows for this caller.
     */
    public String principalId() {
        return userId != null ? userId : subjectId;
    }
}
