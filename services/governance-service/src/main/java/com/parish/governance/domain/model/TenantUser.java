package com.parish.governance.domain.model;

import com.parish.security.BranchScopeMode;
import com.parish.security.UserStatus;
import java.time.Instant;
import java.util.List;

/**
 * A user record of one tenant, joined with its role and branch grants.
 *
 * @param id                 user identifier
 * @param tenantId           owning tenant
 * @param tenantName         owning tenant name
 * @param email              normalized email, unique platform-wide
 * @param name               display name
 * @param roleId             assigned role
 * @param roleName           assigned role name
 * @param status             lifecycle status
 * @param branchScopeMode    branch scope mode
 * @param defaultBranchId    preferred branch, may be null
 * @param branchIds          granted branches (any state), ordered by grant time
 * @param invitedAt          time of the latest invitation
 * @param activatedAt        time of the first sign-in
 * @param lastLoginAt        time of the latest sign-in
 * @param lastSignInProvider provider of the latest sign-in
 * @param createdAt          creation time
 */
public record TenantUser(
        String id,
        String tenantId,
        String tenantName,
        String email,
        String name,
        String roleId,
        String roleName,
        UserStatus status,
        BranchScopeMode branchScopeMode,
        String defaultBranchId,
        List<String> branchIds,
        Instant invitedAt,
        Instant activatedAt,
        Instant lastLoginAt,
        String lastSignInProvider,
        Instant createdAt) {

    public TenantUser {
        branchIds = branchIds == null ? List.of() : List.copyOf(branchIds);
    }

    public TenantUser withName(String newName) {
        return new TenantUser(id, tenantId, tenantName, email, newName, roleId, roleName, status, branchScopeMode,
                defaultBranchId, branchIds, invitedAt, activatedAt, lastLoginAt, lastSignInProvider, createdAt);
    }

    public TenantUser withRole(Role role) {
        return new TenantUser(id, tenantId, tenantName, email, name, role.id(), role.name(), status, branchScopeMode,
                defaultBranchId, branchIds, invitedAt, activatedAt, lastLoginAt, lastSignInProvider, createdAt);
    }

    public TenantUser withStatus(UserStatus newStatus) {
        return new TenantUser(id, tenantId, tenantName, email, name, roleId, roleName, newStatus, branchScopeMode,
                defaultBranchId, branchIds, invitedAt, activatedAt, lastLoginAt, lastSignInProvider, createdAt);
    }

    public TenantUser withAccess(BranchScopeMode mode, List<String> grants, String defaultBranch) {
        return new TenantUser(id, tenantId, tenantName, email, name, roleId, roleName, status, mode,
                defaultBranch, grants, invitedAt, activatedAt, lastLoginAt, lastSignInProvider, createdAt);
    }

    public TenantUser withInvitedAt(Instant at) {
        return new TenantUser(id, tenantId, tenantName, email, name, roleId, roleName, status, branchScopeMode,
                defaultBranchId, branchIds, at, activatedAt, lastLoginAt, lastSignInProvider, createdAt);
    }

    /**
     * Records a sign-in; the first one also sets {@code activatedAt}.
     */
    public TenantUser withSignIn(Instant at, String provider) {
        return new TenantUser(id, tenantId, tenantName, email, name, roleId, roleName, status, branchScopeMode,
                defaultBranchId, branchIds, invitedAt, activatedAt == null ? at : activatedAt, at, provider,
                createdAt);
    }
}
