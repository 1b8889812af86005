package com.parish.security;

import java.util.List;
import java.util.Set;

/**
 * A tenant user as seen by the session resolver: the user record joined with its role,
 * its tenant and its branch grants.
 * <p>
 * {@code allowedBranchIds} holds only grants on active branches of the user's own tenant;
 * the directory is responsible for that filtering.
 *
 * @param userId           user identifier
 * @param tenantId         owning tenant
 * @param tenantName       owning tenant display name
 * @param email            normalized email
 * @param status           lifecycle status
 * @param roleId           assigned role
 * @param roleName         assigned role name
 * @param permissions      permissions of the assigned role
 * @param branchScopeMode  branch scope mode
 * @param allowedBranchIds granted active branches, ordered
 * @param defaultBranchId  preferred branch, may be null
 */
public record LinkedAccount(
        String userId,
        String tenantId,
        String tenantName,
        String email,
        UserStatus status,
        String roleId,
        String roleName,
        Set<String> permissions,
        BranchScopeMode branchScopeMode,
        List<String> allowedBranchIds,
        String defaultBranchId
) {

    public LinkedAccount {
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
        allowedBranchIds = allowedBranchIds == null ? List.of() : List.copyOf(allowedBranchIds);
        branchScopeMode = branchScopeMode == null ? BranchScopeMode.ALL : branchScopeMode;
    }
}
