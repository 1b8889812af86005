package com.parish.governance.domain.model;

import com.parish.security.BranchScopeMode;
import java.util.List;

/**
 * An invitation of a person into a tenant.
 *
 * @param email           email to invite, normalized by the service
 * @param name            display name
 * @param roleId          role of the tenant to assign
 * @param branchScopeMode branch scope mode, null meaning {@link BranchScopeMode#ALL}
 * @param branchIds       granted branches, required when restricted
 * @param defaultBranchId preferred branch, may be null
 */
public record UserInvitation(
        String email,
        String name,
        String roleId,
        BranchScopeMode branchScopeMode,
        List<String> branchIds,
        String defaultBranchId) {

    public UserInvitation {
        branchIds = branchIds == null ? List.of() : List.copyOf(branchIds);
        branchScopeMode = branchScopeMode == null ? BranchScopeMode.ALL : branchScopeMode;
    }
}
