package com.parish.governance.domain.model;

import com.parish.security.BranchScopeMode;
import com.parish.security.UserStatus;
import java.util.List;

/**
 * A partial update of a tenant user. Null fields are left unchanged. A blank
 * {@code defaultBranchId} clears the default branch.
 */
public record UserChanges(
        String name,
        UserStatus status,
        String roleId,
        BranchScopeMode branchScopeMode,
        List<String> branchIds,
        String defaultBranchId) {

    public static UserChanges role(String roleId) {
        return new UserChanges(null, null, roleId, null, null, null);
    }

    public static UserChanges status(UserStatus status) {
        return new UserChanges(null, status, null, null, null, null);
    }

    public static UserChanges access(BranchScopeMode mode, List<String> branchIds, String defaultBranchId) {
        return new UserChanges(null, null, null, mode, branchIds, defaultBranchId);
    }

    public boolean touchesAccess() {
        return branchScopeMode != null || branchIds != null || defaultBranchId != null;
    }
}
