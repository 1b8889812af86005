package com.parish.governance.api.dto;

import jakarta.validation.constraints.Size;
import java.util.List;

/**
 * Partial user update. Null fields are left unchanged; an empty {@code defaultBranchId}
 * clears the default branch.
 */
public record UpdateUserRequest(
        @Size(max = 200) String name,
        String status,
        String roleId,
        String branchScopeMode,
        List<String> branchIds,
        String defaultBranchId) {
}
