package com.parish.governance.api.dto;

import jakarta.validation.constraints.NotBlank;
import java.util.List;

public record UpdateUserBranchesRequest(
        @NotBlank String branchScopeMode,
        List<String> branchIds,
        String defaultBranchId) {
}
