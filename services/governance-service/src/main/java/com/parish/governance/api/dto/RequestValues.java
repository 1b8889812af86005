package com.parish.governance.api.dto;

import com.parish.governance.domain.model.TenantStatus;
import com.parish.security.BadRequestException;
import com.parish.security.BranchScopeMode;
import com.parish.security.UserStatus;
import java.util.Locale;

/**
 * Strict parsing of enumerated request values. Unknown values are rejected instead of
 * falling back to a default.
 */
public final class RequestValues {

    private RequestValues() {
        // utility class
    }

    public static UserStatus userStatus(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return UserStatus.fromString(value)
                .orElseThrow(() -> new BadRequestException("Unknown user status: " + value));
    }

    public static TenantStatus tenantStatus(String value) {
        return TenantStatus.fromString(value)
                .orElseThrow(() -> new BadRequestException("Unknown tenant status: " + value));
    }

    public static BranchScopeMode branchScopeMode(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String candidate = value.strip().toUpperCase(Locale.ROOT);
        for (BranchScopeMode mode : BranchScopeMode.values()) {
            if (mode.name().equals(candidate)) {
                return mode;
            }
        }
        throw new BadRequestException("Unknown branch scope mode: " + value);
    }
}
