package com.parish.security;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that a {@link SecurityContext} matches the shape its {@link SessionKind} promises.
 * All errors are collected rather than stopping at the first one.
 */
public final class SecurityContextValidator {

    private SecurityContextValidator() {
        // utility class
    }

    /**
     * Validates the context.
     *
     * @param context the context to check
     * @return a {@link SecurityValidationResult} listing every problem found
     */
    public static SecurityValidationResult validate(SecurityContext context) {
        if (context == null) {
            return SecurityValidationResult.fail(List.of("context must not be null"));
        }
        List<String> errors = new ArrayList<>();

        if (context.kind() == null) {
            errors.add("kind must not be null");
            return SecurityValidationResult.fail(errors);
        }
        if (isBlank(context.subjectId())) {
            errors.add("subjectId must not be null or blank");
        }
        if (isBlank(context.email())) {
            errors.add("email must not be null or blank");
        }

        switch (context.kind()) {
            case PLATFORM_ADMIN -> validatePlatformAdmin(context, errors);
            case TENANT_USER -> validateTenantUser(context, errors);
            case IMPERSONATION -> validateImpersonation(context, errors);
        }

        return errors.isEmpty() ? SecurityValidationResult.ok() : SecurityValidationResult.fail(errors);
    }

    private static void validatePlatformAdmin(SecurityContext context, List<String> errors) {
        if (context.tenantId() != null) {
            errors.add("platform admin context must not carry a tenant");
        }
        if (context.userId() != null) {
            errors.add("platform admin context must not carry a tenant user");
        }
        if (!context.permissions().isEmpty()) {
            errors.add("platform admin context must not carry tenant permissions");
        }
        if (context.impersonation() != null) {
            errors.add("platform admin context must not carry an impersonation grant");
        }
    }

    private static void validateTenantUser(SecurityContext context, List<String> errors) {
        if (isBlank(context.tenantId())) {
            errors.add("tenantId must not be null or blank");
        }
        if (isBlank(context.userId())) {
            errors.add("userId must not be null or blank");
        }
        if (isBlank(context.roleId())) {
            errors.add("roleId must not be null or blank");
        }
        if (context.userStatus() == null || context.userStatus() == UserStatus.SUSPENDED) {
            errors.add("userStatus must be Invited or Active");
        }
        if (context.impersonation() != null) {
            errors.add("tenant user context must not carry an impersonation grant");
        }
        if (context.isRestricted()) {
            if (context.allowedBranchIds().isEmpty()) {
                errors.add("restricted context must carry at least one branch grant");
            }
            if (context.defaultBranchId() != null && !context.allowedBranchIds().contains(context.defaultBranchId())) {
                errors.add("defaultBranchId must be one of the granted branches");
            }
        }
    }

    private static void validateImpersonation(SecurityContext context, List<String> errors) {
        if (isBlank(context.tenantId())) {
            errors.add("tenantId must not be null or blank");
        }
        if (context.impersonation() == null) {
            errors.add("impersonation context must carry its grant");
        } else if (!context.impersonation().tenantId().equals(context.tenantId())) {
            errors.add("impersonation grant tenant must match the context tenant");
        }
        if (context.isRestricted()) {
            errors.add("impersonation context must not be branch restricted");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
