package com.parish.security.branch;

import com.parish.security.BadRequestException;
import com.parish.security.ForbiddenException;
import com.parish.security.SecurityContext;
import com.parish.security.TenantIsolationEnforcer;

import java.util.List;

/**
 * Resolves which branches a request may read or write.
 * <p>
 * Pure functions of the context and the requested branch. Unrestricted contexts are never
 * rejected on branch grounds; restricted contexts are confined to their grants. Callers
 * still have to check that the resolved branches exist within their tenant.
 */
public final class BranchScopeResolver {

    static final String NO_BRANCH_ACCESS = "No branch access assigned for this account.";
    static final String BRANCH_REQUIRED =
            "Branch is required for this account because your access is branch-restricted.";

    private BranchScopeResolver() {
        // utility class
    }

    /**
     * Scope for a read. A restricted context without an explicit branch reads its single
     * grant, or all of its grants when it holds several.
     *
     * @param context           resolved tenant context
     * @param requestedBranchId branch asked for by the client, blank meaning none
     * @throws ForbiddenException if the context has no grants or the branch is outside them
     */
    public static BranchScope resolveReadScope(SecurityContext context, String requestedBranchId) {
        TenantIsolationEnforcer.requireTenant(context);
        String requested = normalize(requestedBranchId);
        if (!context.isRestricted()) {
            return requested == null ? BranchScope.allBranches() : BranchScope.single(requested);
        }

        List<String> grants = context.allowedBranchIds();
        if (grants.isEmpty()) {
            throw new ForbiddenException(NO_BRANCH_ACCESS);
        }
        if (requested != null) {
            requireGranted(grants, requested);
            return BranchScope.single(requested);
        }
        return grants.size() == 1 ? BranchScope.single(grants.get(0)) : BranchScope.anyOf(grants);
    }

    /**
     * Scope for a write. Restricted contexts must name one of their granted branches.
     *
     * @param context           resolved tenant context
     * @param requestedBranchId branch the write targets, blank meaning none
     * @throws BadRequestException if a restricted context names no branch
     * @throws ForbiddenException  if the branch is outside the grants
     */
    public static BranchScope resolveWriteScope(SecurityContext context, String requestedBranchId) {
        TenantIsolationEnforcer.requireTenant(context);
        String requested = normalize(requestedBranchId);
        if (!context.isRestricted()) {
            return requested == null ? BranchScope.allBranches() : BranchScope.single(requested);
        }
        if (requested == null) {
            throw new BadRequestException(BRANCH_REQUIRED);
        }
        requireGranted(context.allowedBranchIds(), requested);
        return BranchScope.single(requested);
    }

    private static void requireGranted(List<String> grants, String branchId) {
        if (!grants.contains(branchId)) {
            throw new ForbiddenException("Branch is outside your allowed scope: " + branchId);
        }
    }

    private static String normalize(String branchId) {
        if (branchId == null) {
            return null;
        }
        String trimmed = branchId.strip();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
