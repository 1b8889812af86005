package com.parish.governance.domain.services;

import com.parish.governance.domain.model.Branch;
import com.parish.governance.domain.ports.BranchRepository;
import com.parish.security.BadRequestException;
import com.parish.security.NotFoundException;
import com.parish.security.SecurityContext;
import com.parish.security.TenantIsolationEnforcer;
import com.parish.security.branch.BranchScope;
import com.parish.security.branch.BranchScopeResolver;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * The single branch check every tenant-scoped handler goes through: resolves the scope
 * from the context, then re-checks the resolved branches against the store.
 *
 * <p>A branch that does not exist or belongs to another tenant is reported as not found,
 * so the response never reveals that another tenant's branch exists.
 */
@Component
public class BranchAccessGuard {

    private final BranchRepository branches;

    public BranchAccessGuard(BranchRepository branches) {
        this.branches = branches;
    }

    /**
     * Scope for reading branch-scoped data, archived branches included.
     */
    public BranchScope readScope(SecurityContext context, String requestedBranchId) {
        BranchScope scope = BranchScopeResolver.resolveReadScope(context, requestedBranchId);
        requireExisting(context.tenantId(), scope.branchIds());
        return scope;
    }

    /**
     * Scope for writing branch-scoped data. The target branch must be active.
     */
    public BranchScope writeScope(SecurityContext context, String requestedBranchId) {
        BranchScope scope = BranchScopeResolver.resolveWriteScope(context, requestedBranchId);
        if (scope.branchId() != null) {
            Branch branch = requireBranch(context, scope.branchId());
            if (!branch.active()) {
                throw new BadRequestException("Branch is archived: " + branch.id());
            }
        }
        return scope;
    }

    /**
     * Loads a branch of the caller's tenant.
     *
     * @throws NotFoundException if the branch is missing or belongs to another tenant
     */
    public Branch requireBranch(SecurityContext context, String branchId) {
        String tenantId = TenantIsolationEnforcer.requireTenant(context);
        return branches.findById(tenantId, branchId)
                .orElseThrow(() -> NotFoundException.of("Branch", branchId));
    }

    private void requireExisting(String tenantId, List<String> branchIds) {
        if (branchIds.isEmpty()) {
            return;
        }
        Set<String> existing = new HashSet<>(branches.findExistingIds(tenantId, branchIds));
        for (String branchId : branchIds) {
            if (!existing.contains(branchId)) {
                throw NotFoundException.of("Branch", branchId);
            }
        }
    }
}
