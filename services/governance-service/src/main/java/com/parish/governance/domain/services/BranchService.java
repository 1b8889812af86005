package com.parish.governance.domain.services;

import com.parish.governance.domain.model.Branch;
import com.parish.governance.domain.ports.BranchRepository;
import com.parish.security.BadRequestException;
import com.parish.security.ForbiddenException;
import com.parish.security.SecurityContext;
import com.parish.security.TenantIsolationEnforcer;
import com.parish.security.audit.AuditAction;
import com.parish.security.audit.AuditRecorder;
import com.parish.security.branch.BranchScope;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Branch listing and lifecycle.
 *
 * <p>Archiving keeps two invariants: a tenant always has an active branch, and a
 * restricted user never loses their last grant. Both are checked under the tenant lock.
 */
@Service
public class BranchService {

    static final String AUDIT_RESOURCE = "Branch";
    static final String LAST_ACTIVE_BRANCH = "Cannot archive the last active branch.";
    static final String DUPLICATE_NAME = "An active branch with this name already exists.";
    static final int MAX_NAME_LENGTH = 200;

    private static final Logger log = LoggerFactory.getLogger(BranchService.class);

    private final BranchRepository branches;
    private final BranchAccessGuard guard;
    private final TenantLocks tenantLocks;
    private final AuditRecorder auditRecorder;
    private final Clock clock;

    public BranchService(BranchRepository branches,
                         BranchAccessGuard guard,
                         TenantLocks tenantLocks,
                         AuditRecorder auditRecorder,
                         Clock clock) {
        this.branches = branches;
        this.guard = guard;
        this.tenantLocks = tenantLocks;
        this.auditRecorder = auditRecorder;
        this.clock = clock;
    }

    /**
     * Branches visible to the caller. Restricted callers only see their grants.
     */
    @Transactional(readOnly = true)
    public List<Branch> list(SecurityContext context, boolean includeArchived, String requestedBranchId) {
        BranchScope scope = guard.readScope(context, requestedBranchId);
        return branches.findByTenant(context.tenantId(), includeArchived, scope.branchIds());
    }

    @Transactional(readOnly = true)
    public Branch get(SecurityContext context, String branchId) {
        guard.readScope(context, branchId);
        return guard.requireBranch(context, branchId);
    }

    @Transactional
    public Branch create(SecurityContext context, String name, String location) {
        String tenantId = TenantIsolationEnforcer.requireTenant(context);
        String branchName = requireName(name);
        if (branches.activeNameExists(tenantId, branchName, null)) {
            throw new BadRequestException(DUPLICATE_NAME);
        }
        Branch branch = new Branch(UUID.randomUUID().toString(), tenantId, branchName, blankToNull(location),
                true, clock.instant());
        branches.insert(branch);

        auditRecorder.record(tenantId, AuditAction.BRANCH_CREATED, AUDIT_RESOURCE,
                AuditDetails.of("branchId", branch.id(), "name", branch.name(), "location", branch.location()),
                context.email());
        return branch;
    }

    /**
     * Renames or relocates a branch. Null arguments leave the field unchanged; a blank
     * location clears it.
     */
    @Transactional
    public Branch update(SecurityContext context, String branchId, String name, String location) {
        guard.writeScope(context, branchId);
        Branch current = guard.requireBranch(context, branchId);

        String nextName = name == null ? current.name() : requireName(name);
        String nextLocation = location == null ? current.location() : blankToNull(location);
        if (!nextName.equalsIgnoreCase(current.name())
                && branches.activeNameExists(current.tenantId(), nextName, branchId)) {
            throw new BadRequestException(DUPLICATE_NAME);
        }
        Branch updated = new Branch(current.id(), current.tenantId(), nextName, nextLocation, current.active(),
                current.createdAt());
        if (updated.equals(current)) {
            return current;
        }
        branches.update(updated);

        auditRecorder.record(current.tenantId(), AuditAction.BRANCH_UPDATED, AUDIT_RESOURCE,
                AuditDetails.of(
                        "branchId", branchId,
                        "before", AuditDetails.of("name", current.name(), "location", current.location()),
                        "after", AuditDetails.of("name", updated.name(), "location", updated.location())),
                context.email());
        return updated;
    }

    /**
     * Archives a branch, deleting every grant on it and clearing it as a default branch.
     * Archiving an already archived branch is a no-op.
     */
    @Transactional
    public Branch archive(SecurityContext context, String branchId) {
        String tenantId = TenantIsolationEnforcer.requireTenant(context);
        tenantLocks.lock(tenantId);
        Branch branch = guard.requireBranch(context, branchId);
        if (!branch.active()) {
            return branch;
        }
        guard.writeScope(context, branchId);

        if (branches.countActive(tenantId) <= 1) {
            throw new BadRequestException(LAST_ACTIVE_BRANCH);
        }
        List<String> stranded = branches.findUsersRestrictedToOnly(tenantId, branchId);
        if (!stranded.isEmpty()) {
            throw new BadRequestException(
                    "Cannot archive a branch that is the only access for restricted users: "
                            + String.join(", ", stranded));
        }

        int removedGrants = branches.deleteGrants(branchId);
        int clearedDefaults = branches.clearDefaultBranch(branchId);
        branches.setActive(branch, false);
        log.info("Archived branch {} in tenant {}: removedGrants={}, clearedDefaults={}",
                branchId, tenantId, removedGrants, clearedDefaults);

        auditRecorder.record(tenantId, AuditAction.BRANCH_ARCHIVED, AUDIT_RESOURCE,
                AuditDetails.of(
                        "branchId", branchId,
                        "name", branch.name(),
                        "removedGrants", removedGrants,
                        "clearedDefaultBranches", clearedDefaults),
                context.email());
        return new Branch(branch.id(), tenantId, branch.name(), branch.location(), false, branch.createdAt());
    }

    /**
     * Reactivates an archived branch. Grants removed by the archive are not restored.
     */
    @Transactional
    public Branch unarchive(SecurityContext context, String branchId) {
        String tenantId = TenantIsolationEnforcer.requireTenant(context);
        tenantLocks.lock(tenantId);
        Branch branch = guard.requireBranch(context, branchId);
        if (branch.active()) {
            return branch;
        }
        if (context.isRestricted()) {
            throw new ForbiddenException("Branch-restricted accounts cannot unarchive branches.");
        }
        if (branches.activeNameExists(tenantId, branch.name(), branchId)) {
            throw new BadRequestException(DUPLICATE_NAME);
        }
        branches.setActive(branch, true);

        auditRecorder.record(tenantId, AuditAction.BRANCH_UNARCHIVED, AUDIT_RESOURCE,
                AuditDetails.of("branchId", branchId, "name", branch.name()),
                context.email());
        return new Branch(branch.id(), tenantId, branch.name(), branch.location(), true, branch.createdAt());
    }

    private static String requireName(String name) {
        String trimmed = name == null ? "" : name.strip();
        if (trimmed.isEmpty()) {
            throw new BadRequestException("Branch name is required.");
        }
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new BadRequestException("Branch name must be at most " + MAX_NAME_LENGTH + " characters.");
        }
        return trimmed;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
