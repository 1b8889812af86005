package com.parish.governance.domain.ports;

import com.parish.governance.domain.model.Branch;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface BranchRepository {

    /**
     * Branches of a tenant ordered by name.
     *
     * @param includeArchived also return archived branches
     * @param branchIds       restrict to these ids, empty for no restriction
     */
    List<Branch> findByTenant(String tenantId, boolean includeArchived, Collection<String> branchIds);

    Optional<Branch> findById(String tenantId, String branchId);

    /** The subset of {@code branchIds} that exist in the tenant, in any state. */
    List<String> findExistingIds(String tenantId, Collection<String> branchIds);

    /** The subset of {@code branchIds} that are active branches of the tenant. */
    List<String> findActiveIds(String tenantId, Collection<String> branchIds);

    long countActive(String tenantId);

    /** True if an active branch other than {@code excludingBranchId} uses the name (case-insensitive). */
    boolean activeNameExists(String tenantId, String name, String excludingBranchId);

    void insert(Branch branch);

    /** Writes name and location. */
    void update(Branch branch);

    void setActive(Branch branch, boolean active);

    /**
     * Emails of restricted users whose only grant on an active branch is {@code branchId}.
     */
    List<String> findUsersRestrictedToOnly(String tenantId, String branchId);

    int deleteGrants(String branchId);

    int clearDefaultBranch(String branchId);
}
