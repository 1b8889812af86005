package com.parish.governance.domain.ports;

import com.parish.governance.domain.model.PageRequest;
import com.parish.governance.domain.model.PageResult;
import com.parish.governance.domain.model.TenantUser;
import com.parish.governance.domain.model.UserQuery;
import java.util.List;
import java.util.Optional;

public interface UserRepository {

    Optional<TenantUser> findById(String tenantId, String userId);

    /** Lookup across tenants, for platform operations. */
    Optional<TenantUser> findAnyById(String userId);

    Optional<TenantUser> findByEmail(String normalizedEmail);

    /** Newest first. A null tenant in the query searches every tenant. */
    PageResult<TenantUser> find(UserQuery query, PageRequest page);

    /** Inserts the user row; grants are written with {@link #replaceBranchAccess}. */
    void insert(TenantUser user);

    /**
     * Writes every mutable column: tenant, name, role, status, scope mode, default branch
     * and the invite/sign-in timestamps.
     */
    void update(TenantUser user);

    void replaceBranchAccess(String userId, List<String> branchIds);

    /** Users assigned to the Owner system role who are not suspended. */
    long countActiveOwners(String tenantId);
}
