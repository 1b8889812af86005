package com.parish.governance.domain.ports;

import com.parish.governance.domain.model.Plan;
import com.parish.governance.domain.model.Tenant;
import com.parish.governance.domain.model.TenantStatus;
import java.util.Optional;

/**
 * Tenant rows and the plan catalog.
 */
public interface TenantRepository {

    Optional<Tenant> findById(String tenantId);

    /**
     * Takes a row lock on the tenant for the rest of the current transaction.
     * Serializes mutations whose invariants span several rows of one tenant
     * (owner retention, branch archive).
     *
     * @return false if the tenant does not exist
     */
    boolean lockForUpdate(String tenantId);

    void updateStatus(String tenantId, TenantStatus status);

    void updatePlan(String tenantId, String planId);

    Optional<Plan> findPlan(String planId);
}
