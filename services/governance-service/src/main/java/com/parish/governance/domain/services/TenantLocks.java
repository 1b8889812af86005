package com.parish.governance.domain.services;

import com.parish.governance.domain.ports.TenantRepository;
import com.parish.security.NotFoundException;
import org.springframework.stereotype.Component;

/** Tenant row lock taken before multi-row invariant checks. */
@Component
public class TenantLocks {

    private final TenantRepository tenants;

    public TenantLocks(TenantRepository tenants) {
        this.tenants = tenants;
    }

    /**
     * Locks the tenant until the surrounding transaction ends.
     *
     * @throws NotFoundException if the tenant does not exist
     */
    public void lock(String tenantId) {
        if (!tenants.lockForUpdate(tenantId)) {
            throw NotFoundException.of("Tenant", tenantId);
        }
    }
}
