package com.parish.governance.domain.services;

import com.parish.governance.domain.model.Plan;
import com.parish.governance.domain.model.Tenant;
import com.parish.governance.domain.model.TenantStatus;
import com.parish.governance.domain.ports.TenantRepository;
import com.parish.security.BadRequestException;
import com.parish.security.NotFoundException;
import com.parish.security.SecurityContext;
import com.parish.security.TenantIsolationEnforcer;
import com.parish.security.audit.AuditAction;
import com.parish.security.audit.AuditRecorder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Platform-level tenant administration: subscription status and plan.
 */
@Service
public class TenantAdminService {

    static final String AUDIT_RESOURCE = "Tenant";

    private final TenantRepository tenants;
    private final TenantLocks tenantLocks;
    private final AuditRecorder auditRecorder;

    public TenantAdminService(TenantRepository tenants, TenantLocks tenantLocks, AuditRecorder auditRecorder) {
        this.tenants = tenants;
        this.tenantLocks = tenantLocks;
        this.auditRecorder = auditRecorder;
    }

    @Transactional(readOnly = true)
    public Tenant get(String tenantId) {
        return tenants.findById(tenantId).orElseThrow(() -> NotFoundException.of("Tenant", tenantId));
    }

    @Transactional
    public Tenant updateStatus(SecurityContext actor, String tenantId, TenantStatus status) {
        TenantIsolationEnforcer.requirePlatformAdmin(actor);
        if (status == null) {
            throw new BadRequestException("status is required.");
        }
        tenantLocks.lock(tenantId);
        Tenant current = get(tenantId);
        if (current.status() == status) {
            return current;
        }
        tenants.updateStatus(tenantId, status);

        auditRecorder.record(tenantId, AuditAction.TENANT_STATUS_UPDATED, AUDIT_RESOURCE,
                AuditDetails.of("tenantId", tenantId, "previousStatus", current.status().value(),
                        "status", status.value()),
                actor.email());
        return get(tenantId);
    }

    @Transactional
    public Tenant updatePlan(SecurityContext actor, String tenantId, String planId) {
        TenantIsolationEnforcer.requirePlatformAdmin(actor);
        if (planId == null || planId.isBlank()) {
            throw new BadRequestException("planId is required.");
        }
        tenantLocks.lock(tenantId);
        Tenant current = get(tenantId);
        Plan plan = tenants.findPlan(planId.strip())
                .orElseThrow(() -> new BadRequestException("Plan not found: " + planId));
        if (plan.id().equals(current.planId())) {
            return current;
        }
        tenants.updatePlan(tenantId, plan.id());

        auditRecorder.record(tenantId, AuditAction.TENANT_PLAN_UPDATED, AUDIT_RESOURCE,
                AuditDetails.of("tenantId", tenantId, "previousPlanId", current.planId(),
                        "planId", plan.id(), "planName", plan.name()),
                actor.email());
        return get(tenantId);
    }
}
