package com.parish.governance.api;

import com.parish.governance.api.dto.RequestValues;
import com.parish.governance.api.dto.UpdatePlanRequest;
import com.parish.governance.api.dto.UpdateStatusRequest;
import com.parish.governance.domain.model.Tenant;
import com.parish.governance.domain.services.TenantAdminService;
import com.parish.governance.infrastructure.web.PlatformAdminOnly;
import com.parish.security.SecurityContext;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/platform/tenants")
@PlatformAdminOnly
public class PlatformTenantController {

    private final TenantAdminService tenantAdminService;

    public PlatformTenantController(TenantAdminService tenantAdminService) {
        this.tenantAdminService = tenantAdminService;
    }

    @GetMapping("/{tenantId}")
    public Tenant get(@PathVariable String tenantId) {
        return tenantAdminService.get(tenantId);
    }

    @PatchMapping("/{tenantId}/status")
    public Tenant updateStatus(SecurityContext context, @PathVariable String tenantId,
                               @Valid @RequestBody UpdateStatusRequest request) {
        return tenantAdminService.updateStatus(context, tenantId, RequestValues.tenantStatus(request.status()));
    }

    @PatchMapping("/{tenantId}/plan")
    public Tenant updatePlan(SecurityContext context, @PathVariable String tenantId,
                             @Valid @RequestBody UpdatePlanRequest request) {
        return tenantAdminService.updatePlan(context, tenantId, request.planId());
    }
}
