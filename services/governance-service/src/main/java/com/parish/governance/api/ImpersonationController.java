package com.parish.governance.api;

import com.parish.governance.api.dto.ImpersonationStartResponse;
import com.parish.governance.api.dto.StopImpersonationResponse;
import com.parish.governance.api.dto.TokenRequest;
import com.parish.governance.infrastructure.web.PlatformAdminOnly;
import com.parish.security.SecurityContext;
import com.parish.security.impersonation.ImpersonationManager;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Starting and stopping impersonation sessions.
 */
@RestController
@RequestMapping("/api/v1")
public class ImpersonationController {

    private final ImpersonationManager impersonationManager;

    public ImpersonationController(ImpersonationManager impersonationManager) {
        this.impersonationManager = impersonationManager;
    }

    @PostMapping("/platform/tenants/{tenantId}/impersonation")
    @ResponseStatus(HttpStatus.CREATED)
    @PlatformAdminOnly
    public ImpersonationStartResponse start(SecurityContext context, @PathVariable String tenantId) {
        return ImpersonationStartResponse.from(impersonationManager.start(context, tenantId));
    }

    @PostMapping("/platform/impersonation/stop")
    @PlatformAdminOnly
    public StopImpersonationResponse stopByToken(SecurityContext context,
                                                 @Valid @RequestBody TokenRequest request) {
        return new StopImpersonationResponse(impersonationManager.stop(context, request.token().strip()));
    }

    /** Ends the impersonation session making the request. */
    @DeleteMapping("/impersonation")
    public StopImpersonationResponse stopOwn(SecurityContext context) {
        return new StopImpersonationResponse(impersonationManager.stop(context));
    }
}
