package com.parish.governance.api;

import com.parish.governance.api.dto.SessionResponse;
import com.parish.governance.api.dto.TokenRequest;
import com.parish.governance.domain.services.SessionService;
import com.parish.security.impersonation.ImpersonationManager;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Session bootstrap. The credential travels in the body, so these endpoints sit outside
 * the {@code /api/**} interceptor.
 */
@RestController
@RequestMapping("/auth")
public class SessionController {

    private final SessionService sessionService;
    private final ImpersonationManager impersonationManager;

    public SessionController(SessionService sessionService, ImpersonationManager impersonationManager) {
        this.sessionService = sessionService;
        this.impersonationManager = impersonationManager;
    }

    @PostMapping("/session")
    public SessionResponse createSession(@Valid @RequestBody TokenRequest request) {
        return SessionResponse.from(sessionService.signIn(request.token()));
    }

    @PostMapping("/impersonation/session")
    public SessionResponse impersonationSession(@Valid @RequestBody TokenRequest request) {
        return SessionResponse.from(impersonationManager.validate(request.token().strip()));
    }
}
