package com.parish.governance.domain.services;

import com.parish.governance.domain.model.TenantUser;
import com.parish.governance.domain.ports.UserRepository;
import com.parish.security.SecurityContext;
import com.parish.security.SessionKind;
import com.parish.security.SessionResolver;
import com.parish.security.UserStatus;
import com.parish.security.audit.AuditAction;
import com.parish.security.audit.AuditRecorder;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Sign-in: resolves the presented credential and records the sign-in of tenant users.
 *
 * <p>The first sign-in of an invited user claims the invitation: the user becomes active
 * and a {@link AuditAction#USER_CLAIMED} entry is written.
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final SessionResolver sessionResolver;
    private final UserRepository users;
    private final AuditRecorder auditRecorder;
    private final Clock clock;

    public SessionService(SessionResolver sessionResolver, UserRepository users, AuditRecorder auditRecorder,
                          Clock clock) {
        this.sessionResolver = sessionResolver;
        this.users = users;
        this.auditRecorder = auditRecorder;
        this.clock = clock;
    }

    @Transactional
    public SecurityContext signIn(String credential) {
        SecurityContext context = sessionResolver.resolveContext(credential);
        if (context.kind() != SessionKind.TENANT_USER) {
            return context;
        }
        TenantUser user = users.findById(context.tenantId(), context.userId()).orElse(null);
        if (user == null) {
            // deleted between resolution and this read; the context itself is still valid
            return context;
        }

        Instant now = clock.instant();
        TenantUser signedIn = user.withSignIn(now, context.identityProvider());
        if (user.status() != UserStatus.INVITED) {
            users.update(signedIn);
            return context;
        }

        users.update(signedIn.withStatus(UserStatus.ACTIVE));
        log.info("User {} claimed invitation into tenant {}", user.id(), user.tenantId());
        auditRecorder.record(user.tenantId(), AuditAction.USER_CLAIMED, UserService.AUDIT_RESOURCE,
                AuditDetails.of(
                        "userId", user.id(),
                        "email", user.email(),
                        "provider", context.identityProvider(),
                        "activatedAt", now.toString()),
                context.email());
        return context.withUserStatus(UserStatus.ACTIVE);
    }
}
