package com.parish.security;

import com.parish.security.impersonation.ImpersonationManager;
import com.parish.security.impersonation.ImpersonationTokenCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a presented bearer credential into exactly one {@link SecurityContext}.
 * <p>
 * Resolution order:
 * <ol>
 *   <li>{@code imp_} credentials are validated by the {@link ImpersonationManager};</li>
 *   <li>anything else goes to the {@link IdentityVerifier}, and the verified email is
 *       checked against the platform-admin allow-list first, then looked up in the
 *       {@link TenantDirectory}.</li>
 * </ol>
 * Resolution is a pure lookup. Activating invited users on first sign-in is left to the
 * session endpoint.
 */
public class SessionResolver {

    private static final Logger log = LoggerFactory.getLogger(SessionResolver.class);

    private final IdentityVerifier identityVerifier;
    private final TenantDirectory tenantDirectory;
    private final PlatformAdminAllowList platformAdmins;
    private final ImpersonationManager impersonationManager;

    public SessionResolver(IdentityVerifier identityVerifier,
                           TenantDirectory tenantDirectory,
                           PlatformAdminAllowList platformAdmins,
                           ImpersonationManager impersonationManager) {
        this.identityVerifier = identityVerifier;
        this.tenantDirectory = tenantDirectory;
        this.platformAdmins = platformAdmins;
        this.impersonationManager = impersonationManager;
    }

    /**
     * Resolves the credential carried by an Authorization header.
     *
     * @param authorizationHeader raw header value, may be null
     * @throws UnauthenticatedException if no bearer credential is present
     */
    public SecurityContext resolveAuthorizationHeader(String authorizationHeader) {
        String token = BearerTokenExtractor.extract(authorizationHeader)
                .orElseThrow(() -> new UnauthenticatedException("Missing authorization token"));
        return resolveContext(token);
    }

    /**
     * Resolves a bearer credential.
     *
     * @param credential the credential, without the {@code Bearer} scheme
     * @return the resolved context
     * @throws UnauthenticatedException   if the credential is missing or cannot be verified
     * @throws AccountNotLinkedException  if no tenant user is registered for the identity
     * @throws AccountSuspendedException  if the tenant user is suspended
     * @throws NoBranchAccessException    if a restricted user holds no grant on an active branch
     */
    public SecurityContext resolveContext(String credential) {
        if (credential == null || credential.isBlank()) {
            throw new UnauthenticatedException("Missing authorization token");
        }
        String token = credential.strip();

        SecurityContext context = ImpersonationTokenCodec.isImpersonationToken(token)
                ? impersonationManager.validate(token)
                : resolveIdentity(token);

        SecurityValidationResult validation = SecurityContextValidator.validate(context);
        if (!validation.valid()) {
            throw new IllegalStateException("Resolved security context is inconsistent: " + validation.errors());
        }
        log.debug("Resolved session: kind={}, tenantId={}, principal={}",
                context.kind(), context.tenantId(), context.principalId());
        return context;
    }

    private SecurityContext resolveIdentity(String token) {
        IdentityClaims claims = verify(token);
        String email = PlatformAdminAllowList.normalize(claims.email());
        if (email.isEmpty()) {
            throw new UnauthenticatedException("Identity carries no email");
        }

        if (platformAdmins.contains(email)) {
            return SecurityContext.platformAdmin(claims, email);
        }

        LinkedAccount account = tenantDirectory.findLinkedAccount(email)
                .orElseThrow(AccountNotLinkedException::new);
        if (account.status() == UserStatus.SUSPENDED) {
            throw new AccountSuspendedException();
        }
        if (account.branchScopeMode() == BranchScopeMode.RESTRICTED && account.allowedBranchIds().isEmpty()) {
            throw new NoBranchAccessException();
        }
        return SecurityContext.tenantUser(claims, email, account);
    }

    private IdentityClaims verify(String token) {
        IdentityClaims claims;
        try {
            claims = identityVerifier.verify(token);
        } catch (AccessControlException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Identity verification failed unexpectedly", e);
            throw new UnauthenticatedException("Identity verification failed", e);
        }
        if (claims == null) {
            throw new UnauthenticatedException("Identity verification returned no claims");
        }
        return claims;
    }
}
