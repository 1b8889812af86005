package com.parish.security.impersonation;

import com.parish.security.ForbiddenException;
import com.parish.security.NotFoundException;
import com.parish.security.SecurityContext;
import com.parish.security.TenantDirectory;
import com.parish.security.TenantIsolationEnforcer;
import com.parish.security.TenantRef;
import com.parish.security.UnauthenticatedException;
import com.parish.security.audit.AuditAction;
import com.parish.security.audit.AuditRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Issues, validates and stops impersonation grants.
 * <p>
 * A grant is active while {@code now < expiresAt} and it has not been revoked. Starting
 * and stopping are audited with {@link AuditRecorder#recordRequired}: when the audit write
 * fails, the start fails and no credential is handed out, and a stop is undone so the grant
 * stays active until a later stop is audited.
 */
public class ImpersonationManager {

    /** Resource name used in audit entries. */
    public static final String AUDIT_RESOURCE = "Impersonation";

    private static final Logger log = LoggerFactory.getLogger(ImpersonationManager.class);

    private final ImpersonationTokenCodec codec;
    private final ImpersonationRevocations revocations;
    private final TenantDirectory tenantDirectory;
    private final AuditRecorder auditRecorder;
    private final Duration ttl;
    private final Clock clock;

    public ImpersonationManager(ImpersonationTokenCodec codec,
                                ImpersonationRevocations revocations,
                                TenantDirectory tenantDirectory,
                                AuditRecorder auditRecorder,
                                Duration ttl,
                                Clock clock) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        this.codec = codec;
        this.revocations = revocations;
        this.tenantDirectory = tenantDirectory;
        this.auditRecorder = auditRecorder;
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Starts impersonating a tenant.
     *
     * @param actor    the caller, must be a platform-admin context
     * @param tenantId tenant to impersonate
     * @return the signed credential and its grant
     * @throws ForbiddenException if the caller is not a platform admin
     * @throws NotFoundException  if the tenant does not exist
     */
    public ImpersonationToken start(SecurityContext actor, String tenantId) {
        TenantIsolationEnforcer.requirePlatformAdmin(actor);
        TenantRef tenant = tenantDirectory.findTenant(tenantId)
                .orElseThrow(() -> NotFoundException.of("Tenant", tenantId));

        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        ImpersonationGrant grant = new ImpersonationGrant(
                UUID.randomUUID().toString(), actor.email(), tenant.id(), issuedAt, issuedAt.plus(ttl));

        auditRecorder.recordRequired(tenant.id(), AuditAction.IMPERSONATION_STARTED, AUDIT_RESOURCE,
                auditDetails(grant, tenant), actor.email());
        log.info("Impersonation started: grantId={}, tenantId={}, expiresAt={}",
                grant.grantId(), tenant.id(), grant.expiresAt());
        return new ImpersonationToken(codec.encode(grant), grant);
    }

    /**
     * Turns a presented impersonation credential into a tenant-shaped context.
     *
     * @throws UnauthenticatedException if the credential is invalid, expired or revoked,
     *                                  or the tenant no longer exists
     */
    public SecurityContext validate(String token) {
        ImpersonationGrant grant = codec.decode(token);
        if (grant.isExpiredAt(clock.instant())) {
            throw new UnauthenticatedException("Impersonation session expired");
        }
        if (revocations.isRevoked(grant.grantId())) {
            throw new UnauthenticatedException("Impersonation session was ended");
        }
        TenantRef tenant = tenantDirectory.findTenant(grant.tenantId())
                .orElseThrow(() -> new UnauthenticatedException("Impersonated tenant no longer exists"));
        return SecurityContext.impersonation(grant, tenant);
    }

    /**
     * Stops the impersonation session of the calling impersonation context.
     *
     * @return true if the grant was ended by this call
     */
    public boolean stop(SecurityContext caller) {
        if (!caller.isImpersonation()) {
            throw new ForbiddenException("Only an impersonation session can be stopped this way.");
        }
        return revoke(caller.impersonation(), caller.email());
    }

    /**
     * Stops the grant encoded in a credential on behalf of a caller. The caller must be the
     * impersonation session itself or the platform admin the grant was issued to.
     *
     * @return true if the grant was ended by this call, false if it had already ended
     */
    public boolean stop(SecurityContext caller, String token) {
        ImpersonationGrant grant = codec.decode(token);
        boolean sameSession = caller.isImpersonation()
                && caller.impersonation().grantId().equals(grant.grantId());
        boolean owningAdmin = caller.isPlatformAdmin()
                && caller.email().equalsIgnoreCase(grant.superAdminEmail());
        if (!sameSession && !owningAdmin) {
            throw new ForbiddenException("Impersonation session belongs to another operator.");
        }
        return revoke(grant, caller.email());
    }

    public Duration ttl() {
        return ttl;
    }

    private boolean revoke(ImpersonationGrant grant, String actorEmail) {
        if (grant.isExpiredAt(clock.instant())) {
            return false;
        }
        if (!revocations.revoke(grant.grantId(), grant.expiresAt())) {
            return false;
        }
        Map<String, Object> details = auditDetails(grant, null);
        details.put("endedAt", clock.instant().toString());
        try {
            auditRecorder.recordRequired(grant.tenantId(), AuditAction.IMPERSONATION_ENDED, AUDIT_RESOURCE,
                    details, actorEmail);
        } catch (RuntimeException e) {
            revocations.reinstate(grant.grantId());
            log.warn("Impersonation stop rolled back, audit write failed: grantId={}", grant.grantId());
            throw e;
        }
        log.info("Impersonation ended: grantId={}, tenantId={}", grant.grantId(), grant.tenantId());
        return true;
    }

    private static Map<String, Object> auditDetails(ImpersonationGrant grant, TenantRef tenant) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("grantId", grant.grantId());
        details.put("superAdminEmail", grant.superAdminEmail());
        details.put("tenantId", grant.tenantId());
        if (tenant != null) {
            details.put("tenantName", tenant.name());
        }
        details.put("startedAt", grant.issuedAt().toString());
        details.put("expiresAt", grant.expiresAt().toString());
        return details;
    }
}
