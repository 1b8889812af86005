package com.parish.governance.api.dto;

import com.parish.security.SecurityContext;
import com.parish.security.impersonation.ImpersonationGrant;
import java.time.Instant;
import java.util.List;

/**
 * Flattened session as returned to clients after sign-in.
 *
 * @param kind             session kind
 * @param subjectId        identity-provider subject
 * @param email            normalized email
 * @param platformAdmin    true for platform-admin sessions
 * @param tenantId         tenant acted on, absent for platform admins
 * @param tenantName       tenant display name
 * @param userId           tenant user id
 * @param roleId           role id
 * @param roleName         role name
 * @param permissions      granted permissions, sorted
 * @param status           user status
 * @param branchScopeMode  ALL or RESTRICTED
 * @param allowedBranchIds granted branches
 * @param defaultBranchId  preferred branch
 * @param identityProvider sign-in provider
 * @param impersonation    window of an impersonation session
 */
public record SessionResponse(
        String kind,
        String subjectId,
        String email,
        boolean platformAdmin,
        String tenantId,
        String tenantName,
        String userId,
        String roleId,
        String roleName,
        List<String> permissions,
        String status,
        String branchScopeMode,
        List<String> allowedBranchIds,
        String defaultBranchId,
        String identityProvider,
        ImpersonationWindow impersonation) {

    public static SessionResponse from(SecurityContext context) {
        ImpersonationGrant grant = context.impersonation();
        return new SessionResponse(
                context.kind().name(),
                context.subjectId(),
                context.email(),
                context.isPlatformAdmin(),
                context.tenantId(),
                context.tenantName(),
                context.userId(),
                context.roleId(),
                context.roleName(),
                context.permissions().stream().sorted().toList(),
                context.userStatus() == null ? null : context.userStatus().value(),
                context.branchScopeMode().name(),
                context.allowedBranchIds(),
                context.defaultBranchId(),
                context.identityProvider(),
                grant == null ? null : ImpersonationWindow.from(grant));
    }

    public record ImpersonationWindow(String grantId, String superAdminEmail, Instant startedAt, Instant expiresAt) {

        static ImpersonationWindow from(ImpersonationGrant grant) {
            return new ImpersonationWindow(grant.grantId(), grant.superAdminEmail(), grant.issuedAt(),
                    grant.expiresAt());
        }
    }
}
