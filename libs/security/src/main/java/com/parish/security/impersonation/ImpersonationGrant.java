package com.parish.security.impersonation;

import java.time.Instant;

/**
 * A time-boxed permission for one platform operator to act inside one tenant.
 * <p>
 * Grants are never mutated. A grant ends either when {@code expiresAt} is reached or
 * when it is revoked through an explicit stop.
 *
 * @param grantId         unique grant identifier, used for revocation
 * @param superAdminEmail normalized email of the platform operator
 * @param tenantId        tenant being impersonated
 * @param issuedAt        start of the window
 * @param expiresAt       end of the window (exclusive)
 */
public record ImpersonationGrant(
        String grantId,
        String superAdminEmail,
        String tenantId,
        Instant issuedAt,
        Instant expiresAt
) {

    public ImpersonationGrant {
        requireText(grantId, "grantId");
        requireText(superAdminEmail, "superAdminEmail");
        requireText(tenantId, "tenantId");
        if (issuedAt == null || expiresAt == null) {
            throw new IllegalArgumentException("issuedAt and expiresAt must not be null");
        }
        if (!expiresAt.isAfter(issuedAt)) {
            throw new IllegalArgumentException("expiresAt must be after issuedAt");
        }
    }

    /**
     * A grant is expired from {@code expiresAt} onwards.
     */
    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be null or blank");
        }
    }
}
