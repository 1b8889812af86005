package com.parish.governance.api.dto;

import com.parish.security.impersonation.ImpersonationToken;
import java.time.Instant;

/**
 * The credential of a new impersonation session. Only returned once.
 */
public record ImpersonationStartResponse(
        String token,
        String grantId,
        String tenantId,
        Instant startedAt,
        Instant expiresAt) {

    public static ImpersonationStartResponse from(ImpersonationToken issued) {
        return new ImpersonationStartResponse(
                issued.token(),
                issued.grant().grantId(),
                issued.grant().tenantId(),
                issued.grant().issuedAt(),
                issued.grant().expiresAt());
    }

    @Override
    public String toString() {
        return "ImpersonationStartResponse[grantId=" + grantId + ", tenantId=" + tenantId + "]";
    }
}
