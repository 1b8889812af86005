package com.parish.security.impersonation;

import java.time.Instant;

/**
 * Server-side record of impersonation grants that were stopped before they expired.
 * Entries only need to be kept until the grant's natural expiry.
 */
public interface ImpersonationRevocations {

    /**
     * Marks a grant as revoked.
     *
     * @param grantId   grant to revoke
     * @param expiresAt the grant's natural expiry
     * @return true if the grant was newly revoked, false if it already was
     */
    boolean revoke(String grantId, Instant expiresAt);

    /**
     * Undoes a revocation whose stop could not be completed.
     *
     * @param grantId grant to make active again
     */
    void reinstate(String grantId);

    boolean isRevoked(String grantId);
}
