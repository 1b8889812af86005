package com.parish.security.impersonation;

/**
 * A signed impersonation credential together with the grant it encodes.
 *
 * @param token the credential handed to the platform operator
 * @param grant the decoded grant
 */
public record ImpersonationToken(String token, ImpersonationGrant grant) {

    @Override
    public String toString() {
        return "ImpersonationToken[grant=" + grant + "]";
    }
}
