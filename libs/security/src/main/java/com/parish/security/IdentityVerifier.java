package com.parish.security;

/**
 * Port to the external identity provider.
 * <p>
 * Implementations must fail closed: an invalid, expired or unverifiable credential, a
 * timeout and any transport error all surface as {@link UnauthenticatedException}.
 */
public interface IdentityVerifier {

    /**
     * Verifies an opaque bearer credential.
     *
     * @param token the credential as presented by the client
     * @return the verified claims
     * @throws UnauthenticatedException if the credential cannot be verified
     */
    IdentityClaims verify(String token);
}
