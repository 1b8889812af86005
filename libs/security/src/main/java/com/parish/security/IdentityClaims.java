package com.parish.security;

/**
 * Claims returned by the external identity provider for a verified credential.
 *
 * @param subjectId      provider-side subject identifier
 * @param email          email address as reported by the provider (not yet normalized)
 * @param signInProvider sign-in method reported by the provider (e.g. "password", "google.com")
 */
public record IdentityClaims(String subjectId, String email, String signInProvider) {
}
