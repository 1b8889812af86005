package com.parish.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Extracts bearer credentials from HTTP Authorization headers.
 */
public final class BearerTokenExtractor {

    private static final String SCHEME = "bearer";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * Extracts the credential from an Authorization header value of the form
     * {@code "Bearer <token>"}. The scheme is matched case-insensitively and must be
     * followed by whitespace.
     *
     * @param authorizationHeader the full Authorization header value (may be null)
     * @return the token, or empty if the header is missing or malformed
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (trimmed.length() <= SCHEME.length()
                || !trimmed.substring(0, SCHEME.length()).toLowerCase(Locale.ROOT).equals(SCHEME)
                || !Character.isWhitespace(trimmed.charAt(SCHEME.length()))) {
            return Optional.empty();
        }
        String token = trimmed.substring(SCHEME.length()).strip();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
