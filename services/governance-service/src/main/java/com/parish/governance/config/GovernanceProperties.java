package com.parish.governance.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for the governance service, bound from {@code parish.governance.*}
 * and validated at startup.
 *
 * <pre>
 * parish:
 *   governance:
 *     name: governance-service
 *     environment: production
 *     platform-admin-emails: [ops@parish.app]
 *     impersonation:
 *       secret: ${IMPERSONATION_SECRET}
 *       ttl: PT30M
 *     identity:
 *       verify-url: https://identity.internal/v1/verify
 *       timeout: PT5S
 *     cors-origins: [http://localhost:3000]
 * </pre>
 *
 * @param name                service name used for logging and metrics. Required.
 * @param environment         deployment environment (development, staging, production)
 * @param platformAdminEmails emails of platform operators
 * @param impersonation       impersonation signing and lifetime
 * @param identity            identity provider endpoint
 * @param corsOrigins         origins allowed to call {@code /api/**} and {@code /auth/**}
 */
@ConfigurationProperties(prefix = "parish.governance")
@Validated
public record GovernanceProperties(
        @NotBlank String name,
        String environment,
        List<String> platformAdminEmails,
        @Valid Impersonation impersonation,
        @Valid Identity identity,
        List<String> corsOrigins) {

    /** Applies defaults for optional fields before Bean Validation runs. */
    public GovernanceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        platformAdminEmails = platformAdminEmails == null ? List.of() : List.copyOf(platformAdminEmails);
        if (impersonation == null) {
            impersonation = new Impersonation(null, null);
        }
        if (identity == null) {
            identity = new Identity(null, null);
        }
        corsOrigins = corsOrigins == null
                ? List.of("http://localhost:3000", "http://localhost:5173")
                : List.copyOf(corsOrigins);
    }

    /**
     * @param secret HMAC secret used to sign impersonation credentials, at least 32 characters
     * @param ttl    lifetime of an impersonation grant (default 30 minutes)
     */
    public record Impersonation(@NotBlank @Size(min = 32) String secret, Duration ttl) {

        public Impersonation {
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                ttl = Duration.ofMinutes(30);
            }
        }
    }

    /**
     * @param verifyUrl endpoint that verifies bearer credentials and returns identity claims
     * @param timeout   connect and read timeout for verification calls (default 5 seconds)
     */
    public record Identity(@NotBlank String verifyUrl, @NotNull Duration timeout) {

        public Identity {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                timeout = Duration.ofSeconds(5);
            }
        }
    }
}
