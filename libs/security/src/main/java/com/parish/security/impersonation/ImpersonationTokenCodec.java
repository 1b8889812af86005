package com.parish.security.impersonation;

import com.parish.security.UnauthenticatedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;

/**
 * Encodes {@link ImpersonationGrant}s as self-contained signed credentials and verifies
 * them again on every request.
 * <p>
 * Format: {@code imp_<compact HS256 JWS>} with {@code jti} = grant id, {@code sub} = operator
 * email, a {@code tenantId} claim and {@code iat}/{@code exp} for the window. The prefix lets
 * the session resolver route the credential without calling the identity provider.
 * JWT timestamps have second precision, so grants are issued on whole seconds.
 */
public final class ImpersonationTokenCodec {

    /** Prefix that marks an impersonation credential. */
    public static final String PREFIX = "imp_";

    static final String TENANT_CLAIM = "tenantId";

    private static final int MIN_SECRET_LENGTH = 32;

    private final SecretKey key;
    private final JwtParser parser;

    /**
     * @param secret signing secret, at least 32 characters
     */
    public ImpersonationTokenCodec(String secret) {
        this(secret, Clock.systemUTC());
    }

    /**
     * @param secret signing secret, at least 32 characters
     * @param clock  clock the parser checks {@code exp} against
     */
    public ImpersonationTokenCodec(String secret, Clock clock) {
        if (secret == null || secret.length() < MIN_SECRET_LENGTH) {
            throw new IllegalArgumentException(
                    "impersonation secret must be at least " + MIN_SECRET_LENGTH + " characters");
        }
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.parser = Jwts.parser()
                .verifyWith(key)
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    public static boolean isImpersonationToken(String token) {
        return token != null && token.startsWith(PREFIX);
    }

    /**
     * Serializes and signs a grant.
     *
     * @param grant the grant to encode
     * @return the credential string
     */
    public String encode(ImpersonationGrant grant) {
        return PREFIX + Jwts.builder()
                .id(grant.grantId())
                .subject(grant.superAdminEmail())
                .claim(TENANT_CLAIM, grant.tenantId())
                .issuedAt(Date.from(grant.issuedAt()))
                .expiration(Date.from(grant.expiresAt()))
                .signWith(key)
                .compact();
    }

    /**
     * Verifies the signature and decodes the grant. Expiry and revocation are judged by the
     * caller, so an expired but authentic credential still decodes.
     *
     * @param token the presented credential
     * @return the grant
     * @throws UnauthenticatedException if the credential is malformed or the signature does not match
     */
    public ImpersonationGrant decode(String token) {
        if (!isImpersonationToken(token)) {
            throw new UnauthenticatedException("Not an impersonation token");
        }
        Claims claims;
        try {
            claims = parser.parseSignedClaims(token.substring(PREFIX.length())).getPayload();
        } catch (ExpiredJwtException e) {
            // signature was verified before the exp check
            claims = e.getClaims();
        } catch (SignatureException e) {
            throw new UnauthenticatedException("Invalid impersonation token signature", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new UnauthenticatedException("Malformed impersonation token", e);
        }
        return toGrant(claims);
    }

    private static ImpersonationGrant toGrant(Claims claims) {
        try {
            return new ImpersonationGrant(
                    claims.getId(),
                    claims.getSubject(),
                    claims.get(TENANT_CLAIM, String.class),
                    toInstant(claims.getIssuedAt()),
                    toInstant(claims.getExpiration()));
        } catch (IllegalArgumentException | JwtException e) {
            throw new UnauthenticatedException("Malformed impersonation token payload", e);
        }
    }

    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }
}
