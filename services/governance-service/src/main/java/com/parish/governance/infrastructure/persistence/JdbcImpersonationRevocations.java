package com.parish.governance.infrastructure.persistence;

import com.parish.security.impersonation.ImpersonationRevocations;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Store-backed revocation list. Rows are kept until the grant would have expired anyway,
 * then purged on the next revocation.
 */
@Repository
public class JdbcImpersonationRevocations implements ImpersonationRevocations {

    private static final Logger log = LoggerFactory.getLogger(JdbcImpersonationRevocations.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;

    public JdbcImpersonationRevocations(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    @Override
    public boolean revoke(String grantId, Instant expiresAt) {
        Instant now = clock.instant();
        int purged = jdbc.update("DELETE FROM impersonation_revocations WHERE expires_at < :now",
                Map.of("now", JdbcSupport.timestamp(now)));
        if (purged > 0) {
            log.debug("Purged {} expired impersonation revocations", purged);
        }
        try {
            jdbc.update("""
                            INSERT INTO impersonation_revocations (grant_id, expires_at, revoked_at)
                            VALUES (:grantId, :expiresAt, :revokedAt)
                            """,
                    new MapSqlParameterSource()
                            .addValue("grantId", grantId)
                            .addValue("expiresAt", JdbcSupport.timestamp(expiresAt))
                            .addValue("revokedAt", JdbcSupport.timestamp(now)));
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("Impersonation grant {} already revoked", grantId);
            return false;
        }
    }

    @Override
    public void reinstate(String grantId) {
        jdbc.update("DELETE FROM impersonation_revocations WHERE grant_id = :grantId",
                Map.of("grantId", grantId));
    }

    @Override
    public boolean isRevoked(String grantId) {
        List<String> rows = jdbc.queryForList(
                "SELECT grant_id FROM impersonation_revocations WHERE grant_id = :grantId",
                Map.of("grantId", grantId), String.class);
        return !rows.isEmpty();
    }
}
