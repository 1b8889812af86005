package com.parish.governance.infrastructure.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import com.parish.governance.IntegrationTestSupport;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

@DisplayName("JdbcImpersonationRevocations")
class JdbcImpersonationRevocationsTest extends IntegrationTestSupport {

    @Autowired private JdbcImpersonationRevocations revocations;

    @Test
    @DisplayName("a reinstated grant is active again and can be revoked once more")
    void reinstate() {
        String grantId = UUID.randomUUID().toString();
        Instant expiresAt = Instant.now().plus(Duration.ofMinutes(30));

        assertThat(revocations.revoke(grantId, expiresAt)).isTrue();
        assertThat(revocations.revoke(grantId, expiresAt)).isFalse();

        revocations.reinstate(grantId);

        assertThat(revocations.isRevoked(grantId)).isFalse();
        assertThat(revocations.revoke(grantId, expiresAt)).isTrue();
        assertThat(revocations.isRevoked(grantId)).isTrue();
    }
}
