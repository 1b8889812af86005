package com.parish.security;

import com.parish.observability.SensitiveDataRedactor;
import com.parish.security.audit.AuditRecorder;
import com.parish.security.impersonation.ImpersonationManager;
import com.parish.security.impersonation.ImpersonationToken;
import com.parish.security.impersonation.ImpersonationTokenCodec;
import com.parish.security.testing.InMemoryAuditSink;
import com.parish.security.testing.InMemoryImpersonationRevocations;
import com.parish.security.testing.InMemoryTenantDirectory;
import com.parish.security.testing.MutableClock;
import com.parish.security.testing.TestSecurityContextFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SessionResolver")
class SessionResolverTest {

    private static final String SECRET = "0123456789abcdef0123456789abcdef";

    @Mock
    private IdentityVerifier identityVerifier;

    private InMemoryTenantDirectory directory;
    private MutableClock clock;
    private ImpersonationManager impersonationManager;
    private SessionResolver resolver;

    @BeforeEach
    void setUp() {
        directory = new InMemoryTenantDirectory()
                .addTenant(new TenantRef("tenant-1", "Grace Chapel", "Active"));
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        impersonationManager = new ImpersonationManager(
                new ImpersonationTokenCodec(SECRET, clock),
                new InMemoryImpersonationRevocations(),
                directory,
                new AuditRecorder(new InMemoryAuditSink(), new SensitiveDataRedactor(), clock),
                Duration.ofMinutes(30),
                clock);
        resolver = new SessionResolver(identityVerifier, directory,
                PlatformAdminAllowList.of(List.of("Ops@Parish.Test")), impersonationManager);
    }

    private LinkedAccount account(String email, UserStatus status, BranchScopeMode mode, List<String> grants) {
        return new LinkedAccount("user-1", "tenant-1", "Grace Chapel", email, status, "role-1", "Staff",
                Set.of(Permissions.MEMBERS_MANAGE), mode, grants, grants.isEmpty() ? null : grants.get(0));
    }

    @Nested
    @DisplayName("identity credentials")
    class Identity {

        @Test
        @DisplayName("normalizes the email and builds a tenant-user context")
        void tenantUser() {
            directory.addAccount(account("jane@grace.org", UserStatus.ACTIVE, BranchScopeMode.RESTRICTED,
                    List.of("b-1", "b-2")));
            when(identityVerifier.verify("tok")).thenReturn(new IdentityClaims("sub-1", "  Jane@Grace.ORG ", "password"));

            SecurityContext ctx = resolver.resolveContext("tok");

            assertThat(ctx.kind()).isEqualTo(SessionKind.TENANT_USER);
            assertThat(ctx.email()).isEqualTo("jane@grace.org");
            assertThat(ctx.tenantId()).isEqualTo("tenant-1");
            assertThat(ctx.userId()).isEqualTo("user-1");
            assertThat(ctx.permissions()).containsExactly(Permissions.MEMBERS_MANAGE);
            assertThat(ctx.branchScopeMode()).isEqualTo(BranchScopeMode.RESTRICTED);
            assertThat(ctx.allowedBranchIds()).containsExactly("b-1", "b-2");
            assertThat(ctx.defaultBranchId()).isEqualTo("b-1");
            assertThat(ctx.identityProvider()).isEqualTo("password");
        }

        @Test
        @DisplayName("allow-listed email becomes a platform admin without a directory lookup")
        void platformAdmin() {
            directory.addAccount(account("ops@parish.test", UserStatus.ACTIVE, BranchScopeMode.ALL, List.of()));
            when(identityVerifier.verify("tok")).thenReturn(new IdentityClaims("sub-ops", "OPS@parish.test", "google.com"));

            SecurityContext ctx = resolver.resolveContext("tok");

            assertThat(ctx.isPlatformAdmin()).isTrue();
            assertThat(ctx.tenantId()).isNull();
            assertThat(ctx.permissions()).isEmpty();
        }

        @Test
        @DisplayName("invited users resolve without being activated")
        void invitedUser() {
            directory.addAccount(account("new@grace.org", UserStatus.INVITED, BranchScopeMode.ALL, List.of()));
            when(identityVerifier.verify("tok")).thenReturn(new IdentityClaims("sub-2", "new@grace.org", "password"));

            assertThat(resolver.resolveContext("tok").userStatus()).isEqualTo(UserStatus.INVITED);
        }

        @Test
        @DisplayName("unknown email is not linked")
        void notLinked() {
            when(identityVerifier.verify("tok")).thenReturn(new IdentityClaims("sub-3", "stranger@x.org", "password"));

            assertThatThrownBy(() -> resolver.resolveContext("tok")).isInstanceOf(AccountNotLinkedException.class);
        }

        @Test
        @DisplayName("suspended user is rejected")
        void suspended() {
            directory.addAccount(account("gone@grace.org", UserStatus.SUSPENDED, BranchScopeMode.ALL, List.of()));
            when(identityVerifier.verify("tok")).thenReturn(new IdentityClaims("sub-4", "gone@grace.org", "password"));

            assertThatThrownBy(() -> resolver.resolveContext("tok")).isInstanceOf(AccountSuspendedException.class);
        }

        @Test
        @DisplayName("restricted user without active grants has no branch access")
        void noBranchAccess() {
            directory.addAccount(account("lost@grace.org", UserStatus.ACTIVE, BranchScopeMode.RESTRICTED, List.of()));
            when(identityVerifier.verify("tok")).thenReturn(new IdentityClaims("sub-5", "lost@grace.org", "password"));

            assertThatThrownBy(() -> resolver.resolveContext("tok")).isInstanceOf(NoBranchAccessException.class);
        }

        @Test
        @DisplayName("unexpected verifier failures fail closed")
        void verifierCrash() {
            when(identityVerifier.verify("tok")).thenThrow(new IllegalStateException("connection reset"));

            assertThatThrownBy(() -> resolver.resolveContext("tok"))
                    .isInstanceOf(UnauthenticatedException.class)
                    .hasCauseInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("claims without an email are rejected")
        void missingEmail() {
            when(identityVerifier.verify("tok")).thenReturn(new IdentityClaims("sub-6", " ", "password"));

            assertThatThrownBy(() -> resolver.resolveContext("tok")).isInstanceOf(UnauthenticatedException.class);
        }
    }

    @Nested
    @DisplayName("missing credentials")
    class Missing {

        @Test
        @DisplayName("blank credential is unauthenticated")
        void blank() {
            assertThatThrownBy(() -> resolver.resolveContext("  "))
                    .isInstanceOf(UnauthenticatedException.class)
                    .hasMessage("Missing authorization token");
            verify(identityVerifier, never()).verify(anyString());
        }

        @Test
        @DisplayName("header without a bearer scheme is unauthenticated")
        void badHeader() {
            assertThatThrownBy(() -> resolver.resolveAuthorizationHeader("Basic abc"))
                    .isInstanceOf(UnauthenticatedException.class);
        }
    }

    @Nested
    @DisplayName("impersonation credentials")
    class Impersonation {

        @Test
        @DisplayName("resolve to a full-authority context without calling the identity provider")
        void impersonationContext() {
            ImpersonationToken token = impersonationManager.start(
                    TestSecurityContextFactory.platformAdmin("ops@parish.test"), "tenant-1");

            SecurityContext ctx = resolver.resolveAuthorizationHeader("Bearer " + token.token());

            assertThat(ctx.kind()).isEqualTo(SessionKind.IMPERSONATION);
            assertThat(ctx.tenantId()).isEqualTo("tenant-1");
            assertThat(ctx.tenantName()).isEqualTo("Grace Chapel");
            assertThat(ctx.subjectId()).isEqualTo("impersonation:tenant-1");
            assertThat(ctx.email()).isEqualTo("ops@parish.test");
            assertThat(ctx.roleName()).isEqualTo("Impersonation");
            assertThat(ctx.permissions()).containsExactly(PermissionAuthorizer.WILDCARD);
            assertThat(ctx.branchScopeMode()).isEqualTo(BranchScopeMode.ALL);
            assertThat(ctx.identityProvider()).isEqualTo("impersonation");
            verify(identityVerifier, never()).verify(anyString());
        }

        @Test
        @DisplayName("expired credential is unauthenticated")
        void expired() {
            ImpersonationToken token = impersonationManager.start(
                    TestSecurityContextFactory.platformAdmin("ops@parish.test"), "tenant-1");
            clock.advance(Duration.ofMinutes(30));

            assertThatThrownBy(() -> resolver.resolveContext(token.token()))
                    .isInstanceOf(UnauthenticatedException.class)
                    .hasMessageContaining("expired");
        }
    }
}
