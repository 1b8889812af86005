package com.parish.security.branch;

import com.parish.security.BadRequestException;
import com.parish.security.ForbiddenException;
import com.parish.security.SecurityContext;
import com.parish.security.testing.TestSecurityContextFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BranchScopeResolver")
class BranchScopeResolverTest {

    private final SecurityContext unrestricted = TestSecurityContextFactory.tenantUser("tenant-1");
    private final SecurityContext singleGrant = TestSecurityContextFactory.restrictedUser("tenant-1", List.of("A"));
    private final SecurityContext twoGrants = TestSecurityContextFactory.restrictedUser("tenant-1", List.of("A", "C"));

    @Nested
    @DisplayName("read scope")
    class Read {

        @Test
        @DisplayName("unrestricted context passes the requested branch through")
        void unrestrictedRequested() {
            assertThat(BranchScopeResolver.resolveReadScope(unrestricted, "Z")).isEqualTo(BranchScope.single("Z"));
        }

        @Test
        @DisplayName("unrestricted context without a branch reads every branch")
        void unrestrictedAll() {
            assertThat(BranchScopeResolver.resolveReadScope(unrestricted, "  ").isUnfiltered()).isTrue();
        }

        @Test
        @DisplayName("restricted context reads a granted branch")
        void restrictedGranted() {
            assertThat(BranchScopeResolver.resolveReadScope(twoGrants, " C ")).isEqualTo(BranchScope.single("C"));
        }

        @Test
        @DisplayName("restricted context is refused a branch outside its grants")
        void restrictedOutside() {
            assertThatThrownBy(() -> BranchScopeResolver.resolveReadScope(singleGrant, "B"))
                    .isInstanceOf(ForbiddenException.class)
                    .hasMessageContaining("outside your allowed scope")
                    .hasMessageContaining("B");
        }

        @Test
        @DisplayName("a single grant is selected automatically")
        void singleGrantNarrowed() {
            assertThat(BranchScopeResolver.resolveReadScope(singleGrant, null)).isEqualTo(BranchScope.single("A"));
        }

        @Test
        @DisplayName("several grants are returned as a set, never one arbitrary pick")
        void severalGrants() {
            BranchScope scope = BranchScopeResolver.resolveReadScope(twoGrants, null);

            assertThat(scope.branchId()).isNull();
            assertThat(scope.allowedBranchIds()).containsExactly("A", "C");
        }

        @Test
        @DisplayName("restricted context without grants is refused")
        void noGrants() {
            var ctx = new SecurityContext(singleGrant.kind(), singleGrant.subjectId(), singleGrant.email(),
                    singleGrant.tenantId(), singleGrant.tenantName(), singleGrant.userId(), singleGrant.roleId(),
                    singleGrant.roleName(), singleGrant.permissions(), singleGrant.userStatus(),
                    singleGrant.branchScopeMode(), List.of(), null, singleGrant.identityProvider(), null);

            assertThatThrownBy(() -> BranchScopeResolver.resolveReadScope(ctx, null))
                    .isInstanceOf(ForbiddenException.class)
                    .hasMessage("No branch access assigned for this account.");
        }

        @Test
        @DisplayName("platform admins must impersonate first")
        void platformAdmin() {
            var admin = TestSecurityContextFactory.platformAdmin("ops@parish.test");

            assertThatThrownBy(() -> BranchScopeResolver.resolveReadScope(admin, "A"))
                    .isInstanceOf(ForbiddenException.class);
        }
    }

    @Nested
    @DisplayName("write scope")
    class Write {

        @Test
        @DisplayName("unrestricted context may write without a branch")
        void unrestrictedNoBranch() {
            assertThat(BranchScopeResolver.resolveWriteScope(unrestricted, null).isUnfiltered()).isTrue();
        }

        @Test
        @DisplayName("impersonation is never rejected on branch grounds")
        void impersonation() {
            var ctx = TestSecurityContextFactory.impersonation("tenant-1", "ops@parish.test");

            assertThat(BranchScopeResolver.resolveWriteScope(ctx, "anything")).isEqualTo(BranchScope.single("anything"));
        }

        @Test
        @DisplayName("restricted context must name a branch")
        void restrictedMissing() {
            assertThatThrownBy(() -> BranchScopeResolver.resolveWriteScope(singleGrant, " "))
                    .isInstanceOf(BadRequestException.class)
                    .hasMessageContaining("Branch is required");
        }

        @Test
        @DisplayName("restricted context cannot write outside its grants")
        void restrictedOutside() {
            assertThatThrownBy(() -> BranchScopeResolver.resolveWriteScope(twoGrants, "B"))
                    .isInstanceOf(ForbiddenException.class);
        }

        @Test
        @DisplayName("restricted context writes a granted branch")
        void restrictedGranted() {
            assertThat(BranchScopeResolver.resolveWriteScope(twoGrants, "A")).isEqualTo(BranchScope.single("A"));
        }
    }

    @Test
    @DisplayName("scope cannot name a single branch and a set at once")
    void exclusiveFields() {
        assertThatThrownBy(() -> new BranchScope("A", List.of("B")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
