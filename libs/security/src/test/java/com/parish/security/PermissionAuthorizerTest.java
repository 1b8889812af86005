package com.parish.security;

import com.parish.security.testing.TestSecurityContextFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PermissionAuthorizer")
class PermissionAuthorizerTest {

    private final SecurityContext staff = TestSecurityContextFactory.tenantUser(
            "tenant-1", Permissions.MEMBERS_MANAGE, Permissions.REPORTS_VIEW);

    @Nested
    @DisplayName("authorize()")
    class Authorize {

        @Test
        @DisplayName("allows an empty requirement for any context")
        void emptyRequirement() {
            var admin = TestSecurityContextFactory.platformAdmin("ops@parish.test");

            assertThatCode(() -> PermissionAuthorizer.authorize(admin, Set.of())).doesNotThrowAnyException();
            assertThatCode(() -> PermissionAuthorizer.authorize(staff, null)).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("allows when every required permission is held")
        void subsetHeld() {
            assertThatCode(() -> PermissionAuthorizer.authorize(staff,
                    Set.of(Permissions.MEMBERS_MANAGE, Permissions.REPORTS_VIEW)))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("rejects and names every missing permission")
        void namesMissing() {
            assertThatThrownBy(() -> PermissionAuthorizer.authorize(staff,
                    Set.of(Permissions.MEMBERS_MANAGE, Permissions.ROLES_MANAGE, Permissions.BRANCHES_MANAGE)))
                    .isInstanceOf(ForbiddenException.class)
                    .hasMessage("Missing permission: branches.manage, roles.manage");
        }

        @Test
        @DisplayName("manage does not imply view")
        void noHierarchy() {
            assertThat(PermissionAuthorizer.isAuthorized(staff, Set.of(Permissions.MEMBERS_VIEW))).isFalse();
        }

        @Test
        @DisplayName("the wildcard satisfies every requirement")
        void wildcard() {
            var impersonation = TestSecurityContextFactory.impersonation("tenant-1", "ops@parish.test");

            assertThat(PermissionAuthorizer.isAuthorized(impersonation, Set.copyOf(Permissions.CATALOG))).isTrue();
        }

        @Test
        @DisplayName("platform admins hold no tenant permission")
        void platformAdminHasNone() {
            var admin = TestSecurityContextFactory.platformAdmin("ops@parish.test");

            assertThat(PermissionAuthorizer.missing(admin, Set.of(Permissions.USERS_MANAGE)))
                    .containsExactly(Permissions.USERS_MANAGE);
        }
    }
}
