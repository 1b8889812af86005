package com.parish.governance.domain.services;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.parish.governance.domain.model.Role;
import com.parish.governance.domain.model.TenantUser;
import com.parish.governance.domain.ports.UserRepository;
import com.parish.security.BadRequestException;
import com.parish.security.BranchScopeMode;
import com.parish.security.UserStatus;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("OwnerRetentionPolicy")
class OwnerRetentionPolicyTest {

    private static final String TENANT = "tenant-1";
    private static final Role OWNER = new Role("role-owner", TENANT, "Owner", true, List.of());
    private static final Role ADMIN = new Role("role-admin", TENANT, "Admin", true, List.of());
    private static final Role FAKE_OWNER = new Role("role-custom", TENANT, "owner", false, List.of());

    private final UserRepository users = mock(UserRepository.class);
    private final OwnerRetentionPolicy policy = new OwnerRetentionPolicy(users);

    private static TenantUser user(Role role, UserStatus status) {
        return new TenantUser("user-1", TENANT, "Grace Chapel", "owner@grace.org", "Owner", role.id(), role.name(),
                status, BranchScopeMode.ALL, null, List.of(), Instant.EPOCH, null, null, null, Instant.EPOCH);
    }

    @Nested
    @DisplayName("sole active owner")
    class SoleOwner {

        @Test
        @DisplayName("cannot be demoted")
        void cannotBeDemoted() {
            when(users.countActiveOwners(TENANT)).thenReturn(1L);

            assertThatThrownBy(() -> policy.assertRetained(user(OWNER, UserStatus.ACTIVE), ADMIN, UserStatus.ACTIVE))
                    .isInstanceOf(BadRequestException.class)
                    .hasMessage(OwnerRetentionPolicy.LAST_OWNER);
        }

        @Test
        @DisplayName("cannot be suspended")
        void cannotBeSuspended() {
            when(users.countActiveOwners(TENANT)).thenReturn(1L);

            assertThatThrownBy(() -> policy.assertRetained(user(OWNER, UserStatus.ACTIVE), OWNER, UserStatus.SUSPENDED))
                    .isInstanceOf(BadRequestException.class);
        }

        @Test
        @DisplayName("cannot be moved to a custom role that merely looks like Owner")
        void customOwnerLookalikeDoesNotCount() {
            when(users.countActiveOwners(TENANT)).thenReturn(1L);

            assertThatThrownBy(() -> policy.assertRetained(user(OWNER, UserStatus.ACTIVE), FAKE_OWNER, UserStatus.ACTIVE))
                    .isInstanceOf(BadRequestException.class);
        }

        @Test
        @DisplayName("invited owners count as well")
        void invitedOwnerCounts() {
            when(users.countActiveOwners(TENANT)).thenReturn(1L);

            assertThatThrownBy(() -> policy.assertRetained(user(OWNER, UserStatus.INVITED), ADMIN, UserStatus.INVITED))
                    .isInstanceOf(BadRequestException.class);
        }
    }

    @Test
    @DisplayName("allows demoting one of two active owners")
    void allowsDemotionWithAnotherOwner() {
        when(users.countActiveOwners(TENANT)).thenReturn(2L);

        assertThatCode(() -> policy.assertRetained(user(OWNER, UserStatus.ACTIVE), ADMIN, UserStatus.ACTIVE))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("skips the count when the user stays an active owner")
    void ownerStaysOwner() {
        policy.assertRetained(user(OWNER, UserStatus.ACTIVE), OWNER, UserStatus.ACTIVE);

        verifyNoInteractions(users);
    }

    @Test
    @DisplayName("skips the count for users that are not active owners")
    void nonOwnerChanges() {
        policy.assertRetained(user(ADMIN, UserStatus.ACTIVE), ADMIN, UserStatus.SUSPENDED);
        policy.assertRetained(user(OWNER, UserStatus.SUSPENDED), ADMIN, UserStatus.SUSPENDED);

        verifyNoInteractions(users);
    }
}
