package com.parish.governance.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.parish.governance.GovernanceFixture;
import com.parish.governance.IntegrationTestSupport;
import com.parish.security.BranchScopeMode;
import com.parish.security.Permissions;
import com.parish.security.SystemRole;
import com.parish.security.UserStatus;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

@DisplayName("/api/v1/users")
class UserControllerTest extends IntegrationTestSupport {

    private static final String LAST_OWNER = "Cannot remove or suspend the last active Owner in this tenant.";

    private String tenantId;
    private Map<SystemRole, String> roles;
    private String ownerId;
    private String ownerAuth;
    private String branchA;
    private String branchB;

    @BeforeEach
    void setUp() {
        tenantId = fixture.tenant("Grace Chapel");
        roles = fixture.systemRoles(tenantId);
        branchA = fixture.branch(tenantId, "Downtown");
        branchB = fixture.branch(tenantId, "Riverside");
        String owner = GovernanceFixture.uniqueEmail("owner");
        ownerId = fixture.user(tenantId, owner, roles.get(SystemRole.OWNER), UserStatus.ACTIVE);
        ownerAuth = bearer(owner);
    }

    private String body(String json) {
        return json.replace('\'', '"');
    }

    @Nested
    @DisplayName("owner retention")
    class OwnerRetention {

        @Test
        @DisplayName("the sole owner cannot demote themselves")
        void soleOwnerDemotion() throws Exception {
            mockMvc.perform(patch("/api/v1/users/" + ownerId + "/role")
                            .header("Authorization", ownerAuth)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body("{'roleId':'" + roles.get(SystemRole.ADMIN) + "'}")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail").value(LAST_OWNER));

            assertThat(fixture.userRoleId(ownerId)).isEqualTo(roles.get(SystemRole.OWNER));
        }

        @Test
        @DisplayName("the sole owner cannot be suspended")
        void soleOwnerSuspension() throws Exception {
            mockMvc.perform(post("/api/v1/users/" + ownerId + "/suspend").header("Authorization", ownerAuth))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail").value(LAST_OWNER));
        }

        @Test
        @DisplayName("one of two owners can be demoted")
        void secondOwner() throws Exception {
            var second = fixture.user(tenantId, GovernanceFixture.uniqueEmail("co-owner"),
                    roles.get(SystemRole.OWNER), UserStatus.ACTIVE);

            mockMvc.perform(patch("/api/v1/users/" + second + "/role")
                            .header("Authorization", ownerAuth)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body("{'roleId':'" + roles.get(SystemRole.ADMIN) + "'}")))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.roleName").value("Admin"));

            assertThat(fixture.auditActions(tenantId)).containsExactly("USER_UPDATED");
        }

        @Test
        @DisplayName("a suspended owner does not count")
        void suspendedOwnerDoesNotCount() throws Exception {
            fixture.user(tenantId, GovernanceFixture.uniqueEmail("away"), roles.get(SystemRole.OWNER),
                    UserStatus.SUSPENDED);

            mockMvc.perform(patch("/api/v1/users/" + ownerId)
                            .header("Authorization", ownerAuth)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body("{'status':'Suspended'}")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail").value(LAST_OWNER));
        }
    }

    @Nested
    @DisplayName("inviting")
    class Inviting {

        @Test
        @DisplayName("invites a restricted user with a default branch")
        void invitesRestricted() throws Exception {
            var email = GovernanceFixture.uniqueEmail("usher");

            mockMvc.perform(post("/api/v1/users")
                            .header("Authorization", ownerAuth)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body("{'email':'" + email.toUpperCase() + "','name':'Usher','roleId':'"
                                    + roles.get(SystemRole.VIEWER) + "','branchScopeMode':'RESTRICTED',"
                                    + "'branchIds':['" + branchB + "','" + branchA + "'],'defaultBranchId':'"
                                    + branchA + "'}")))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.email").value(email))
                    .andExpect(jsonPath("$.status").value("Invited"))
                    .andExpect(jsonPath("$.branchIds[0]").value(branchB))
                    .andExpect(jsonPath("$.defaultBranchId").value(branchA));

            assertThat(fixture.auditActions(tenantId)).containsExactly("USER_INVITED");
        }

        @Test
        @DisplayName("restricted invitations need at least one branch")
        void restrictedWithoutBranches() throws Exception {
            mockMvc.perform(post("/api/v1/users")
                            .header("Authorization", ownerAuth)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body("{'email':'" + GovernanceFixture.uniqueEmail("x") + "','name':'X','roleId':'"
                                    + roles.get(SystemRole.VIEWER) + "','branchScopeMode':'RESTRICTED','branchIds':[]}")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail")
                            .value("Restricted users must have at least one branch access assignment."));
        }

        @Test
        @DisplayName("branches of another tenant are invalid")
        void foreignBranch() throws Exception {
            var foreign = fixture.branch(fixture.tenant("Other"), "Elsewhere");

            mockMvc.perform(post("/api/v1/users")
                            .header("Authorization", ownerAuth)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body("{'email':'" + GovernanceFixture.uniqueEmail("x") + "','name':'X','roleId':'"
                                    + roles.get(SystemRole.VIEWER) + "','branchScopeMode':'RESTRICTED',"
                                    + "'branchIds':['" + foreign + "']}")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail").value("One or more branch IDs are invalid for this tenant."));
        }

        @Test
        @DisplayName("an email of another tenant is refused")
        void otherTenantEmail() throws Exception {
            var otherTenant = fixture.tenant("Other");
            var email = GovernanceFixture.uniqueEmail("taken");
            fixture.user(otherTenant, email, fixture.customRole(otherTenant, "Greeter"), UserStatus.ACTIVE);

            mockMvc.perform(post("/api/v1/users")
                            .header("Authorization", ownerAuth)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body("{'email':'" + email + "','name':'Taken','roleId':'"
                                    + roles.get(SystemRole.STAFF) + "'}")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail").value("This email already belongs to a different tenant."));
        }

        @Test
        @DisplayName("platform administrators cannot be invited")
        void platformAdmin() throws Exception {
            mockMvc.perform(post("/api/v1/users")
                            .header("Authorization", ownerAuth)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body("{'email':'" + PLATFORM_ADMIN + "','name':'Ops','roleId':'"
                                    + roles.get(SystemRole.STAFF) + "'}")))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("a restricted inviter can only grant its own branches")
        void restrictedInviter() throws Exception {
            var managers = fixture.role(tenantId, "Branch Admins", false, List.of(Permissions.USERS_MANAGE));
            var email = GovernanceFixture.uniqueEmail("branch-admin");
            fixture.user(tenantId, email, managers, UserStatus.ACTIVE, BranchScopeMode.RESTRICTED, List.of(branchA));
            var auth = bearer(email);

            mockMvc.perform(post("/api/v1/users")
                            .header("Authorization", auth)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body("{'email':'" + GovernanceFixture.uniqueEmail("x") + "','name':'X','roleId':'"
                                    + roles.get(SystemRole.VIEWER) + "','branchScopeMode':'ALL'}")))
                    .andExpect(status().isForbidden());
            mockMvc.perform(post("/api/v1/users")
                            .header("Authorization", auth)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body("{'email':'" + GovernanceFixture.uniqueEmail("x") + "','name':'X','roleId':'"
                                    + roles.get(SystemRole.VIEWER) + "','branchScopeMode':'RESTRICTED',"
                                    + "'branchIds':['" + branchB + "']}")))
                    .andExpect(status().isForbidden());
            mockMvc.perform(post("/api/v1/users")
                            .header("Authorization", auth)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body("{'email':'" + GovernanceFixture.uniqueEmail("x") + "','name':'X','roleId':'"
                                    + roles.get(SystemRole.VIEWER) + "','branchScopeMode':'RESTRICTED',"
                                    + "'branchIds':['" + branchA + "']}")))
                    .andExpect(status().isCreated());
        }
    }

    @Nested
    @DisplayName("branch access")
    class BranchAccess {

        @Test
        @DisplayName("narrowing grants drops a default outside them")
        void dropsDefault() throws Exception {
            var usher = fixture.user(tenantId, GovernanceFixture.uniqueEmail("usher"), roles.get(SystemRole.VIEWER),
                    UserStatus.ACTIVE, BranchScopeMode.RESTRICTED, List.of(branchA, branchB));
            fixture.setDefaultBranch(usher, branchA);

            mockMvc.perform(patch("/api/v1/users/" + usher + "/branches")
                            .header("Authorization", ownerAuth)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body("{'branchScopeMode':'RESTRICTED','branchIds':['" + branchB + "']}")))
                    .andExpect(status().isOk());

            assertThat(fixture.grants(usher)).containsExactly(branchB);
            assertThat(fixture.defaultBranch(usher)).isNull();
        }

        @Test
        @DisplayName("a default outside the grants is rejected")
        void defaultOutsideGrants() throws Exception {
            var usher = fixture.user(tenantId, GovernanceFixture.uniqueEmail("usher"), roles.get(SystemRole.VIEWER),
                    UserStatus.ACTIVE, BranchScopeMode.RESTRICTED, List.of(branchA));

            mockMvc.perform(patch("/api/v1/users/" + usher + "/branches")
                            .header("Authorization", ownerAuth)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body("{'branchScopeMode':'RESTRICTED','branchIds':['" + branchA
                                    + "'],'defaultBranchId':'" + branchB + "'}")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail").value("Default branch must be one of the assigned branches."));
        }

        @Test
        @DisplayName("switching to ALL clears the grants")
        void switchToAll() throws Exception {
            var usher = fixture.user(tenantId, GovernanceFixture.uniqueEmail("usher"), roles.get(SystemRole.VIEWER),
                    UserStatus.ACTIVE, BranchScopeMode.RESTRICTED, List.of(branchA));

            mockMvc.perform(patch("/api/v1/users/" + usher + "/branches")
                            .header("Authorization", ownerAuth)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body("{'branchScopeMode':'ALL'}")))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.branchScopeMode").value("ALL"));

            assertThat(fixture.grants(usher)).isEmpty();
        }
    }

    @Nested
    @DisplayName("tenant boundary")
    class TenantBoundary {

        @Test
        @DisplayName("users of another tenant are not found")
        void otherTenantUser() throws Exception {
            var otherTenant = fixture.tenant("Other");
            var foreign = fixture.user(otherTenant, GovernanceFixture.uniqueEmail("foreign"),
                    fixture.customRole(otherTenant, "Greeter"), UserStatus.ACTIVE);

            mockMvc.perform(get("/api/v1/users/" + foreign).header("Authorization", ownerAuth))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("listing stays inside the caller's tenant")
        void listing() throws Exception {
            var otherTenant = fixture.tenant("Other");
            fixture.user(otherTenant, GovernanceFixture.uniqueEmail("foreign"),
                    fixture.customRole(otherTenant, "Greeter"), UserStatus.ACTIVE);

            mockMvc.perform(get("/api/v1/users").header("Authorization", ownerAuth))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.items", hasSize(1)))
                    .andExpect(jsonPath("$.total").value(1));
        }

        @Test
        @DisplayName("platform administrators must impersonate")
        void platformAdminRefused() throws Exception {
            mockMvc.perform(get("/api/v1/users").header("Authorization", bearer(PLATFORM_ADMIN)))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.detail").value(
                            "Super-admins must use explicit impersonation to access church-admin routes."));
        }

        @Test
        @DisplayName("requires users.manage")
        void requiresPermission() throws Exception {
            var staff = GovernanceFixture.uniqueEmail("staff");
            fixture.user(tenantId, staff, roles.get(SystemRole.STAFF), UserStatus.ACTIVE);

            mockMvc.perform(get("/api/v1/users").header("Authorization", bearer(staff)))
                    .andExpect(status().isForbidden());
        }

        @Test
        @DisplayName("rejects an unknown status filter")
        void unknownStatusFilter() throws Exception {
            mockMvc.perform(get("/api/v1/users").param("status", "Banned").header("Authorization", ownerAuth))
                    .andExpect(status().isBadRequest());
        }
    }

    @Test
    @DisplayName("only invited users can be re-sent an invitation")
    void resendInvite() throws Exception {
        var invited = fixture.user(tenantId, GovernanceFixture.uniqueEmail("new"), roles.get(SystemRole.STAFF),
                UserStatus.INVITED);

        mockMvc.perform(post("/api/v1/users/" + invited + "/resend-invite").header("Authorization", ownerAuth))
                .andExpect(status().isOk());
        mockMvc.perform(post("/api/v1/users/" + ownerId + "/resend-invite").header("Authorization", ownerAuth))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Only invited users can be sent a new invitation."));
    }
}
