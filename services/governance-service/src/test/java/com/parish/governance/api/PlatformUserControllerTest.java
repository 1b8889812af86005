package com.parish.governance.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import com.parish.governance.GovernanceFixture;
import com.parish.governance.IntegrationTestSupport;
import com.parish.security.BranchScopeMode;
import com.parish.security.SystemRole;
import com.parish.security.UserStatus;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

@DisplayName("/api/v1/platform/users")
class PlatformUserControllerTest extends IntegrationTestSupport {

    private String tenantId;
    private Map<SystemRole, String> roles;
    private String ownerId;
    private String adminAuth;

    @BeforeEach
    void setUp() {
        tenantId = fixture.tenant("Grace Chapel");
        roles = fixture.systemRoles(tenantId);
        ownerId = fixture.user(tenantId, GovernanceFixture.uniqueEmail("owner"), roles.get(SystemRole.OWNER),
                UserStatus.ACTIVE);
        adminAuth = bearer(PLATFORM_ADMIN);
    }

    @Test
    @DisplayName("lists users of one tenant")
    void listsByTenant() throws Exception {
        fixture.user(tenantId, GovernanceFixture.uniqueEmail("staff"), roles.get(SystemRole.STAFF), UserStatus.INVITED);

        mockMvc.perform(get("/api/v1/platform/users").param("tenantId", tenantId).header("Authorization", adminAuth))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(2))
                .andExpect(jsonPath("$.items", hasSize(2)));
        mockMvc.perform(get("/api/v1/platform/users")
                        .param("tenantId", tenantId)
                        .param("status", "Invited")
                        .header("Authorization", adminAuth))
                .andExpect(jsonPath("$.total").value(1));
    }

    @Test
    @DisplayName("the last owner cannot be suspended from the platform either")
    void lastOwner() throws Exception {
        mockMvc.perform(patch("/api/v1/platform/users/" + ownerId + "/status")
                        .header("Authorization", adminAuth)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"Suspended\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Cannot remove or suspend the last active Owner in this tenant."));
    }

    @Test
    @DisplayName("suspends a user and audits it in the user's tenant")
    void suspends() throws Exception {
        var staff = fixture.user(tenantId, GovernanceFixture.uniqueEmail("staff"), roles.get(SystemRole.STAFF),
                UserStatus.ACTIVE);

        mockMvc.perform(patch("/api/v1/platform/users/" + staff + "/status")
                        .header("Authorization", adminAuth)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"Suspended\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("Suspended"));

        assertThat(fixture.userStatus(staff)).isEqualTo("Suspended");
        assertThat(fixture.auditActions(tenantId)).containsExactly("PLATFORM_USER_STATUS_UPDATED");
    }

    @Test
    @DisplayName("a role must belong to the user's tenant")
    void foreignRole() throws Exception {
        var foreign = fixture.customRole(fixture.tenant("Other"), "Greeter");

        mockMvc.perform(patch("/api/v1/platform/users/" + ownerId + "/role")
                        .header("Authorization", adminAuth)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"roleId\":\"" + foreign + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Role does not belong to the user's tenant."));
    }

    @Test
    @DisplayName("resetting access restores an active unrestricted user")
    void resetsAccess() throws Exception {
        var branch = fixture.branch(tenantId, "Downtown");
        var usher = fixture.user(tenantId, GovernanceFixture.uniqueEmail("usher"), roles.get(SystemRole.VIEWER),
                UserStatus.SUSPENDED, BranchScopeMode.RESTRICTED, List.of(branch));
        fixture.setDefaultBranch(usher, branch);

        mockMvc.perform(post("/api/v1/platform/users/" + usher + "/reset-access").header("Authorization", adminAuth))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("Active"))
                .andExpect(jsonPath("$.branchScopeMode").value("ALL"));

        assertThat(fixture.grants(usher)).isEmpty();
        assertThat(fixture.defaultBranch(usher)).isNull();
        assertThat(fixture.auditActions(tenantId)).containsExactly("PLATFORM_USER_ACCESS_RESET");
    }

    @Test
    @DisplayName("impersonation sessions are refused")
    void impersonationRefused() throws Exception {
        String body = mockMvc.perform(post("/api/v1/platform/tenants/" + tenantId + "/impersonation")
                        .header("Authorization", adminAuth))
                .andReturn().getResponse().getContentAsString();
        String token = JsonPath.read(body, "$.token");

        mockMvc.perform(get("/api/v1/platform/users/" + ownerId).header("Authorization", "Bearer " + token))
                .andExpect(status().isForbidden());
    }
}
