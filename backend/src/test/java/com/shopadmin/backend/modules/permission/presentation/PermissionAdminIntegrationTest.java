package com.shopadmin.backend.modules.permission.presentation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopadmin.backend.modules.auth.domain.AppUser;
import com.shopadmin.backend.modules.permission.domain.ActionType;
import com.shopadmin.backend.modules.permission.domain.ResourceType;
import com.shopadmin.backend.modules.permission.infrastructure.persistence.PermissionRepository;
import com.shopadmin.backend.modules.permission.infrastructure.persistence.RolePermissionRepository;
import com.shopadmin.backend.support.AbstractPostgresIntegrationTest;
import com.shopadmin.backend.support.TestUserFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class PermissionAdminIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestUserFactory testUserFactory;

    @Autowired
    private PermissionRepository permissionRepository;

    @Autowired
    private RolePermissionRepository rolePermissionRepository;

    private AppUser admin;
    private String adminToken;

    @BeforeEach
    void setUp() {
        admin = testUserFactory.createUser("admin", "SUPER_ADMIN");
        adminToken = testUserFactory.tokenFor(admin);
    }

    private UUID permissionId(ResourceType resource, ActionType action) {
        return permissionRepository.findByResourceTypeAndActionType(resource, action).orElseThrow().getId();
    }

    private String bearer(String token) {
        return "Bearer " + token;
    }

    private JsonNode check(UUID userId, String resource, String action) throws Exception {
        MvcResult result = mockMvc.perform(post("/admin/permissions/check")
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"userId": "%s", "resource": "%s", "action": "%s"}
                                """.formatted(userId, resource, action)))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private void setOverride(UUID userId, UUID permissionId, boolean granted, OffsetDateTime expiresAt)
            throws Exception {
        String expiry = expiresAt == null ? "null" : "\"" + expiresAt + "\"";
        mockMvc.perform(put("/admin/users/{userId}/permissions/{permissionId}", userId, permissionId)
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"granted": %s, "reason": "integration test", "expiresAt": %s}
                                """.formatted(granted, expiry)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.granted").value(granted));
    }

    @Test
    void requestWithoutTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/admin/permissions"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("unauthorized"));
    }

    @Test
    void actorWithoutGrantIsForbiddenWithReason() throws Exception {
        AppUser shopper = testUserFactory.createUser("shopper", "USER");

        mockMvc.perform(get("/admin/permissions")
                        .header(HttpHeaders.AUTHORIZATION, bearer(testUserFactory.tokenFor(shopper))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("permission.denied"))
                .andExpect(jsonPath("$.detail").value("no role or user grant"));
    }

    @Test
    void roleGrantOverrideAndExpiryFollowPrecedence() throws Exception {
        String editorRole = testUserFactory.createRole("EDITOR");
        UUID productWrite = permissionId(ResourceType.PRODUCT, ActionType.WRITE);

        mockMvc.perform(put("/admin/roles/{roleCode}/permissions/{permissionId}", editorRole, productWrite)
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.created").value(true))
                .andExpect(jsonPath("$.permission").value("product.write"));

        AppUser editor = testUserFactory.createUser("editor", editorRole);

        JsonNode byRole = check(editor.getId(), "product", "write");
        assertThat(byRole.path("hasPermission").asBoolean()).isTrue();
        assertThat(byRole.path("source").asText()).isEqualTo("role");

        setOverride(editor.getId(), productWrite, false, OffsetDateTime.now(ZoneOffset.UTC).plusDays(1));
        JsonNode denied = check(editor.getId(), "product", "write");
        assertThat(denied.path("hasPermission").asBoolean()).isFalse();
        assertThat(denied.path("source").asText()).isEqualTo("user-override");

        setOverride(editor.getId(), productWrite, false, OffsetDateTime.now(ZoneOffset.UTC).plusSeconds(1));
        Thread.sleep(1_500);
        JsonNode afterExpiry = check(editor.getId(), "product", "write");
        assertThat(afterExpiry.path("hasPermission").asBoolean()).isTrue();
        assertThat(afterExpiry.path("source").asText()).isEqualTo("role");

        mockMvc.perform(get("/admin/audit/decisions")
                        .param("actorId", editor.getId().toString())
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(3))
                .andExpect(jsonPath("$.items[0].decision").value("ALLOW"))
                .andExpect(jsonPath("$.items[1].source").value("user-override"));
    }

    @Test
    void grantingTwiceKeepsOneRowAndOneAuditEntry() throws Exception {
        String role = testUserFactory.createRole("IDEMP");
        UUID orderRead = permissionId(ResourceType.ORDER, ActionType.READ);

        mockMvc.perform(put("/admin/roles/{roleCode}/permissions/{permissionId}", role, orderRead)
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isCreated());
        mockMvc.perform(put("/admin/roles/{roleCode}/permissions/{permissionId}", role, orderRead)
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.created").value(false));

        assertThat(rolePermissionRepository.findByRoleCode(role)).hasSize(1);
        mockMvc.perform(get("/admin/audit/grants")
                        .param("actorId", admin.getId().toString())
                        .param("resource", "role_permission")
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(1))
                .andExpect(jsonPath("$.items[0].action").value("GRANT"));
    }

    @Test
    void revokedRoleGrantIsDeniedImmediately() throws Exception {
        String role = testUserFactory.createRole("REVOKE");
        UUID reviewManage = permissionId(ResourceType.REVIEW, ActionType.MANAGE);
        mockMvc.perform(put("/admin/roles/{roleCode}/permissions/{permissionId}", role, reviewManage)
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isCreated());
        AppUser moderator = testUserFactory.createUser("moderator", role);
        assertThat(check(moderator.getId(), "review", "manage").path("hasPermission").asBoolean()).isTrue();

        mockMvc.perform(delete("/admin/roles/{roleCode}/permissions/{permissionId}", role, reviewManage)
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isNoContent());

        JsonNode afterRevoke = check(moderator.getId(), "review", "manage");
        assertThat(afterRevoke.path("hasPermission").asBoolean()).isFalse();
        assertThat(afterRevoke.path("source").asText()).isEqualTo("none");
    }

    @Test
    void deactivatedPermissionIsDeniedDespiteOverride() throws Exception {
        UUID couponAdmin = permissionId(ResourceType.COUPON, ActionType.ADMIN);
        AppUser target = testUserFactory.createUser("coupon", "USER");
        setOverride(target.getId(), couponAdmin, true, null);
        assertThat(check(target.getId(), "coupon", "admin").path("source").asText()).isEqualTo("user-override");

        try {
            mockMvc.perform(patch("/admin/permissions/{permissionId}", couponAdmin)
                            .header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"active\": false}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.active").value(false));

            JsonNode decision = check(target.getId(), "coupon", "admin");
            assertThat(decision.path("hasPermission").asBoolean()).isFalse();
            assertThat(decision.path("source").asText()).isEqualTo("none");
            assertThat(decision.path("reason").asText()).isEqualTo("unknown or inactive capability");
        } finally {
            mockMvc.perform(patch("/admin/permissions/{permissionId}", couponAdmin)
                            .header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"active\": true}"))
                    .andExpect(status().isOk());
        }
    }

    @Test
    void systemPermissionCannotBeDeleted() throws Exception {
        UUID productRead = permissionId(ResourceType.PRODUCT, ActionType.READ);

        mockMvc.perform(delete("/admin/permissions/{permissionId}", productRead)
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("permission.system_protected"));
    }

    @Test
    void overrideWithPastExpiryIsRejected() throws Exception {
        AppUser target = testUserFactory.createUser("late", "USER");
        UUID orderWrite = permissionId(ResourceType.ORDER, ActionType.WRITE);

        mockMvc.perform(put("/admin/users/{userId}/permissions/{permissionId}", target.getId(), orderWrite)
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"granted": true, "expiresAt": "2020-01-01T00:00:00Z"}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("permission.override_expired"));
    }

    @Test
    void effectivePermissionsCombineRoleAndOverrides() throws Exception {
        AppUser guest = testUserFactory.createUser("guest", "GUEST");
        UUID productRead = permissionId(ResourceType.PRODUCT, ActionType.READ);
        UUID wishlistWrite = permissionId(ResourceType.WISHLIST, ActionType.WRITE);
        setOverride(guest.getId(), productRead, false, null);
        setOverride(guest.getId(), wishlistWrite, true, null);

        MvcResult result = mockMvc.perform(get("/admin/users/{userId}/effective-permissions", guest.getId())
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isOk())
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());

        assertThat(body.findValuesAsText("name")).contains("wishlist.write", "brand.read")
                .doesNotContain("product.read");
    }

    @Test
    void unknownRoleAssignmentIsNotFound() throws Exception {
        AppUser target = testUserFactory.createUser("orphan", null);

        mockMvc.perform(put("/admin/users/{userId}/role", target.getId())
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"roleCode\": \"NO_SUCH_ROLE\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("role.not_found"));
    }

    @Test
    void permissionIsFoundByName() throws Exception {
        mockMvc.perform(get("/admin/permissions/by-name/{name}", "product.read")
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("product.read"))
                .andExpect(jsonPath("$.resource").value("product"));
    }

    @Test
    void perUserResourceViewAndStatsReflectOverrides() throws Exception {
        AppUser guest = testUserFactory.createUser("stats", "GUEST");
        setOverride(guest.getId(), permissionId(ResourceType.PRODUCT, ActionType.READ), false, null);
        setOverride(guest.getId(), permissionId(ResourceType.PRODUCT, ActionType.WRITE), true, null);

        mockMvc.perform(get("/admin/users/{userId}/permissions/resources/{resource}", guest.getId(), "product")
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].name").value("product.write"));

        mockMvc.perform(get("/admin/users/{userId}/permissions/stats", guest.getId())
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.roleCode").value("GUEST"))
                .andExpect(jsonPath("$.rolePermissions").value(7))
                .andExpect(jsonPath("$.overrideGrants").value(1))
                .andExpect(jsonPath("$.overrideDenies").value(1))
                .andExpect(jsonPath("$.effectivePermissions").value(7));
    }
}
