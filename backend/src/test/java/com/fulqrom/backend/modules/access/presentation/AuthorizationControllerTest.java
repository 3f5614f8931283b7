package com.fulqrom.backend.modules.access.presentation;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import com.fulqrom.backend.global.error.RestExceptionHandler;
import com.fulqrom.backend.modules.access.application.AccessScope;
import com.fulqrom.backend.modules.access.application.AuthorizationDecision;
import com.fulqrom.backend.modules.access.application.AuthorizationFailure;
import com.fulqrom.backend.modules.access.application.AuthorizationFailureException;
import com.fulqrom.backend.modules.access.application.AuthorizationService;
import com.fulqrom.backend.modules.access.application.RoleModuleEvaluator;
import com.fulqrom.backend.modules.access.config.AuthorizationProperties;
import com.fulqrom.backend.modules.access.domain.PermissionFlag;
import com.fulqrom.backend.modules.access.domain.PermissionFlags;
import com.fulqrom.backend.modules.access.presentation.gate.UserIdentifierExtractor;
import com.fulqrom.backend.support.AccessFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class AuthorizationControllerTest {

    private static final String CALLER = "65f1b2c3d4e5f6a7b8c90040";
    private static final String OTHER = "65f1b2c3d4e5f6a7b8c90041";

    @Mock
    private AuthorizationService authorizationService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        AuthorizationController controller = new AuthorizationController(
                authorizationService,
                new UserIdentifierExtractor(new AuthorizationProperties())
        );
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new RestExceptionHandler())
                .build();
    }

    @Test
    void returnsResourceDecisionForCaller() throws Exception {
        when(authorizationService.authorizeResource(CALLER, "building", "view", "B42")).thenReturn(
                AuthorizationDecision.grantedByResourceAccess(CALLER, PermissionFlag.VIEW, "buildings",
                        AccessFixtures.grant("building", "B42", PermissionFlags.viewOnly())));

        mockMvc.perform(post("/authorization/check")
                        .header("X-User-Id", CALLER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"resource_type": "building", "resource_id": "B42", "action": "view"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.allowed").value(true))
                .andExpect(jsonPath("$.source").value("resource_access"))
                .andExpect(jsonPath("$.required_permission").value("can_view"))
                .andExpect(jsonPath("$.matched_grant.resource_id").value("B42"));
    }

    @Test
    void deniedModuleDecisionIsStillOk() throws Exception {
        when(authorizationService.authorizeModule(CALLER, "sites", "edit")).thenReturn(
                AuthorizationDecision.fromRoles(CALLER, PermissionFlag.EDIT, "sites", null, null,
                        new RoleModuleEvaluator.Verdict(false, null)));

        mockMvc.perform(post("/authorization/check")
                        .header("X-User-Id", CALLER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"module\": \"sites\", \"action\": \"edit\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.allowed").value(false))
                .andExpect(jsonPath("$.source").value("denied"))
                .andExpect(jsonPath("$.role_name").doesNotExist());
    }

    @Test
    void checkingAnotherUserNeedsUsersView() throws Exception {
        when(authorizationService.authorizeModule(CALLER, "users", "view")).thenReturn(
                AuthorizationDecision.fromRoles(CALLER, PermissionFlag.VIEW, "users", null, null,
                        new RoleModuleEvaluator.Verdict(false, null)));

        mockMvc.perform(post("/authorization/check")
                        .header("X-User-Id", CALLER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"user_id": "%s", "module": "sites", "action": "view"}
                                """.formatted(OTHER)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("authz.permission_denied"))
                .andExpect(jsonPath("$.details.required_permission").value("view:users"));

        verify(authorizationService, never()).authorizeModule(OTHER, "sites", "view");
    }

    @Test
    void checksAnotherUserWhenAllowed() throws Exception {
        when(authorizationService.authorizeModule(CALLER, "users", "view")).thenReturn(
                AuthorizationDecision.fromRoles(CALLER, PermissionFlag.VIEW, "users", null, null,
                        new RoleModuleEvaluator.Verdict(true, "Admin")));
        when(authorizationService.authorizeModule(OTHER, "sites", "view")).thenReturn(
                AuthorizationDecision.fromRoles(OTHER, PermissionFlag.VIEW, "sites", null, null,
                        new RoleModuleEvaluator.Verdict(true, "Property Manager")));

        mockMvc.perform(post("/authorization/check")
                        .header("X-User-Id", CALLER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"user_id": "%s", "module": "sites", "action": "view"}
                                """.formatted(OTHER)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user_id").value(OTHER))
                .andExpect(jsonPath("$.role_name").value("Property Manager"));
    }

    @Test
    void anonymousCallerIsUnauthorized() throws Exception {
        mockMvc.perform(post("/authorization/check")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"module\": \"sites\", \"action\": \"view\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("authz.authentication_required"));
    }

    @Test
    void engineFailuresMapToTheirStatus() throws Exception {
        when(authorizationService.authorizeModule("ghost-id", "sites", "view"))
                .thenThrow(new AuthorizationFailureException(AuthorizationFailure.USER_NOT_FOUND));

        mockMvc.perform(post("/authorization/check")
                        .header("X-User-Id", "ghost-id")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"module\": \"sites\", \"action\": \"view\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("authz.user_not_found"));
    }

    @Test
    void missingTargetIsBadRequest() throws Exception {
        mockMvc.perform(post("/authorization/check")
                        .header("X-User-Id", CALLER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\": \"view\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("authz.target_required"));
    }

    @Test
    void listsCallerScope() throws Exception {
        when(authorizationService.accessScope(CALLER, "building")).thenReturn(
                new AccessScope(CALLER, "building", "buildings", false, List.of("B1", "B7"), List.of()));

        mockMvc.perform(get("/authorization/scope")
                        .header("X-User-Id", CALLER)
                        .param("resource_type", " building "))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.full_access").value(false))
                .andExpect(jsonPath("$.module").value("buildings"))
                .andExpect(jsonPath("$.resource_ids[1]").value("B7"))
                .andExpect(jsonPath("$.excluded_resource_ids").isEmpty());
    }

    @Test
    void scopeOfAnotherUserNeedsUsersView() throws Exception {
        when(authorizationService.authorizeModule(CALLER, "users", "view")).thenReturn(
                AuthorizationDecision.fromRoles(CALLER, PermissionFlag.VIEW, "users", null, null,
                        new RoleModuleEvaluator.Verdict(false, null)));

        mockMvc.perform(get("/authorization/scope")
                        .header("X-User-Id", CALLER)
                        .param("resource_type", "site")
                        .param("user_id", OTHER))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("authz.permission_denied"));

        verify(authorizationService, never()).accessScope(OTHER, "site");
    }

    @Test
    void missingScopeTypeIsBadRequest() throws Exception {
        when(authorizationService.accessScope(CALLER, null))
                .thenThrow(new AuthorizationFailureException(AuthorizationFailure.RESOURCE_TYPE_MISSING));

        mockMvc.perform(get("/authorization/scope").header("X-User-Id", CALLER))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("authz.resource_type_missing"));
    }
}
