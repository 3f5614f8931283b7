package com.fulqrom.backend.modules.access.presentation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import com.fulqrom.backend.global.error.ProblemException;
import com.fulqrom.backend.global.error.RestExceptionHandler;
import com.fulqrom.backend.modules.access.application.AuthorizationDecision;
import com.fulqrom.backend.modules.access.application.ResourceAccessService;
import com.fulqrom.backend.modules.access.application.ResourceAccessService.GrantCommand;
import com.fulqrom.backend.modules.access.presentation.gate.AuthorizationContext;
import com.fulqrom.backend.modules.access.domain.PermissionFlag;
import com.fulqrom.backend.modules.access.domain.PermissionFlags;
import com.fulqrom.backend.modules.access.domain.ResourceAccessGrant;
import com.fulqrom.backend.support.AccessFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class ResourceAccessControllerTest {

    private static final String USER_ID = "65f1b2c3d4e5f6a7b8c90030";
    private static final String CALLER_ID = "65f1b2c3d4e5f6a7b8c90001";

    @Mock
    private ResourceAccessService resourceAccessService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ResourceAccessController(resourceAccessService))
                .setControllerAdvice(new RestExceptionHandler())
                .build();
    }

    private static AuthorizationDecision callerDecision() {
        return AccessFixtures.moduleDecision(CALLER_ID, "users", PermissionFlag.CREATE);
    }

    @Test
    void listsGrantsInSnakeCase() throws Exception {
        ResourceAccessGrant grant = AccessFixtures.grant("building", "B42", PermissionFlags.viewOnly());
        when(resourceAccessService.listGrants(USER_ID)).thenReturn(List.of(grant));

        mockMvc.perform(get("/users/{userId}/resource-access", USER_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].grant_id").value(grant.getGrantId()))
                .andExpect(jsonPath("$[0].resource_type").value("building"))
                .andExpect(jsonPath("$[0].resource_id").value("B42"))
                .andExpect(jsonPath("$[0].permissions.can_view").value(true))
                .andExpect(jsonPath("$[0].permissions.can_edit").value(false));
    }

    @Test
    void createsGrant() throws Exception {
        ResourceAccessGrant grant = AccessFixtures.grant("site", "S1", new PermissionFlags(true, false, true, false));
        when(resourceAccessService.grant(any(GrantCommand.class), eq(CALLER_ID))).thenReturn(grant);

        mockMvc.perform(post("/users/resource-access")
                        .requestAttr(AuthorizationContext.REQUEST_ATTRIBUTE, callerDecision())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"user_id": "%s", "resource_type": "site", "resource_id": "S1",
                                 "permissions": {"can_view": true, "can_edit": true}, "granted_by": "ops"}
                                """.formatted(USER_ID)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.resource_id").value("S1"))
                .andExpect(jsonPath("$.permissions.can_edit").value(true));

        ArgumentCaptor<GrantCommand> captor = ArgumentCaptor.forClass(GrantCommand.class);
        verify(resourceAccessService).grant(captor.capture(), eq(CALLER_ID));
        GrantCommand command = captor.getValue();
        assertThat(command.permissions()).isEqualTo(new PermissionFlags(true, false, true, false));
        assertThat(command.grantedBy()).isEqualTo("ops");
    }

    @Test
    void grantDefaultsGrantedByToCaller() throws Exception {
        ResourceAccessGrant grant = AccessFixtures.grant("site", "S1", PermissionFlags.viewOnly());
        when(resourceAccessService.grant(any(GrantCommand.class), eq(CALLER_ID))).thenReturn(grant);

        mockMvc.perform(post("/users/resource-access")
                        .requestAttr(AuthorizationContext.REQUEST_ATTRIBUTE, callerDecision())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"user_id": "%s", "resource_type": "site", "resource_id": "S1"}
                                """.formatted(USER_ID)))
                .andExpect(status().isCreated());

        ArgumentCaptor<GrantCommand> captor = ArgumentCaptor.forClass(GrantCommand.class);
        verify(resourceAccessService).grant(captor.capture(), eq(CALLER_ID));
        assertThat(captor.getValue().grantedBy()).isEqualTo(CALLER_ID);
    }

    @Test
    void grantOutsideCallerScopeIsForbidden() throws Exception {
        when(resourceAccessService.grant(any(GrantCommand.class), eq(CALLER_ID))).thenThrow(new ProblemException(
                HttpStatus.FORBIDDEN, "access.resource_out_of_scope", "You cannot grant access to site S1."));

        mockMvc.perform(post("/users/resource-access")
                        .requestAttr(AuthorizationContext.REQUEST_ATTRIBUTE, callerDecision())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"user_id": "%s", "resource_type": "site", "resource_id": "S1"}
                                """.formatted(USER_ID)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("access.resource_out_of_scope"));
    }

    @Test
    void grantWithoutAuthorizedCallerIsUnauthorized() throws Exception {
        mockMvc.perform(post("/users/resource-access")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"user_id": "%s", "resource_type": "site", "resource_id": "S1"}
                                """.formatted(USER_ID)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("authz.authentication_required"));

        verify(resourceAccessService, never()).grant(any(GrantCommand.class), anyString());
    }

    @Test
    void missingFieldsAreValidationErrors() throws Exception {
        mockMvc.perform(post("/users/resource-access")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\": \"" + USER_ID + "\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_PROBLEM_JSON))
                .andExpect(jsonPath("$.code").value("validation_error"));
    }

    @Test
    void duplicateGrantIsConflict() throws Exception {
        when(resourceAccessService.grant(any(GrantCommand.class), anyString())).thenThrow(new ProblemException(
                HttpStatus.CONFLICT, "access.grant_duplicate", "Resource access already granted. Use PUT to update permissions."));

        mockMvc.perform(post("/users/resource-access")
                        .requestAttr(AuthorizationContext.REQUEST_ATTRIBUTE, callerDecision())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"user_id": "%s", "resource_type": "site", "resource_id": "S1"}
                                """.formatted(USER_ID)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("access.grant_duplicate"))
                .andExpect(jsonPath("$.instance").value("/users/resource-access"));
    }

    @Test
    void updatesGrantFlags() throws Exception {
        ResourceAccessGrant grant = AccessFixtures.grant("site", "S1", PermissionFlags.all());
        when(resourceAccessService.updatePermissions(eq(USER_ID), eq(grant.getGrantId()), eq(PermissionFlags.all())))
                .thenReturn(grant);

        mockMvc.perform(put("/users/{userId}/resource-access/{grantId}", USER_ID, grant.getGrantId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"permissions": {"can_view": true, "can_create": true, "can_edit": true, "can_delete": true}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.permissions.can_delete").value(true));
    }

    @Test
    void revokesGrantForTargetUser() throws Exception {
        mockMvc.perform(delete("/users/resource-access/{grantId}", "65f1b2c3d4e5f6a7b8c9aaaa")
                        .param("user_id", USER_ID))
                .andExpect(status().isNoContent());

        verify(resourceAccessService).revoke(USER_ID, "65f1b2c3d4e5f6a7b8c9aaaa");
    }

    @Test
    void revokeWithoutUserIdIsBadRequest() throws Exception {
        mockMvc.perform(delete("/users/resource-access/{grantId}", "65f1b2c3d4e5f6a7b8c9aaaa"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("bad_request"));
    }
}
