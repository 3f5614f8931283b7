package com.fulqrom.backend.modules.access.presentation.gate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Map;

import com.fulqrom.backend.modules.access.application.AuthorizationDecision;
import com.fulqrom.backend.modules.access.application.AuthorizationFailure;
import com.fulqrom.backend.modules.access.application.AuthorizationFailureException;
import com.fulqrom.backend.modules.access.application.AuthorizationService;
import com.fulqrom.backend.modules.access.application.DecisionSource;
import com.fulqrom.backend.modules.access.application.PermissionDeniedException;
import com.fulqrom.backend.modules.access.application.RoleModuleEvaluator;
import com.fulqrom.backend.modules.access.config.AuthorizationProperties;
import com.fulqrom.backend.modules.access.domain.PermissionFlag;
import com.fulqrom.backend.modules.access.domain.PermissionFlags;
import com.fulqrom.backend.support.AccessFixtures;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import org.springframework.web.servlet.HandlerMapping;

@ExtendWith(MockitoExtension.class)
class PermissionAspectTest {

    private static final String CALLER = "65f1b2c3d4e5f6a7b8c90001";

    @Mock
    private AuthorizationService authorizationService;

    private MockHttpServletRequest request;
    private GatedHandler handler;

    @BeforeEach
    void setUp() {
        request = new MockHttpServletRequest("GET", "/buildings/B42");
        RequestContextHolder.setRequestAttributes(new ServletRequestAttributes(request));

        AspectJProxyFactory factory = new AspectJProxyFactory(new GatedHandler());
        factory.addAspect(new PermissionAspect(
                authorizationService,
                new UserIdentifierExtractor(new AuthorizationProperties())
        ));
        handler = factory.getProxy();
    }

    @AfterEach
    void tearDown() {
        RequestContextHolder.resetRequestAttributes();
    }

    @Test
    void grantedResourceCheckRunsHandlerAndStoresDecision() {
        request.addHeader("X-User-Id", CALLER);
        request.setAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE, Map.of("id", "B42"));
        AuthorizationDecision granted = AuthorizationDecision.grantedByResourceAccess(CALLER, PermissionFlag.VIEW,
                "buildings", AccessFixtures.grant("building", "B42", PermissionFlags.viewOnly()));
        when(authorizationService.authorizeResource(CALLER, "building", "view", "B42")).thenReturn(granted);

        assertThat(handler.showBuilding("B42")).isEqualTo("building B42");
        assertThat(AuthorizationContext.current(request)).contains(granted);
    }

    @Test
    void deniedResourceCheckBlocksHandler() {
        request.addHeader("X-User-Id", CALLER);
        request.setAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE, Map.of("id", "C7"));
        AuthorizationDecision denied = AuthorizationDecision.deniedByResourceAccess(CALLER, PermissionFlag.VIEW,
                "buildings", AccessFixtures.grant("building", "C7", PermissionFlags.none()));
        when(authorizationService.authorizeResource(CALLER, "building", "view", "C7")).thenReturn(denied);

        assertThatThrownBy(() -> handler.showBuilding("C7"))
                .isInstanceOfSatisfying(PermissionDeniedException.class, ex -> {
                    assertThat(ex.getDetails()).containsEntry("source", "resource_access");
                    assertThat(ex.getDetails()).containsEntry("resource_id", "C7");
                    assertThat(ex.getDetails()).containsKey("your_permissions");
                });
        assertThat(AuthorizationContext.current(request)).isEmpty();
    }

    @Test
    void resourceIdFallsBackToRequestParameter() {
        request.addHeader("X-User-Id", CALLER);
        request.setParameter("documentId", "D9");
        when(authorizationService.authorizeResource(CALLER, "document", "delete", "D9"))
                .thenReturn(AuthorizationDecision.fromRoles(CALLER, PermissionFlag.DELETE, "documents", "document", "D9",
                        new RoleModuleEvaluator.Verdict(true, "Admin")));

        handler.removeDocument();

        assertThat(AuthorizationContext.current(request)).map(AuthorizationDecision::source).contains(DecisionSource.ROLE);
    }

    @Test
    void missingResourceIdIsRejected() {
        request.addHeader("X-User-Id", CALLER);

        assertThatThrownBy(() -> handler.removeDocument())
                .isInstanceOfSatisfying(AuthorizationFailureException.class,
                        ex -> assertThat(ex.getFailure()).isEqualTo(AuthorizationFailure.RESOURCE_ID_MISSING));
        verify(authorizationService, never()).authorizeResource(anyString(), anyString(), anyString(), anyString());
    }

    @Test
    void missingIdentifierRequiresAuthentication() {
        assertThatThrownBy(() -> handler.listSites())
                .isInstanceOfSatisfying(AuthorizationFailureException.class,
                        ex -> assertThat(ex.getFailure()).isEqualTo(AuthorizationFailure.AUTHENTICATION_REQUIRED));
    }

    @Test
    void moduleActionIsDerivedFromHttpMethod() {
        request.setMethod("PUT");
        request.addHeader("X-User-Id", CALLER);
        when(authorizationService.authorizeModule(CALLER, "sites", "edit"))
                .thenReturn(AuthorizationDecision.fromRoles(CALLER, PermissionFlag.EDIT, "sites", null, null,
                        new RoleModuleEvaluator.Verdict(false, null)));

        assertThatThrownBy(() -> handler.listSites())
                .isInstanceOfSatisfying(PermissionDeniedException.class, ex -> {
                    assertThat(ex.getDetails()).containsEntry("source", "denied");
                    assertThat(ex.getDetails()).containsEntry("required_permission", "edit:sites");
                });
    }

    @Test
    void explicitModuleActionIsUsedAsIs() {
        request.setMethod("POST");
        request.addHeader("X-User-Id", CALLER);
        when(authorizationService.authorizeModule(CALLER, "users", "edit"))
                .thenReturn(AuthorizationDecision.fromRoles(CALLER, PermissionFlag.EDIT, "users", null, null,
                        new RoleModuleEvaluator.Verdict(true, "Admin")));

        assertThat(handler.deactivateUser()).isEqualTo("deactivated");
    }

    static class GatedHandler {

        @RequireResourcePermission(resourceType = "building", action = "view")
        public String showBuilding(String id) {
            return "building " + id;
        }

        @RequireResourcePermission(resourceType = "document", action = "delete", resourceIdParam = "documentId")
        public void removeDocument() {
        }

        @RequireModulePermission(module = "sites")
        public String listSites() {
            return "sites";
        }

        @RequireModulePermission(module = "users", action = "edit")
        public String deactivateUser() {
            return "deactivated";
        }
    }
}
