package com.fulqrom.backend.modules.access.presentation;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.fulqrom.backend.modules.access.application.AuthorizationDecision;
import com.fulqrom.backend.modules.access.application.UserAccessService;
import com.fulqrom.backend.modules.access.presentation.dto.AssignRolesRequest;
import com.fulqrom.backend.modules.access.presentation.dto.UserAccessResponse;
import com.fulqrom.backend.modules.access.presentation.gate.AuthorizationContext;
import com.fulqrom.backend.modules.access.presentation.gate.RequireModulePermission;

@RestController
@RequestMapping("/users")
public class UserAccessController {

    private final UserAccessService userAccessService;

    public UserAccessController(UserAccessService userAccessService) {
        this.userAccessService = userAccessService;
    }

    @PutMapping("/{userId}/roles")
    @RequireModulePermission(module = "users", action = "edit")
    public ResponseEntity<UserAccessResponse> assignRoles(
            @PathVariable String userId,
            @Valid @RequestBody AssignRolesRequest request,
            HttpServletRequest httpRequest
    ) {
        String actor = AuthorizationContext.requireUserId(httpRequest);
        return ResponseEntity.ok(UserAccessResponse.from(userAccessService.assignRoles(userId, request.roleIds(), actor)));
    }

    @PostMapping("/{userId}/deactivate")
    @RequireModulePermission(module = "users", action = "edit")
    public ResponseEntity<UserAccessResponse> deactivate(@PathVariable String userId, HttpServletRequest httpRequest) {
        String actor = AuthorizationContext.current(httpRequest).map(AuthorizationDecision::userId).orElse(null);
        return ResponseEntity.ok(UserAccessResponse.from(userAccessService.deactivate(userId, actor)));
    }
}
