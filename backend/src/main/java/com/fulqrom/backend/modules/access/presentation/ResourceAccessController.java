package com.fulqrom.backend.modules.access.presentation;

import java.util.List;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.fulqrom.backend.modules.access.application.ResourceAccessService;
import com.fulqrom.backend.modules.access.application.ResourceAccessService.GrantCommand;
import com.fulqrom.backend.modules.access.presentation.dto.GrantResourceAccessRequest;
import com.fulqrom.backend.modules.access.presentation.dto.ResourceAccessGrantResponse;
import com.fulqrom.backend.modules.access.presentation.dto.UpdateResourceAccessRequest;
import com.fulqrom.backend.modules.access.presentation.gate.AuthorizationContext;
import com.fulqrom.backend.modules.access.presentation.gate.RequireModulePermission;

import io.swagger.v3.oas.annotations.Operation;

@RestController
@RequestMapping("/users")
public class ResourceAccessController {

    private final ResourceAccessService resourceAccessService;

    public ResourceAccessController(ResourceAccessService resourceAccessService) {
        this.resourceAccessService = resourceAccessService;
    }

    @GetMapping("/{userId}/resource-access")
    @RequireModulePermission(module = "users", action = "view")
    public ResponseEntity<List<ResourceAccessGrantResponse>> listGrants(@PathVariable String userId) {
        return ResponseEntity.ok(resourceAccessService.listGrants(userId).stream()
                .map(ResourceAccessGrantResponse::from)
                .toList());
    }

    @Operation(summary = "Grant resource-specific access", description = "Permissions default to view-only.")
    @PostMapping("/resource-access")
    @RequireModulePermission(module = "users", action = "create")
    public ResponseEntity<ResourceAccessGrantResponse> grant(
            @Valid @RequestBody GrantResourceAccessRequest request,
            HttpServletRequest httpRequest
    ) {
        String actor = AuthorizationContext.requireUserId(httpRequest);
        String grantedBy = request.grantedBy() != null ? request.grantedBy() : actor;
        GrantCommand command = new GrantCommand(
                request.userId(),
                request.resourceType(),
                request.resourceId(),
                request.resourceName(),
                request.permissions() == null ? null : request.permissions().toFlags(),
                grantedBy
        );
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ResourceAccessGrantResponse.from(resourceAccessService.grant(command, actor)));
    }

    @PutMapping("/{userId}/resource-access/{grantId}")
    @RequireModulePermission(module = "users", action = "edit")
    public ResponseEntity<ResourceAccessGrantResponse> updateGrant(
            @PathVariable String userId,
            @PathVariable String grantId,
            @Valid @RequestBody UpdateResourceAccessRequest request
    ) {
        return ResponseEntity.ok(ResourceAccessGrantResponse.from(
                resourceAccessService.updatePermissions(userId, grantId, request.permissions().toFlags())));
    }

    @DeleteMapping("/resource-access/{grantId}")
    @RequireModulePermission(module = "users", action = "delete")
    public ResponseEntity<Void> revokeGrant(
            @PathVariable String grantId,
            @RequestParam(name = "user_id") String userId
    ) {
        resourceAccessService.revoke(userId, grantId);
        return ResponseEntity.noContent().build();
    }
}
