package com.fulqrom.backend.modules.access.presentation;

import java.util.List;
import java.util.Map;

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

import com.fulqrom.backend.modules.access.application.RoleService;
import com.fulqrom.backend.modules.access.presentation.dto.RoleRequest;
import com.fulqrom.backend.modules.access.presentation.dto.RoleResponse;
import com.fulqrom.backend.modules.access.presentation.gate.RequireModulePermission;

/**
 * Role administration. The action required on the {@code users} module follows the HTTP method.
 */
@RestController
@RequestMapping("/roles")
public class RoleController {

    private final RoleService roleService;

    public RoleController(RoleService roleService) {
        this.roleService = roleService;
    }

    @GetMapping
    @RequireModulePermission(module = "users")
    public ResponseEntity<List<RoleResponse>> listRoles(
            @RequestParam(name = "active", required = false) Boolean active
    ) {
        return ResponseEntity.ok(roleService.listRoles(active).stream().map(RoleResponse::from).toList());
    }

    @GetMapping("/permissions/matrix")
    @RequireModulePermission(module = "users")
    public ResponseEntity<Map<String, Map<String, Map<String, Boolean>>>> permissionsMatrix() {
        return ResponseEntity.ok(roleService.permissionsMatrix());
    }

    @GetMapping("/name/{name}")
    @RequireModulePermission(module = "users")
    public ResponseEntity<RoleResponse> getRoleByName(@PathVariable String name) {
        return ResponseEntity.ok(RoleResponse.from(roleService.getRoleByName(name)));
    }

    @GetMapping("/{roleId}")
    @RequireModulePermission(module = "users")
    public ResponseEntity<RoleResponse> getRole(@PathVariable String roleId) {
        return ResponseEntity.ok(RoleResponse.from(roleService.getRole(roleId)));
    }

    @PostMapping
    @RequireModulePermission(module = "users")
    public ResponseEntity<RoleResponse> createRole(@Valid @RequestBody RoleRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(RoleResponse.from(roleService.createRole(request.toCommand())));
    }

    @PutMapping("/{roleId}")
    @RequireModulePermission(module = "users")
    public ResponseEntity<RoleResponse> updateRole(
            @PathVariable String roleId,
            @Valid @RequestBody RoleRequest request
    ) {
        return ResponseEntity.ok(RoleResponse.from(roleService.updateRole(roleId, request.toCommand())));
    }

    @DeleteMapping("/{roleId}")
    @RequireModulePermission(module = "users")
    public ResponseEntity<Void> deleteRole(@PathVariable String roleId) {
        roleService.deleteRole(roleId);
        return ResponseEntity.noContent().build();
    }
}
