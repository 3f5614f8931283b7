package com.fulqrom.backend.modules.access.application;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fulqrom.backend.global.error.ProblemException;
import com.fulqrom.backend.global.jpa.HexObjectIds;
import com.fulqrom.backend.modules.access.domain.ModulePermission;
import com.fulqrom.backend.modules.access.domain.Role;
import com.fulqrom.backend.modules.access.infrastructure.persistence.AppUserRepository;
import com.fulqrom.backend.modules.access.infrastructure.persistence.RoleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class RoleService {

    private static final Logger log = LoggerFactory.getLogger(RoleService.class);

    private final RoleRepository roleRepository;
    private final AppUserRepository appUserRepository;

    public RoleService(RoleRepository roleRepository, AppUserRepository appUserRepository) {
        this.roleRepository = roleRepository;
        this.appUserRepository = appUserRepository;
    }

    @Transactional(readOnly = true)
    public List<RoleSummary> listRoles(Boolean active) {
        List<Role> roles = active == null
                ? roleRepository.findAllByOrderByNameAsc()
                : roleRepository.findByActiveOrderByNameAsc(active);
        return roles.stream().map(this::summarize).toList();
    }

    @Transactional(readOnly = true)
    public RoleSummary getRole(@NonNull String roleId) {
        return summarize(findRole(roleId));
    }

    @Transactional(readOnly = true)
    public RoleSummary getRoleByName(@NonNull String name) {
        Role role = roleRepository.findByName(name.trim())
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "role.not_found", "Role not found"));
        return summarize(role);
    }

    public RoleSummary createRole(@NonNull RoleCommand command) {
        String name = requireName(command.name());
        if (roleRepository.existsByName(name)) {
            throw new ProblemException(HttpStatus.CONFLICT, "role.name_taken", "Role with this name already exists");
        }
        List<ModulePermission> permissions = command.permissions() == null ? List.of() : command.permissions();
        ensureUniqueModules(permissions);

        Role role = new Role();
        role.setName(name);
        role.setDescription(trimToNull(command.description()));
        role.setActive(command.active() == null || command.active());
        role.replacePermissions(permissions);
        Role saved = roleRepository.save(role);

        log.info("Created role {} ({}) with {} module entries", saved.getName(), saved.getId(), permissions.size());
        return new RoleSummary(saved, 0);
    }

    public RoleSummary updateRole(@NonNull String roleId, @NonNull RoleCommand command) {
        Role role = findRole(roleId);

        if (command.name() != null && !command.name().isBlank()) {
            String name = command.name().trim();
            if (!name.equals(role.getName()) && roleRepository.existsByName(name)) {
                throw new ProblemException(HttpStatus.CONFLICT, "role.name_taken", "Role with this name already exists");
            }
            role.setName(name);
        }
        if (command.description() != null) {
            role.setDescription(trimToNull(command.description()));
        }
        if (command.active() != null) {
            role.setActive(command.active());
        }
        if (command.permissions() != null) {
            ensureUniqueModules(command.permissions());
            role.replacePermissions(command.permissions());
        }
        Role saved = roleRepository.save(role);

        log.info("Updated role {} ({})", saved.getName(), saved.getId());
        return summarize(saved);
    }

    public void deleteRole(@NonNull String roleId) {
        Role role = findRole(roleId);
        long userCount = appUserRepository.countByRoleId(role.getId());
        if (userCount > 0) {
            throw new ProblemException(HttpStatus.CONFLICT, "role.in_use",
                    "Cannot delete role. It is assigned to " + userCount + " user(s).");
        }
        roleRepository.delete(role);
        log.info("Deleted role {} ({})", role.getName(), role.getId());
    }

    /**
     * Role name to module name to flag map, for the administration screens.
     */
    @Transactional(readOnly = true)
    public Map<String, Map<String, Map<String, Boolean>>> permissionsMatrix() {
        Map<String, Map<String, Map<String, Boolean>>> matrix = new LinkedHashMap<>();
        for (Role role : roleRepository.findByActiveOrderByNameAsc(true)) {
            Map<String, Map<String, Boolean>> modules = new LinkedHashMap<>();
            for (ModulePermission permission : role.getPermissions()) {
                modules.put(permission.getModuleName(), permission.getFlags().asMap());
            }
            matrix.put(role.getName(), modules);
        }
        return matrix;
    }

    Role findRole(String roleId) {
        if (!HexObjectIds.isValid(roleId)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "role.invalid_id", "Invalid role ID format");
        }
        return roleRepository.findById(HexObjectIds.normalize(roleId))
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "role.not_found", "Role not found"));
    }

    private RoleSummary summarize(Role role) {
        return new RoleSummary(role, appUserRepository.countByRoleId(role.getId()));
    }

    private static void ensureUniqueModules(List<ModulePermission> permissions) {
        Set<String> seen = new HashSet<>();
        for (ModulePermission permission : permissions) {
            if (!seen.add(permission.getModuleName())) {
                throw new ProblemException(HttpStatus.BAD_REQUEST, "role.duplicate_module",
                        "Module " + permission.getModuleName() + " is listed more than once");
            }
        }
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "role.name_required", "Role name is required");
        }
        return name.trim();
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public record RoleCommand(String name, String description, Boolean active, List<ModulePermission> permissions) {
    }

    public record RoleSummary(Role role, long userCount) {
    }
}
