package com.fulqrom.backend.modules.access.application;

import com.fulqrom.backend.modules.access.domain.AppUser;
import com.fulqrom.backend.modules.access.domain.PermissionFlag;
import com.fulqrom.backend.modules.access.domain.Role;

import org.springframework.stereotype.Component;

/**
 * Scans active roles in list order; the first role whose entry for the module carries the flag wins.
 */
@Component
public class RoleModuleEvaluator {

    public Verdict evaluate(AppUser user, String moduleName, PermissionFlag flag) {
        if (moduleName == null) {
            return Verdict.denied();
        }
        for (Role role : user.getRoles()) {
            if (!role.isActive()) {
                continue;
            }
            boolean granted = role.findPermission(moduleName)
                    .map(permission -> permission.allows(flag))
                    .orElse(false);
            if (granted) {
                return new Verdict(true, role.getName());
            }
        }
        return Verdict.denied();
    }

    public record Verdict(boolean granted, String roleName) {

        static Verdict denied() {
            return new Verdict(false, null);
        }
    }
}
