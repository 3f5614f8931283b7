package com.fulqrom.backend.modules.access.application;

import static org.assertj.core.api.Assertions.assertThat;

import com.fulqrom.backend.modules.access.application.RoleModuleEvaluator.Verdict;
import com.fulqrom.backend.modules.access.domain.AppUser;
import com.fulqrom.backend.modules.access.domain.PermissionFlag;
import com.fulqrom.backend.modules.access.domain.Role;
import com.fulqrom.backend.support.AccessFixtures;

import org.junit.jupiter.api.Test;

class RoleModuleEvaluatorTest {

    private final RoleModuleEvaluator evaluator = new RoleModuleEvaluator();

    @Test
    void grantsThroughFirstRoleCarryingFlag() {
        Role viewer = AccessFixtures.role("Viewer", AccessFixtures.module("buildings", true, false, false, false));
        Role editor = AccessFixtures.role("Editor", AccessFixtures.module("buildings", true, false, true, false));
        Role admin = AccessFixtures.role("Admin", AccessFixtures.module("buildings", true, true, true, true));
        AppUser user = AccessFixtures.user("u1", viewer, editor, admin);

        Verdict verdict = evaluator.evaluate(user, "buildings", PermissionFlag.EDIT);

        assertThat(verdict.granted()).isTrue();
        assertThat(verdict.roleName()).isEqualTo("Editor");
    }

    @Test
    void skipsInactiveRoles() {
        Role disabled = AccessFixtures.role("Disabled", AccessFixtures.module("sites", true, true, true, true));
        disabled.setActive(false);
        AppUser user = AccessFixtures.user("u1", disabled);

        assertThat(evaluator.evaluate(user, "sites", PermissionFlag.VIEW).granted()).isFalse();
    }

    @Test
    void missingModuleEntryMeansNoAccess() {
        Role role = AccessFixtures.role("Tenants", AccessFixtures.module("floors", true, false, false, false));
        AppUser user = AccessFixtures.user("u1", role);

        Verdict verdict = evaluator.evaluate(user, "documents", PermissionFlag.VIEW);

        assertThat(verdict.granted()).isFalse();
        assertThat(verdict.roleName()).isNull();
    }

    @Test
    void unmappedModuleIsDenied() {
        Role role = AccessFixtures.role("Admin", AccessFixtures.module("users", true, true, true, true));
        AppUser user = AccessFixtures.user("u1", role);

        assertThat(evaluator.evaluate(user, null, PermissionFlag.VIEW).granted()).isFalse();
    }

    @Test
    void userWithoutRolesIsDenied() {
        assertThat(evaluator.evaluate(AccessFixtures.user("u1"), "assets", PermissionFlag.VIEW).granted()).isFalse();
    }
}
