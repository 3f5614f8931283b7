package com.fulqrom.backend.modules.access.domain;

/**
 * The four permission flags carried by role module entries and resource-access grants.
 */
public enum PermissionFlag {
    VIEW("can_view", "view"),
    CREATE("can_create", "create"),
    EDIT("can_edit", "edit"),
    DELETE("can_delete", "delete");

    private final String fieldName;
    private final String action;

    PermissionFlag(String fieldName, String action) {
        this.fieldName = fieldName;
        this.action = action;
    }

    public String fieldName() {
        return fieldName;
    }

    public String action() {
        return action;
    }
}
