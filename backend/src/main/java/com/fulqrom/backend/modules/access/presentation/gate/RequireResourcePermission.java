package com.fulqrom.backend.modules.access.presentation.gate;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Requires permission on one resource instance. The resource-specific grant is consulted first, then the
 * roles' entry for the resource type's module.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface RequireResourcePermission {

    /**
     * Resource type, e.g. {@code "building"}.
     */
    String resourceType();

    /**
     * Action verb: view/read, create/add, edit/update, delete/remove.
     */
    String action();

    /**
     * Handler argument, path variable or request parameter holding the resource id.
     */
    String resourceIdParam() default "id";
}
