package com.fulqrom.backend.modules.access.presentation.gate;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Requires a module-level permission through the caller's roles.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface RequireModulePermission {

    String module();

    /**
     * Action verb. Empty means derive it from the HTTP method (GET view, POST create, PUT/PATCH edit, DELETE delete).
     */
    String action() default "";
}
