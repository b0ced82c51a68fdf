package com.github.dimitryivaniuta.scoped.gateway.registry;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Scope metadata for a controller. Every handler of an annotated or unannotated
 * controller is registered; the annotation only overrides what would be derived.
 */
@Documented
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface ScopedResource {

    /** Resource name; derived from the controller class name when empty. */
    String name() default "";

    /** Module the resource's scopes are catalogued under; the controller package when empty. */
    String module() default "";

    /** Single scope required by every handler of the controller, overriding derivation. */
    String requiredScope() default "";

    /** Custom operations the controller exposes, in addition to those on its handlers. */
    String[] customOperations() default {};
}
