package com.github.dimitryivaniuta.scoped.gateway.registry;

import com.github.dimitryivaniuta.scoped.core.endpoint.StandardOperation;
import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares which operation a handler method performs.
 *
 * <p>Without this annotation the operation follows the HTTP method: GET lists, POST creates,
 * PUT updates, PATCH partially updates, DELETE destroys.</p>
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface ScopedOperation {

    /** Standard operation; at most one. Ignored when {@link #custom()} is set. */
    StandardOperation[] value() default {};

    /** Custom operation name; also the scope action, e.g. {@code publish}. */
    String custom() default "";

    /** Explicit scope for this handler only, overriding derivation. */
    String requiredScope() default "";
}
