package com.wayfarer.crm.infrastructure.web;

import com.wayfarer.security.Action;
import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the module and action a handler requires.
 *
 * <p>{@link AccessGateInterceptor} evaluates it before the handler runs. Handlers without it
 * are not gated.
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RequiresPermission {

    /** Module identifier, see {@link com.wayfarer.security.Modules}. */
    String module();

    Action action();
}
