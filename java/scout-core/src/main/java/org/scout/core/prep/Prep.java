package org.scout.core.prep;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares a static, no-argument method of a prep unit as a prep factory.
 * The prep is registered under {@link #name()}, or the method name when that is blank.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface Prep {

    /** One of {@code session}, {@code class} or {@code method}. */
    String scope();

    String name() default "";
}
