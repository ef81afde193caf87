package org.scout.core.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Parameter sets for a test method; the method runs once per entry.
 *
 * Each entry is a JSON document. An object binds arguments by parameter name,
 * an array binds them by position:
 * <pre>
 * &#64;Parameters({"{\"a\": 1, \"b\": 2}", "[3, 4]"})
 * public void testAdd(int a, int b) { ... }
 * </pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface Parameters {

    String[] value();
}
