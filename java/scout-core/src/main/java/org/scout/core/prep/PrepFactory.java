package org.scout.core.prep;

/**
 * Produces a prep value.
 */
@FunctionalInterface
public interface PrepFactory {

    Object create() throws Exception;
}
