package org.scout.core.prep;

/**
 * Raised when a test resolves a prep that nobody registered.
 */
public class PrepNotFoundException extends RuntimeException {

    public PrepNotFoundException(PrepScope scope, String name) {
        super("No prep registered for " + scope.label() + ":" + name);
    }
}
