package org.scout.core.prep;

/**
 * Raised when a prep is registered with a scope other than session, class or method.
 */
public class InvalidScopeException extends IllegalArgumentException {

    public InvalidScopeException(String scope) {
        super("Invalid prep scope '" + scope + "' - Use session, class or method");
    }
}
