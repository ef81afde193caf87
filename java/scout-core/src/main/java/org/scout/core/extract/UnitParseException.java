package org.scout.core.extract;

/**
 * Raised when a unit cannot be structurally analyzed.
 */
public class UnitParseException extends Exception {

    public UnitParseException(String message) {
        super(message);
    }
}
