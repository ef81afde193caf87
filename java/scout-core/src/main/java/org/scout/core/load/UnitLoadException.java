package org.scout.core.load;

/**
 * Raised when a unit cannot be turned into a loaded namespace: compile errors,
 * linkage errors or a failing static initializer.
 */
public class UnitLoadException extends Exception {

    public UnitLoadException(String message) {
        super(message);
    }

    public UnitLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
