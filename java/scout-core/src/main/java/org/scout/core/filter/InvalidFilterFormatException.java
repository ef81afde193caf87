package org.scout.core.filter;

/**
 * Raised for a dotted filter expression with fewer than one or more than three segments.
 */
public class InvalidFilterFormatException extends IllegalArgumentException {

    public InvalidFilterFormatException(String message) {
        super(message);
    }
}
