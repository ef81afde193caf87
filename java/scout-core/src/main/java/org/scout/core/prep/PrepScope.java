package org.scout.core.prep;

import java.util.Locale;

/**
 * Lifetime of a prep value.
 */
public enum PrepScope {
    /** Materialized once per run (once per worker process in parallel mode). */
    SESSION("session"),
    /** Materialized once per loaded test class. */
    CLASS("class"),
    /** Materialized on every resolve within an invocation. */
    METHOD("method");

    private final String label;

    PrepScope(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static PrepScope of(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (PrepScope scope : values()) {
                if (scope.label.equals(normalized)) {
                    return scope;
                }
            }
        }
        throw new InvalidScopeException(value);
    }
}
