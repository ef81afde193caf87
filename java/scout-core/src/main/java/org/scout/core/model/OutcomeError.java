package org.scout.core.model;

/**
 * Classification attached to a failed outcome.
 *
 * @param kind    where the failure happened
 * @param type    fully qualified exception type, when an exception was raised
 * @param message detail text, never empty for {@link Kind#EXCEPTION}
 */
public record OutcomeError(Kind kind, String type, String message) {

    public static final String UNSPECIFIED = "Unspecified";

    public enum Kind {
        EXEC_ERROR,
        CLASS_NOT_FOUND,
        METHOD_NOT_FOUND,
        EXCEPTION
    }

    public static OutcomeError execError(String message) {
        return new OutcomeError(Kind.EXEC_ERROR, null, message);
    }

    public static OutcomeError classNotFound() {
        return new OutcomeError(Kind.CLASS_NOT_FOUND, null, null);
    }

    public static OutcomeError methodNotFound() {
        return new OutcomeError(Kind.METHOD_NOT_FOUND, null, null);
    }

    public static OutcomeError of(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isEmpty()) {
            message = UNSPECIFIED;
        }
        return new OutcomeError(Kind.EXCEPTION, error.getClass().getName(), message);
    }

    public String describe() {
        return switch (kind) {
            case EXEC_ERROR -> "ExecError: " + message;
            case CLASS_NOT_FOUND -> "ClassNotFound";
            case METHOD_NOT_FOUND -> "MethodNotFound";
            case EXCEPTION -> type + " - " + message;
        };
    }
}
