package com.phillippitts.tapguard.exception;

/**
 * Thrown when the transport bridge pushes a signal value that cannot be interpreted.
 */
public class InvalidSignalException extends TapGuardException {

    private final String field;

    public InvalidSignalException(String field, String message) {
        super("Invalid signal '" + field + "': " + message);
        this.field = field;
    }

    public InvalidSignalException(String field, String message, Throwable cause) {
        super("Invalid signal '" + field + "': " + message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
