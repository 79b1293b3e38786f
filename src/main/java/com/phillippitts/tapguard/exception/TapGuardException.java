package com.phillippitts.tapguard.exception;

/**
 * Base exception for all tap-guard application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class TapGuardException extends RuntimeException {

    public TapGuardException(String message) {
        super(message);
    }

    public TapGuardException(String message, Throwable cause) {
        super(message, cause);
    }

    public TapGuardException(Throwable cause) {
        super(cause);
    }
}
