package com.phillippitts.tapguard.exception;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Thrown when a command sent to the terminal bridge fails, times out or is superseded.
 *
 * <p>Inside the recovery engine this exception never leaves a cycle; it is converted into
 * a failed attempt and retried according to backoff.
 */
public class TerminalCommandException extends TapGuardException {

    private final String command;
    private final boolean timedOut;

    public TerminalCommandException(String command, String message) {
        super(message + " (command: " + command + ")");
        this.command = command;
        this.timedOut = false;
    }

    public TerminalCommandException(String command, String message, Throwable cause) {
        this(command, message, cause, false);
    }

    private TerminalCommandException(String command, String message, Throwable cause, boolean timedOut) {
        super(message + " (command: " + command + ")", cause);
        this.command = command;
        this.timedOut = timedOut;
    }

    /**
     * Translates the failure of an awaited gateway future.
     */
    public static TerminalCommandException from(String command, Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause instanceof TerminalCommandException tce) {
            return tce;
        }
        if (cause instanceof TimeoutException) {
            return new TerminalCommandException(command, "timed out", cause, true);
        }
        if (cause instanceof CancellationException) {
            return new TerminalCommandException(command, "cancelled", cause, false);
        }
        String detail = cause == null ? "failed" : "failed: " + cause.getMessage();
        return new TerminalCommandException(command, detail, cause, false);
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public String getCommand() {
        return command;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
