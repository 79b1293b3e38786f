/**
 * Application exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend
 * {@link com.phillippitts.tapguard.exception.TapGuardException}:
 * <ul>
 *   <li>{@link com.phillippitts.tapguard.exception.TerminalCommandException} - a bridge command
 *       failed, timed out or was cancelled; absorbed by the recovery cycle as a failed attempt</li>
 *   <li>{@link com.phillippitts.tapguard.exception.InvalidSignalException} - a signal push could
 *       not be interpreted; mapped to HTTP 400</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.tapguard.exception;
