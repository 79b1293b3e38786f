package com.phillippitts.tapguard.domain;

/**
 * Terminal operating layout.
 *
 * <ul>
 *   <li>{@link #MANUAL} - an attendant or customer enters the amount; transactions are
 *       created by explicit user action</li>
 *   <li>{@link #ZERO_TOUCH} - pre-configured amount and category; a transaction is always
 *       open and the reader continuously awaits a card (tap-to-pay)</li>
 * </ul>
 */
public enum TerminalLayout {
    MANUAL,
    ZERO_TOUCH
}
