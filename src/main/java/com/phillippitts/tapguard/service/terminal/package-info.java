/**
 * Boundary to the terminal transport bridge.
 *
 * <p>Signals flow in through {@link com.phillippitts.tapguard.service.terminal.TerminalSignalRegistry};
 * commands flow out through {@link com.phillippitts.tapguard.service.terminal.ReaderGateway} and
 * {@link com.phillippitts.tapguard.service.terminal.PaymentIntentGateway}, whose futures are
 * awaited with {@link com.phillippitts.tapguard.service.terminal.GatewayCalls#await}.
 */
package com.phillippitts.tapguard.service.terminal;
