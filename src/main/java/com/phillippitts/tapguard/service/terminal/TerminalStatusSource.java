package com.phillippitts.tapguard.service.terminal;

import com.phillippitts.tapguard.domain.DisconnectRecord;
import com.phillippitts.tapguard.domain.ReaderConnectionState;
import com.phillippitts.tapguard.domain.ReaderReadiness;
import com.phillippitts.tapguard.domain.Signal;
import com.phillippitts.tapguard.domain.TerminalLayout;

import java.util.Optional;

/**
 * Read side of the terminal bridge: the signals the health sampler consumes.
 *
 * <p>Implementations must not block. Any accessor may throw if the underlying value cannot
 * be read; the sampler folds such failures into the unknown variant.
 */
public interface TerminalStatusSource {

    ReaderConnectionState readerConnectionState();

    ReaderReadiness readerReadiness();

    Signal readerOnline();

    Signal sdkNetworkOnline();

    Signal offlineModeEnabled();

    Signal softwareUpdateInProgress();

    Signal inPaymentSession();

    TerminalLayout layout();

    Optional<DisconnectRecord> lastDisconnect();

    /**
     * Identifier of the reader the terminal was last bound to, used for auto-connect.
     */
    Optional<String> boundReaderId();
}
