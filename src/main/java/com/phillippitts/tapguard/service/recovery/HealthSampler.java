package com.phillippitts.tapguard.service.recovery;

import com.phillippitts.tapguard.domain.HealthSnapshot;
import com.phillippitts.tapguard.domain.ReaderConnectionState;
import com.phillippitts.tapguard.domain.ReaderReadiness;
import com.phillippitts.tapguard.domain.Signal;
import com.phillippitts.tapguard.domain.TerminalLayout;
import com.phillippitts.tapguard.service.terminal.TerminalStatusSource;
import com.phillippitts.tapguard.service.terminal.TransactionLedger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Assembles a {@link HealthSnapshot} from the collaborators.
 *
 * <p>Each field is read independently. A read that throws or returns {@code null} yields the
 * field's unknown variant instead of failing the whole sample, so a single broken signal
 * cannot stop the cycle and can never be mistaken for a healthy reading.
 */
@Component
public class HealthSampler {

    private static final Logger LOG = LogManager.getLogger(HealthSampler.class);

    private final TerminalStatusSource status;
    private final TransactionLedger ledger;
    private final Clock clock;

    public HealthSampler(TerminalStatusSource status, TransactionLedger ledger, Clock clock) {
        this.status = Objects.requireNonNull(status, "status");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public HealthSnapshot sample() {
        return HealthSnapshot.builder(clock.instant())
                .readerConnectionState(read("readerConnectionState", status::readerConnectionState,
                        ReaderConnectionState.UNKNOWN))
                .readerReadiness(read("readerReadiness", status::readerReadiness, ReaderReadiness.UNKNOWN))
                .readerOnline(read("readerOnline", status::readerOnline, Signal.UNKNOWN))
                .sdkNetworkOnline(read("sdkNetworkOnline", status::sdkNetworkOnline, Signal.UNKNOWN))
                .offlineModeEnabled(read("offlineModeEnabled", status::offlineModeEnabled, Signal.UNKNOWN))
                .softwareUpdateInProgress(read("softwareUpdateInProgress", status::softwareUpdateInProgress,
                        Signal.UNKNOWN))
                .inPaymentSession(read("inPaymentSession", status::inPaymentSession, Signal.UNKNOWN))
                // An unreadable layout must not enable automatic transaction recreation
                .layout(read("layout", status::layout, TerminalLayout.MANUAL))
                .lastDisconnect(readOptional("lastDisconnect", status::lastDisconnect))
                .paymentIntent(readOptional("paymentIntent", ledger::current))
                .boundReaderId(readOptional("boundReaderId", status::boundReaderId))
                .build();
    }

    private <T> T read(String field, Supplier<T> reader, T unknown) {
        try {
            T value = reader.get();
            return value == null ? unknown : value;
        } catch (RuntimeException e) {
            LOG.warn("Could not read {}; treating as unknown: {}", field, e.toString());
            return unknown;
        }
    }

    private <T> T readOptional(String field, Supplier<Optional<T>> reader) {
        Optional<T> value = read(field, reader, Optional.empty());
        return value.orElse(null);
    }
}
