package com.phillippitts.tapguard.service.terminal;

import com.phillippitts.tapguard.config.recovery.TerminalProperties;
import com.phillippitts.tapguard.domain.DisconnectReason;
import com.phillippitts.tapguard.domain.DisconnectRecord;
import com.phillippitts.tapguard.domain.PaymentIntentRecord;
import com.phillippitts.tapguard.domain.ReaderConnectionState;
import com.phillippitts.tapguard.domain.ReaderReadiness;
import com.phillippitts.tapguard.domain.Signal;
import com.phillippitts.tapguard.domain.TerminalLayout;
import com.phillippitts.tapguard.exception.InvalidSignalException;
import com.phillippitts.tapguard.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * In-memory holder of the signals pushed by the transport bridge.
 *
 * <p>Serves as the read side for the health sampler, the connectivity subscription for the
 * fast path, and the local transaction record. Updates are applied atomically: a push that
 * contains one invalid value changes nothing.
 *
 * <p>When readiness moves into {@code awaiting-input} and the active transaction carries no
 * awaiting-input timestamp, the registry stamps it with the current time; leaving that state
 * clears the stamp. An explicit {@code paymentIntent} in the same push takes precedence.
 *
 * <p>Thread-safe. Connectivity listeners run on the pushing thread, outside the lock.
 */
@Component
public class TerminalSignalRegistry implements TerminalStatusSource, ConnectivityMonitor, TransactionLedger {

    private static final Logger LOG = LogManager.getLogger(TerminalSignalRegistry.class);

    static final Set<String> RESETTABLE_FIELDS = Set.of(
            "readerConnectionState", "readerReadiness", "readerOnline", "sdkNetworkOnline",
            "offlineModeEnabled", "softwareUpdateInProgress", "inPaymentSession", "boundReaderId");

    private final Clock clock;
    private final List<Consumer<ConnectivityChange>> listeners = new CopyOnWriteArrayList<>();
    private final Object lock = new Object();

    private ReaderConnectionState readerConnectionState = ReaderConnectionState.UNKNOWN;
    private ReaderReadiness readerReadiness = ReaderReadiness.UNKNOWN;
    private Signal readerOnline = Signal.UNKNOWN;
    private Signal sdkNetworkOnline = Signal.UNKNOWN;
    private Signal offlineModeEnabled = Signal.UNKNOWN;
    private Signal softwareUpdateInProgress = Signal.UNKNOWN;
    private Signal inPaymentSession = Signal.UNKNOWN;
    private TerminalLayout layout;
    private String boundReaderId;
    private PaymentIntentRecord paymentIntent;
    private DisconnectRecord lastDisconnect;

    public TerminalSignalRegistry(TerminalProperties terminalProperties, Clock clock) {
        this.layout = Objects.requireNonNull(terminalProperties, "terminalProperties").getLayout();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Applies a partial update.
     *
     * @throws InvalidSignalException if any value cannot be interpreted; no field is changed
     */
    public void apply(TerminalSignalUpdate update) {
        Objects.requireNonNull(update, "update");
        ParsedUpdate parsed = parse(update);

        ConnectivityChange change = null;
        synchronized (lock) {
            Signal previousNetwork = sdkNetworkOnline;
            ReaderReadiness previousReadiness = readerReadiness;

            for (String field : update.unknownFields()) {
                resetField(field);
            }
            if (parsed.connectionState != null) {
                readerConnectionState = parsed.connectionState;
            }
            if (parsed.readiness != null) {
                readerReadiness = parsed.readiness;
            }
            if (update.readerOnline() != null) {
                readerOnline = Signal.of(update.readerOnline());
            }
            if (update.sdkNetworkOnline() != null) {
                sdkNetworkOnline = Signal.of(update.sdkNetworkOnline());
            }
            if (update.offlineModeEnabled() != null) {
                offlineModeEnabled = Signal.of(update.offlineModeEnabled());
            }
            if (update.softwareUpdateInProgress() != null) {
                softwareUpdateInProgress = Signal.of(update.softwareUpdateInProgress());
            }
            if (update.inPaymentSession() != null) {
                inPaymentSession = Signal.of(update.inPaymentSession());
            }
            if (parsed.layout != null) {
                layout = parsed.layout;
            }
            if (update.boundReaderId() != null) {
                boundReaderId = update.boundReaderId();
            }
            if (Boolean.TRUE.equals(update.clearLastDisconnect())) {
                lastDisconnect = null;
            }
            if (parsed.disconnect != null) {
                lastDisconnect = parsed.disconnect;
            }
            if (Boolean.TRUE.equals(update.clearPaymentIntent())) {
                paymentIntent = null;
            }
            if (parsed.paymentIntent != null) {
                paymentIntent = parsed.paymentIntent;
            } else {
                trackAwaitingInput(previousReadiness);
            }

            if (previousNetwork.isKnown() && sdkNetworkOnline.isKnown() && previousNetwork != sdkNetworkOnline) {
                change = new ConnectivityChange(previousNetwork, sdkNetworkOnline, clock.instant());
            }
        }

        if (change != null) {
            LOG.info("SDK network went {}", change.wentOnline() ? "online" : "offline");
            notifyListeners(change);
        }
    }

    private ParsedUpdate parse(TerminalSignalUpdate update) {
        for (String field : update.unknownFields()) {
            if (!RESETTABLE_FIELDS.contains(field)) {
                throw new InvalidSignalException("unknownFields", "cannot reset '" + field + "'");
            }
        }
        ReaderConnectionState connectionState = parseEnum("readerConnectionState",
                update.readerConnectionState(), ReaderConnectionState::fromWire);
        ReaderReadiness readiness = parseEnum("readerReadiness",
                update.readerReadiness(), ReaderReadiness::fromWire);
        TerminalLayout parsedLayout = parseEnum("layout", update.layout(),
                value -> TerminalLayout.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_')));

        PaymentIntentRecord intent = null;
        TerminalSignalUpdate.PaymentIntentSignal pushed = update.paymentIntent();
        if (pushed != null) {
            if (pushed.id() == null || pushed.id().isBlank()) {
                throw new InvalidSignalException("paymentIntent.id", "must not be blank");
            }
            if (pushed.createdAt() == null) {
                throw new InvalidSignalException("paymentIntent.createdAt", "must be present");
            }
            intent = new PaymentIntentRecord(pushed.id(), pushed.createdAt(), pushed.awaitingInputSince());
        }

        DisconnectRecord disconnect = null;
        TerminalSignalUpdate.DisconnectSignal reported = update.lastDisconnect();
        if (reported != null) {
            if (reported.at() == null) {
                throw new InvalidSignalException("lastDisconnect.at", "must be present");
            }
            disconnect = new DisconnectRecord(DisconnectReason.fromWire(reported.reason()), reported.at());
        }
        return new ParsedUpdate(connectionState, readiness, parsedLayout, intent, disconnect);
    }

    private static <T> T parseEnum(String field, String value, Function<String, T> parser) {
        if (value == null) {
            return null;
        }
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidSignalException(field, "unrecognised value '" + LogSanitizer.truncate(value, 40) + "'", e);
        }
    }

    private void resetField(String field) {
        switch (field) {
            case "readerConnectionState" -> readerConnectionState = ReaderConnectionState.UNKNOWN;
            case "readerReadiness" -> readerReadiness = ReaderReadiness.UNKNOWN;
            case "readerOnline" -> readerOnline = Signal.UNKNOWN;
            case "sdkNetworkOnline" -> sdkNetworkOnline = Signal.UNKNOWN;
            case "offlineModeEnabled" -> offlineModeEnabled = Signal.UNKNOWN;
            case "softwareUpdateInProgress" -> softwareUpdateInProgress = Signal.UNKNOWN;
            case "inPaymentSession" -> inPaymentSession = Signal.UNKNOWN;
            case "boundReaderId" -> boundReaderId = null;
            default -> throw new IllegalStateException("Unexpected field: " + field);
        }
    }

    private void trackAwaitingInput(ReaderReadiness previousReadiness) {
        if (paymentIntent == null || previousReadiness == readerReadiness) {
            return;
        }
        if (readerReadiness == ReaderReadiness.AWAITING_INPUT && !paymentIntent.isAwaitingInput()) {
            paymentIntent = paymentIntent.awaitingInputFrom(clock.instant());
        } else if (readerReadiness != ReaderReadiness.AWAITING_INPUT && paymentIntent.isAwaitingInput()) {
            paymentIntent = paymentIntent.awaitingInputFrom(null);
        }
    }

    private void notifyListeners(ConnectivityChange change) {
        for (Consumer<ConnectivityChange> listener : listeners) {
            try {
                listener.accept(change);
            } catch (RuntimeException e) {
                LOG.warn("Connectivity listener failed: {}", e.getMessage(), e);
            }
        }
    }

    @Override
    public void addListener(Consumer<ConnectivityChange> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeListener(Consumer<ConnectivityChange> listener) {
        listeners.remove(listener);
    }

    @Override
    public ReaderConnectionState readerConnectionState() {
        synchronized (lock) {
            return readerConnectionState;
        }
    }

    @Override
    public ReaderReadiness readerReadiness() {
        synchronized (lock) {
            return readerReadiness;
        }
    }

    @Override
    public Signal readerOnline() {
        synchronized (lock) {
            return readerOnline;
        }
    }

    @Override
    public Signal sdkNetworkOnline() {
        synchronized (lock) {
            return sdkNetworkOnline;
        }
    }

    @Override
    public Signal offlineModeEnabled() {
        synchronized (lock) {
            return offlineModeEnabled;
        }
    }

    @Override
    public Signal softwareUpdateInProgress() {
        synchronized (lock) {
            return softwareUpdateInProgress;
        }
    }

    @Override
    public Signal inPaymentSession() {
        synchronized (lock) {
            return inPaymentSession;
        }
    }

    @Override
    public TerminalLayout layout() {
        synchronized (lock) {
            return layout;
        }
    }

    @Override
    public Optional<DisconnectRecord> lastDisconnect() {
        synchronized (lock) {
            return Optional.ofNullable(lastDisconnect);
        }
    }

    @Override
    public Optional<String> boundReaderId() {
        synchronized (lock) {
            return Optional.ofNullable(boundReaderId);
        }
    }

    @Override
    public Optional<PaymentIntentRecord> current() {
        synchronized (lock) {
            return Optional.ofNullable(paymentIntent);
        }
    }

    @Override
    public void record(PaymentIntentRecord intent) {
        Objects.requireNonNull(intent, "intent");
        synchronized (lock) {
            if (intent.awaitingInputSince() == null && readerReadiness == ReaderReadiness.AWAITING_INPUT) {
                intent = intent.awaitingInputFrom(clock.instant());
            }
            paymentIntent = intent;
        }
        LOG.debug("Recorded payment intent {}", LogSanitizer.maskIdentifier(intent.id()));
    }

    @Override
    public boolean clear(String paymentIntentId) {
        synchronized (lock) {
            if (paymentIntent == null || !paymentIntent.id().equals(paymentIntentId)) {
                return false;
            }
            paymentIntent = null;
            return true;
        }
    }

    private record ParsedUpdate(ReaderConnectionState connectionState,
                                ReaderReadiness readiness,
                                TerminalLayout layout,
                                PaymentIntentRecord paymentIntent,
                                DisconnectRecord disconnect) {
    }
}
