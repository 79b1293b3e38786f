package com.phillippitts.tapguard.service.recovery;

import com.phillippitts.tapguard.config.recovery.RecoveryProperties;
import com.phillippitts.tapguard.config.recovery.TerminalProperties;
import com.phillippitts.tapguard.domain.HealthSnapshot;
import com.phillippitts.tapguard.domain.RecoveryType;
import com.phillippitts.tapguard.exception.TerminalCommandException;
import com.phillippitts.tapguard.service.terminal.DiscoveredReader;
import com.phillippitts.tapguard.service.terminal.GatewayCalls;
import com.phillippitts.tapguard.service.terminal.ReaderGateway;
import com.phillippitts.tapguard.service.terminal.TransactionLedger;
import com.phillippitts.tapguard.util.LogSanitizer;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Performs the remediation for a recovery type.
 *
 * <p>Reader-class failures run the reconnect sequence: cancel discovery, clear discovered
 * readers, start discovery, wait for the bound reader (or the first reader if none is known)
 * and connect. Every step is bounded. On success in the zero-touch layout the active
 * transaction is replaced so the reader returns to awaiting a card.
 *
 * <p>At most one reconnect sequence is in flight. Starting a new one cancels the previous
 * sequence first; cancelling a finished sequence does nothing.
 */
@Component
public class RecoveryExecutor {

    private static final Logger LOG = LogManager.getLogger(RecoveryExecutor.class);

    private final ReaderGateway readers;
    private final TransactionCoordinator coordinator;
    private final TransactionLedger ledger;
    private final String deviceTypeFilter;
    private final Duration callTimeout;
    private final Duration discoveryTimeout;

    private final AtomicReference<ReconnectSequence> inFlight = new AtomicReference<>();

    public RecoveryExecutor(ReaderGateway readers,
                            TransactionCoordinator coordinator,
                            TransactionLedger ledger,
                            TerminalProperties terminalProperties,
                            RecoveryProperties recoveryProperties) {
        this.readers = Objects.requireNonNull(readers, "readers");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.deviceTypeFilter = terminalProperties.getDeviceTypeFilter();
        this.callTimeout = recoveryProperties.getSdkCallTimeout();
        this.discoveryTimeout = recoveryProperties.getDiscoveryTimeout();
    }

    /**
     * Executes one attempt for {@code type}. Never throws for gateway failures.
     *
     * @throws IllegalArgumentException for {@link RecoveryType#NONE}
     */
    public RecoveryOutcome execute(RecoveryType type, HealthSnapshot snapshot) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(snapshot, "snapshot");
        if (!type.isFailure()) {
            throw new IllegalArgumentException("Nothing to execute for " + type);
        }
        if (!type.requiresReconnect()) {
            LOG.debug("{}: passive, waiting for the network to return", type);
            return RecoveryOutcome.passive(type);
        }

        ReconnectSequence sequence = new ReconnectSequence(snapshot.boundReader().orElse(null));
        ReconnectSequence previous = inFlight.getAndSet(sequence);
        if (previous != null) {
            LOG.info("Superseding outstanding reconnect sequence");
            previous.cancel();
        }
        try {
            DiscoveredReader reader = sequence.run();
            LOG.info("{}: connected to reader {}", type, LogSanitizer.maskIdentifier(reader.id()));
        } catch (TerminalCommandException e) {
            LOG.warn("{}: reconnect attempt failed: {}", type, e.getMessage());
            return RecoveryOutcome.failed(type, e.getMessage());
        } finally {
            inFlight.compareAndSet(sequence, null);
        }

        boolean recreated = false;
        if (snapshot.isZeroTouch()) {
            LifecycleOutcome refresh = coordinator.replace(ledger.current().orElse(null),
                    LifecycleAction.POST_RECONNECT, true);
            recreated = refresh.recreated();
        }
        return RecoveryOutcome.succeeded(type, "reader connected", recreated);
    }

    /**
     * Cancels the outstanding reconnect sequence, if any.
     */
    public void cancelOutstanding() {
        ReconnectSequence sequence = inFlight.getAndSet(null);
        if (sequence != null) {
            sequence.cancel();
        }
    }

    boolean hasSequenceInFlight() {
        return inFlight.get() != null;
    }

    @PreDestroy
    void shutdown() {
        cancelOutstanding();
    }

    /**
     * One cancellable pass through the reconnect steps.
     */
    private final class ReconnectSequence {
        private final String boundReaderId;
        private final CompletableFuture<DiscoveredReader> found = new CompletableFuture<>();
        private volatile CompletableFuture<?> pending;
        private volatile boolean cancelled;
        private volatile boolean finished;

        ReconnectSequence(String boundReaderId) {
            this.boundReaderId = boundReaderId;
        }

        DiscoveredReader run() {
            try {
                return connectToBoundReader();
            } finally {
                finished = true;
            }
        }

        private DiscoveredReader connectToBoundReader() {
            step("cancel-discovery", readers::cancelDiscovery, callTimeout);
            step("clear-discovered-devices", readers::clearDiscoveredReaders, callTimeout);

            ensureActive("start-discovery");
            CompletableFuture<Void> discovery = GatewayCalls.invoke("start-discovery",
                    () -> readers.startDiscovery(deviceTypeFilter, this::onReaders));
            pending = discovery;
            discovery.whenComplete((ignored, failure) -> found.completeExceptionally(failure != null
                    ? failure
                    : new TerminalCommandException("start-discovery", "discovery ended without the bound reader")));
            DiscoveredReader reader;
            try {
                reader = GatewayCalls.await(found, discoveryTimeout, "start-discovery");
            } catch (TerminalCommandException e) {
                stopDiscovery();
                throw e;
            }
            DiscoveredReader target = reader;
            step("connect", () -> readers.connect(target.id()), callTimeout);
            return target;
        }

        private void onReaders(List<DiscoveredReader> discovered) {
            if (discovered == null || discovered.isEmpty()) {
                return;
            }
            Optional<DiscoveredReader> match = boundReaderId == null
                    ? Optional.of(discovered.get(0))
                    : discovered.stream().filter(r -> boundReaderId.equals(r.id())).findFirst();
            match.ifPresent(found::complete);
        }

        private <T> T step(String command, Supplier<CompletableFuture<T>> call, Duration timeout) {
            ensureActive(command);
            CompletableFuture<T> started = GatewayCalls.invoke(command, call);
            pending = started;
            T result = GatewayCalls.await(started, timeout, command);
            ensureActive(command);
            return result;
        }

        private void ensureActive(String command) {
            if (cancelled) {
                throw new TerminalCommandException(command, "superseded");
            }
        }

        private void stopDiscovery() {
            GatewayCalls.invoke("cancel-discovery", readers::cancelDiscovery)
                    .whenComplete((ignored, failure) -> {
                        if (failure != null) {
                            LOG.debug("cancel-discovery after failed discovery: {}", failure.toString());
                        }
                    });
        }

        void cancel() {
            if (cancelled || finished) {
                return;
            }
            cancelled = true;
            found.completeExceptionally(new CancellationException("reconnect superseded"));
            CompletableFuture<?> current = pending;
            if (current != null) {
                current.cancel(true);
            }
            stopDiscovery();
        }
    }
}
