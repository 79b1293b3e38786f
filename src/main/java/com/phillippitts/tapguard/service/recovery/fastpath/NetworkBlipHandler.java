package com.phillippitts.tapguard.service.recovery.fastpath;

import com.phillippitts.tapguard.config.ThreadPoolConfig;
import com.phillippitts.tapguard.config.recovery.RecoveryProperties;
import com.phillippitts.tapguard.domain.PaymentIntentRecord;
import com.phillippitts.tapguard.domain.TerminalLayout;
import com.phillippitts.tapguard.service.recovery.LifecycleAction;
import com.phillippitts.tapguard.service.recovery.TransactionCoordinator;
import com.phillippitts.tapguard.service.terminal.ConnectivityChange;
import com.phillippitts.tapguard.service.terminal.ConnectivityMonitor;
import com.phillippitts.tapguard.service.terminal.TerminalStatusSource;
import com.phillippitts.tapguard.service.terminal.TransactionLedger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Replaces the zero-touch transaction when connectivity flips while the reader awaits a card.
 *
 * <p>A transaction created online cannot complete offline and vice versa, so on every
 * online/offline transition during awaiting-input the transaction is cancelled at once and
 * recreated after a short settle delay with the offline preference of the new state. This
 * runs off the connectivity notification, independent of the polling cycle.
 *
 * <p>Overlapping flips produce one cancel/recreate pair: the in-progress flag is taken on the
 * first flip and released only after the recreate has finished.
 */
@Component
public class NetworkBlipHandler implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(NetworkBlipHandler.class);

    private final ConnectivityMonitor monitor;
    private final TerminalStatusSource status;
    private final TransactionLedger ledger;
    private final TransactionCoordinator coordinator;
    private final Executor executor;
    private final Duration settle;
    private final Consumer<ConnectivityChange> listener = this::onConnectivityChange;

    private final AtomicBoolean blipInProgress = new AtomicBoolean(false);
    private volatile boolean running;

    public NetworkBlipHandler(ConnectivityMonitor monitor,
                              TerminalStatusSource status,
                              TransactionLedger ledger,
                              TransactionCoordinator coordinator,
                              RecoveryProperties props,
                              @Qualifier(ThreadPoolConfig.RECOVERY_TASK_EXECUTOR) Executor executor) {
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.status = Objects.requireNonNull(status, "status");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.settle = Objects.requireNonNull(props, "props").getNetworkBlipSettle();
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        monitor.addListener(listener);
        running = true;
        LOG.info("Network blip handler started (settle={}ms)", settle.toMillis());
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        monitor.removeListener(listener);
        running = false;
        LOG.info("Network blip handler stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    void onConnectivityChange(ConnectivityChange change) {
        if (!change.isTransition() || status.layout() != TerminalLayout.ZERO_TOUCH) {
            return;
        }
        Optional<PaymentIntentRecord> awaiting = ledger.current().filter(PaymentIntentRecord::isAwaitingInput);
        if (awaiting.isEmpty()) {
            return;
        }
        if (!blipInProgress.compareAndSet(false, true)) {
            LOG.debug("Connectivity flip ignored; transaction replacement already in progress");
            return;
        }
        LOG.info("Connectivity went {} while awaiting a card; replacing transaction",
                change.wentOnline() ? "online" : "offline");
        try {
            executor.execute(() -> replace(awaiting.get()));
        } catch (RejectedExecutionException e) {
            blipInProgress.set(false);
            LOG.warn("Could not hand off transaction replacement: {}", e.getMessage());
        }
    }

    private void replace(PaymentIntentRecord intent) {
        try {
            boolean started = coordinator.cancelThenRecreateAfter(intent, LifecycleAction.NETWORK_BLIP, settle,
                    () -> blipInProgress.set(false));
            if (!started) {
                blipInProgress.set(false);
            }
        } catch (RuntimeException e) {
            blipInProgress.set(false);
            LOG.warn("Transaction replacement after connectivity flip failed: {}", e.toString());
        }
    }

    /** Visible for tests */
    boolean isBlipInProgress() {
        return blipInProgress.get();
    }
}
