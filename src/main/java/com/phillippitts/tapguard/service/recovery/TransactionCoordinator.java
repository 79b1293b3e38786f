package com.phillippitts.tapguard.service.recovery;

import com.phillippitts.tapguard.config.logging.ThreadContextTaskDecorator;
import com.phillippitts.tapguard.config.recovery.RecoveryProperties;
import com.phillippitts.tapguard.config.recovery.TerminalProperties;
import com.phillippitts.tapguard.domain.OfflineBehavior;
import com.phillippitts.tapguard.domain.PaymentIntentRecord;
import com.phillippitts.tapguard.domain.PaymentIntentRequest;
import com.phillippitts.tapguard.exception.TerminalCommandException;
import com.phillippitts.tapguard.service.recovery.event.LifecycleActionEvent;
import com.phillippitts.tapguard.service.terminal.GatewayCalls;
import com.phillippitts.tapguard.service.terminal.PaymentIntentGateway;
import com.phillippitts.tapguard.service.terminal.TerminalStatusSource;
import com.phillippitts.tapguard.service.terminal.TransactionLedger;
import com.phillippitts.tapguard.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-flight guard around transaction cancel and recreate.
 *
 * <p>The lifecycle guard, the post-reconnect refresh and the network-blip fast path all
 * replace the active transaction. Only one such operation runs at a time; a request that
 * arrives while another is in flight is dropped with {@link LifecycleOutcome.Status#BUSY}
 * and the next cycle re-derives whether it is still needed.
 *
 * <p>Cancel order: stop collecting (if the reader is awaiting a card), cancel the intent,
 * clear the local record. A hard timeout clears the local record even when the cancel call
 * fails, since the backend has already expired the intent.
 */
@Component
public class TransactionCoordinator {

    private static final Logger LOG = LogManager.getLogger(TransactionCoordinator.class);

    private final PaymentIntentGateway gateway;
    private final TransactionLedger ledger;
    private final TerminalStatusSource status;
    private final TerminalProperties.TapToPay preset;
    private final Duration callTimeout;
    private final TaskScheduler scheduler;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private final AtomicBoolean inFlight = new AtomicBoolean(false);

    public TransactionCoordinator(PaymentIntentGateway gateway,
                                  TransactionLedger ledger,
                                  TerminalStatusSource status,
                                  TerminalProperties terminalProperties,
                                  RecoveryProperties recoveryProperties,
                                  TaskScheduler scheduler,
                                  ApplicationEventPublisher publisher,
                                  Clock clock) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.status = Objects.requireNonNull(status, "status");
        this.preset = Objects.requireNonNull(terminalProperties, "terminalProperties").getTapToPay();
        this.callTimeout = Objects.requireNonNull(recoveryProperties, "recoveryProperties").getSdkCallTimeout();
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Cancels {@code intent} (if present) and optionally creates a replacement, on the calling thread.
     *
     * @param intent   transaction to cancel, or {@code null} to only create
     * @param recreate whether to create a replacement after cancelling
     */
    public LifecycleOutcome replace(PaymentIntentRecord intent, LifecycleAction action, boolean recreate) {
        Objects.requireNonNull(action, "action");
        if (!inFlight.compareAndSet(false, true)) {
            return dropped(intent, action);
        }
        try {
            LifecycleOutcome outcome = cancelThenCreate(intent, action, recreate);
            publish(intent, outcome);
            return outcome;
        } finally {
            inFlight.set(false);
        }
    }

    /**
     * Cancels {@code intent} now and creates a replacement after {@code settle} on the task
     * scheduler. The single-flight slot stays taken until the replacement finishes; then
     * {@code onDone} runs.
     *
     * @return {@code false} if another operation was in flight and nothing was done
     */
    public boolean cancelThenRecreateAfter(PaymentIntentRecord intent,
                                           LifecycleAction action,
                                           Duration settle,
                                           Runnable onDone) {
        Objects.requireNonNull(intent, "intent");
        Objects.requireNonNull(settle, "settle");
        Objects.requireNonNull(onDone, "onDone");
        if (!inFlight.compareAndSet(false, true)) {
            dropped(intent, action);
            return false;
        }
        boolean handedOff = false;
        try {
            cancel(intent, action);
            scheduler.schedule(ThreadContextTaskDecorator.propagating(() -> recreateAndRelease(intent, action, onDone)),
                    clock.instant().plus(settle));
            handedOff = true;
        } catch (TerminalCommandException e) {
            LOG.warn("{}: cancel failed, not recreating: {}", action.tag(), e.getMessage());
            publish(intent, LifecycleOutcome.failed(action, e.getMessage()));
        } finally {
            if (!handedOff) {
                inFlight.set(false);
                onDone.run();
            }
        }
        return true;
    }

    public boolean isBusy() {
        return inFlight.get();
    }

    private void recreateAndRelease(PaymentIntentRecord cancelled, LifecycleAction action, Runnable onDone) {
        try {
            create(action);
            publish(cancelled, LifecycleOutcome.applied(action, true));
        } catch (TerminalCommandException e) {
            LOG.warn("{}: recreate failed: {}", action.tag(), e.getMessage());
            publish(cancelled, LifecycleOutcome.failed(action, e.getMessage()));
        } finally {
            inFlight.set(false);
            onDone.run();
        }
    }

    private LifecycleOutcome cancelThenCreate(PaymentIntentRecord intent, LifecycleAction action, boolean recreate) {
        if (intent != null) {
            try {
                cancel(intent, action);
            } catch (TerminalCommandException e) {
                if (action != LifecycleAction.HARD_TIMEOUT) {
                    LOG.warn("{}: cancel failed: {}", action.tag(), e.getMessage());
                    return LifecycleOutcome.failed(action, e.getMessage());
                }
                LOG.warn("{}: cancel failed, clearing expired transaction anyway: {}", action.tag(), e.getMessage());
                ledger.clear(intent.id());
            }
        }
        if (!recreate) {
            return LifecycleOutcome.applied(action, false);
        }
        try {
            create(action);
            return LifecycleOutcome.applied(action, true);
        } catch (TerminalCommandException e) {
            LOG.warn("{}: recreate failed: {}", action.tag(), e.getMessage());
            return LifecycleOutcome.failed(action, e.getMessage());
        }
    }

    private void cancel(PaymentIntentRecord intent, LifecycleAction action) {
        String masked = LogSanitizer.maskIdentifier(intent.id());
        if (intent.isAwaitingInput()) {
            try {
                GatewayCalls.awaitCall(() -> gateway.cancelPaymentCollection(intent.id()), callTimeout,
                        "cancel-payment-collection");
            } catch (TerminalCommandException e) {
                // The intent cancel below also ends collection
                LOG.debug("{}: cancel collection for {} failed: {}", action.tag(), masked, e.getMessage());
            }
        }
        GatewayCalls.awaitCall(() -> gateway.cancelPaymentIntent(intent.id()), callTimeout,
                "cancel-payment-intent");
        ledger.clear(intent.id());
        LOG.info("{}: cancelled transaction {}", action.tag(), masked);
    }

    private void create(LifecycleAction action) {
        OfflineBehavior offline = OfflineBehavior.from(status.offlineModeEnabled(), status.sdkNetworkOnline());
        PaymentIntentRequest request = new PaymentIntentRequest(
                preset.amount(), preset.currency(), preset.category(), offline, true);
        PaymentIntentRecord created = GatewayCalls.awaitCall(() -> gateway.createPaymentIntent(request), callTimeout,
                "create-payment-intent");
        if (created == null) {
            throw new TerminalCommandException("create-payment-intent", "no transaction returned");
        }
        ledger.record(created);
        LOG.info("{}: created transaction {} ({})", action.tag(), LogSanitizer.maskIdentifier(created.id()), offline);
    }

    private LifecycleOutcome dropped(PaymentIntentRecord intent, LifecycleAction action) {
        LOG.info("{}: dropped, another transaction operation is in flight", action.tag());
        LifecycleOutcome outcome = LifecycleOutcome.busy(action);
        publish(intent, outcome);
        return outcome;
    }

    private void publish(PaymentIntentRecord intent, LifecycleOutcome outcome) {
        publisher.publishEvent(new LifecycleActionEvent(outcome.action(), outcome.status(),
                intent == null ? null : LogSanitizer.maskIdentifier(intent.id()),
                outcome.recreated(), outcome.detail(), clock.instant()));
    }
}
