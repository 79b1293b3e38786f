package com.phillippitts.tapguard.service.recovery;

import com.phillippitts.tapguard.config.recovery.RecoveryProperties;
import com.phillippitts.tapguard.domain.HealthSnapshot;
import com.phillippitts.tapguard.domain.PaymentIntentRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Age and stuck-input checks on the active transaction, run before classification.
 *
 * <p>First match wins: hard timeout, then proactive refresh, then stuck awaiting input.
 * The guard keeps no state between cycles. A failed cancel or recreate is simply
 * re-derived from the next snapshot.
 */
@Component
public class PaymentIntentLifecycleGuard {

    private static final Logger LOG = LogManager.getLogger(PaymentIntentLifecycleGuard.class);

    private final Duration hardTimeout;
    private final Duration proactiveRefresh;
    private final Duration stuckAwaitingInput;
    private final TransactionCoordinator coordinator;

    public PaymentIntentLifecycleGuard(RecoveryProperties props, TransactionCoordinator coordinator) {
        Objects.requireNonNull(props, "props");
        this.hardTimeout = props.getPaymentIntentHardTimeout();
        this.proactiveRefresh = props.getPaymentIntentProactiveRefresh();
        this.stuckAwaitingInput = props.getStuckAwaitingInput();
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
    }

    /**
     * Pure inspection of the snapshot; performs no calls.
     */
    public LifecycleVerdict inspect(HealthSnapshot snapshot) {
        Optional<PaymentIntentRecord> current = snapshot.currentPaymentIntent();
        if (current.isEmpty()) {
            return LifecycleVerdict.none();
        }
        PaymentIntentRecord intent = current.get();
        Duration age = intent.age(snapshot.sampledAt());
        if (age.compareTo(hardTimeout) >= 0) {
            return verdict(LifecycleAction.HARD_TIMEOUT, intent, snapshot);
        }
        if (age.compareTo(proactiveRefresh) >= 0) {
            return verdict(LifecycleAction.PROACTIVE_REFRESH, intent, snapshot);
        }
        boolean stuck = intent.awaitingInputFor(snapshot.sampledAt())
                .map(waiting -> waiting.compareTo(stuckAwaitingInput) >= 0)
                .orElse(false);
        if (stuck) {
            return verdict(LifecycleAction.STUCK_AWAITING_INPUT, intent, snapshot);
        }
        return LifecycleVerdict.none();
    }

    /**
     * Inspects the snapshot and carries out the matching action, if any.
     */
    public LifecycleOutcome enforce(HealthSnapshot snapshot) {
        LifecycleVerdict verdict = inspect(snapshot);
        if (!verdict.requiresAction()) {
            return LifecycleOutcome.notRequired();
        }
        PaymentIntentRecord intent = verdict.paymentIntent();
        LOG.info("Transaction check {} matched (age {}s, recreate={})", verdict.action().tag(),
                intent.age(snapshot.sampledAt()).toSeconds(), verdict.recreate());
        return coordinator.replace(intent, verdict.action(), verdict.recreate());
    }

    private static LifecycleVerdict verdict(LifecycleAction action, PaymentIntentRecord intent, HealthSnapshot snapshot) {
        return new LifecycleVerdict(action, intent, action.recreates() && snapshot.isZeroTouch());
    }
}
