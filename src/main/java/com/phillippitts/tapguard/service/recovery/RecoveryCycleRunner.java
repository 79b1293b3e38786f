package com.phillippitts.tapguard.service.recovery;

import com.phillippitts.tapguard.config.ThreadPoolConfig;
import com.phillippitts.tapguard.config.recovery.RecoveryProperties;
import com.phillippitts.tapguard.domain.HealthSnapshot;
import com.phillippitts.tapguard.domain.RecoveryState;
import com.phillippitts.tapguard.domain.RecoveryType;
import com.phillippitts.tapguard.service.recovery.event.RecoveryCycleEvent;
import com.phillippitts.tapguard.service.recovery.event.RecoveryMilestoneEvent;
import com.phillippitts.tapguard.service.recovery.event.RecoverySucceededEvent;
import com.phillippitts.tapguard.service.recovery.event.SuppressionWindowClosedEvent;
import com.phillippitts.tapguard.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives the recovery pipeline: sample, gate, lifecycle checks, classify, schedule, execute.
 *
 * <p>Cycles run on the polling schedule and on demand (after a reconnect attempt, when a
 * reboot grace window closes, or through the API). Only one cycle runs at a time; a cycle
 * requested while another is running is skipped rather than queued, since the next poll
 * samples fresh state anyway. This class is the only writer of {@link RecoveryState}.
 *
 * <p>Nothing escapes a cycle. Unexpected exceptions are logged and the schedule continues.
 */
@Component
public class RecoveryCycleRunner {

    private static final Logger LOG = LogManager.getLogger(RecoveryCycleRunner.class);

    static final String MDC_CYCLE_ID = "cycleId";
    static final String MDC_TRIGGER = "trigger";

    public static final String TRIGGER_SCHEDULED = "scheduled";
    public static final String TRIGGER_POST_ATTEMPT = "post-attempt";
    public static final String TRIGGER_GRACE_EXPIRED = "reboot-grace-expired";
    public static final String TRIGGER_MANUAL = "manual";

    private final RecoveryProperties props;
    private final HealthSampler sampler;
    private final SuppressionGate gate;
    private final PaymentIntentLifecycleGuard lifecycleGuard;
    private final ConditionEvaluator evaluator;
    private final RecoveryScheduler scheduler;
    private final RecoveryExecutor executor;
    private final RecoveryStatusBoard board;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;
    private final Executor followUpExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong cycleSequence = new AtomicLong();
    private RecoveryType lastClassification;

    public RecoveryCycleRunner(RecoveryProperties props,
                               HealthSampler sampler,
                               SuppressionGate gate,
                               PaymentIntentLifecycleGuard lifecycleGuard,
                               ConditionEvaluator evaluator,
                               RecoveryScheduler scheduler,
                               RecoveryExecutor executor,
                               RecoveryStatusBoard board,
                               ApplicationEventPublisher publisher,
                               Clock clock,
                               @Qualifier(ThreadPoolConfig.RECOVERY_TASK_EXECUTOR) Executor followUpExecutor) {
        this.props = Objects.requireNonNull(props, "props");
        this.sampler = Objects.requireNonNull(sampler, "sampler");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.lifecycleGuard = Objects.requireNonNull(lifecycleGuard, "lifecycleGuard");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.board = Objects.requireNonNull(board, "board");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.followUpExecutor = Objects.requireNonNull(followUpExecutor, "followUpExecutor");
    }

    @Scheduled(fixedDelayString = "${terminal.recovery.polling-interval-seconds:30}",
            initialDelayString = "${terminal.recovery.initial-delay-seconds:5}",
            timeUnit = TimeUnit.SECONDS)
    void scheduledCycle() {
        runCycle(TRIGGER_SCHEDULED);
    }

    @EventListener
    void onSuppressionWindowClosed(SuppressionWindowClosedEvent event) {
        requestCycle(TRIGGER_GRACE_EXPIRED);
    }

    /**
     * Runs a cycle asynchronously on the recovery executor.
     */
    public void requestCycle(String trigger) {
        try {
            followUpExecutor.execute(() -> runCycle(trigger));
        } catch (RejectedExecutionException e) {
            LOG.warn("Could not submit {} cycle: {}", trigger, e.getMessage());
        }
    }

    /**
     * Runs one cycle on the calling thread.
     *
     * @return the report, or empty if recovery is disabled, another cycle is running, or the
     *         cycle failed unexpectedly
     */
    public Optional<CycleReport> runCycle(String trigger) {
        Objects.requireNonNull(trigger, "trigger");
        if (!props.isEnabled()) {
            return Optional.empty();
        }
        if (!running.compareAndSet(false, true)) {
            LOG.debug("Skipping {} cycle: another cycle is running", trigger);
            return Optional.empty();
        }
        long cycleId = cycleSequence.incrementAndGet();
        long startNanos = System.nanoTime();
        CycleReport report = null;
        ThreadContext.put(MDC_CYCLE_ID, Long.toString(cycleId));
        ThreadContext.put(MDC_TRIGGER, trigger);
        try {
            report = cycle(cycleId, trigger);
            publisher.publishEvent(new RecoveryCycleEvent(report));
            LOG.debug("Cycle {} finished in {} ms", cycleId, TimeUtils.elapsedMillis(startNanos));
        } catch (RuntimeException e) {
            LOG.error("Recovery cycle {} failed unexpectedly: {}", cycleId, e.toString(), e);
        } finally {
            ThreadContext.remove(MDC_CYCLE_ID);
            ThreadContext.remove(MDC_TRIGGER);
            running.set(false);
        }

        if (report != null && report.action().isAttempt() && report.classification() != null
                && report.classification().requiresReconnect()) {
            requestCycle(TRIGGER_POST_ATTEMPT);
        }
        return Optional.ofNullable(report);
    }

    public boolean isRunning() {
        return running.get();
    }

    private CycleReport cycle(long cycleId, String trigger) {
        HealthSnapshot snapshot = sampler.sample();
        Instant now = snapshot.sampledAt();
        RecoveryState previous = board.state();

        SuppressionDecision suppression = gate.evaluate(snapshot);
        if (!suppression.proceed()) {
            CycleReport report = new CycleReport(cycleId, trigger, now, null, CycleAction.SUPPRESSED,
                    previous.attemptCount(), previous.elapsedSinceFirstFailure(now), suppression.reason(),
                    LifecycleAction.NONE, null);
            board.publish(previous, report);
            return report;
        }

        LifecycleOutcome lifecycle = enforceLifecycle(snapshot);

        RecoveryType classification = evaluator.classify(snapshot);
        if (classification != lastClassification) {
            LOG.info("Classification {} -> {}", lastClassification, classification);
            lastClassification = classification;
        }

        SchedulingDecision decision = scheduler.decide(classification, previous, now);
        RecoveryState next = decision.state();
        CycleAction action;
        String detail = lifecycle.detail();

        switch (decision.transition()) {
            case HEALTHY -> action = CycleAction.HEALTHY;
            case RECOVERED -> {
                action = CycleAction.RECOVERED;
                Duration elapsed = previous.elapsedSinceFirstFailure(now);
                LOG.info("Recovered from {} after {} attempt(s) in {}", previous.recoveryType(),
                        previous.attemptCount(), TimeUtils.describe(elapsed));
                publisher.publishEvent(new RecoverySucceededEvent(previous.recoveryType(),
                        previous.attemptCount(), elapsed, now));
            }
            case BACKOFF_WAIT -> {
                action = CycleAction.BACKOFF_WAIT;
                detail = "next attempt in " + TimeUtils.describe(decision.remainingWait());
                LOG.debug("{}: backing off, {}", classification, detail);
            }
            default -> {
                RecoveryOutcome outcome = attempt(classification, snapshot);
                next = scheduler.recordAttempt(next, now);
                action = switch (outcome.result()) {
                    case SUCCEEDED -> CycleAction.ATTEMPT_SUCCEEDED;
                    case FAILED -> CycleAction.ATTEMPT_FAILED;
                    case PASSIVE -> CycleAction.PASSIVE_WAIT;
                };
                detail = outcome.detail();
                LOG.info("{}: attempt {} {}", classification, next.attemptCount(), action.tag());
                if (scheduler.isMilestone(next.attemptCount())) {
                    publisher.publishEvent(new RecoveryMilestoneEvent(classification, next.attemptCount(),
                            next.elapsedSinceFirstFailure(now), now));
                }
            }
        }

        CycleReport report = new CycleReport(cycleId, trigger, now, classification, action,
                next.attemptCount(), next.elapsedSinceFirstFailure(now), null, lifecycle.action(), detail);
        board.publish(next, report);
        return report;
    }

    private LifecycleOutcome enforceLifecycle(HealthSnapshot snapshot) {
        try {
            return lifecycleGuard.enforce(snapshot);
        } catch (RuntimeException e) {
            LOG.warn("Transaction check failed, continuing with classification: {}", e.toString(), e);
            return LifecycleOutcome.failed(LifecycleAction.NONE, "transaction check failed: " + e.getMessage());
        }
    }

    // Counted as a failed attempt so backoff still applies
    private RecoveryOutcome attempt(RecoveryType classification, HealthSnapshot snapshot) {
        try {
            return executor.execute(classification, snapshot);
        } catch (RuntimeException e) {
            LOG.warn("{}: attempt failed unexpectedly: {}", classification, e.toString(), e);
            return RecoveryOutcome.failed(classification, e.toString());
        }
    }
}
