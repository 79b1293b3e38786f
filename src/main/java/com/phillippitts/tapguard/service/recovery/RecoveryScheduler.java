package com.phillippitts.tapguard.service.recovery;

import com.phillippitts.tapguard.config.recovery.RecoveryProperties;
import com.phillippitts.tapguard.domain.BackoffClass;
import com.phillippitts.tapguard.domain.BackoffPolicy;
import com.phillippitts.tapguard.domain.RecoveryState;
import com.phillippitts.tapguard.domain.RecoveryType;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-type attempt and backoff bookkeeping.
 *
 * <p>Pure with respect to {@link RecoveryState}: the caller owns the state and replaces it
 * with what this class returns. There is no attempt limit; once the schedule is exhausted
 * its last wait repeats.
 */
@Component
public class RecoveryScheduler {

    private final Map<BackoffClass, BackoffPolicy> policies = new EnumMap<>(BackoffClass.class);
    private final int milestoneEvery;

    public RecoveryScheduler(RecoveryProperties props) {
        Objects.requireNonNull(props, "props");
        policies.put(BackoffClass.FAST, BackoffPolicy.ofSeconds(BackoffClass.FAST, props.getFastBackoffSchedule()));
        policies.put(BackoffClass.SLOW, BackoffPolicy.ofSeconds(BackoffClass.SLOW, props.getSlowBackoffSchedule()));
        this.milestoneEvery = props.getMilestoneEveryAttempts();
    }

    public SchedulingDecision decide(RecoveryType classification, RecoveryState previous, Instant now) {
        Objects.requireNonNull(classification, "classification");
        Objects.requireNonNull(previous, "previous");
        Objects.requireNonNull(now, "now");

        if (!classification.isFailure()) {
            SchedulingDecision.Transition transition = previous.isRecovering()
                    ? SchedulingDecision.Transition.RECOVERED
                    : SchedulingDecision.Transition.HEALTHY;
            return new SchedulingDecision(transition, RecoveryState.healthy(), Duration.ZERO);
        }

        if (classification != previous.recoveryType()) {
            return new SchedulingDecision(SchedulingDecision.Transition.NEW_FAILURE,
                    RecoveryState.startingFor(classification, now), Duration.ZERO);
        }

        Duration required = policyFor(classification).requiredWaitAfter(previous.attemptCount());
        if (previous.lastAttemptTime() == null) {
            return new SchedulingDecision(SchedulingDecision.Transition.BACKOFF_ELAPSED, previous, Duration.ZERO);
        }
        Duration elapsed = Duration.between(previous.lastAttemptTime(), now);
        if (elapsed.compareTo(required) >= 0) {
            return new SchedulingDecision(SchedulingDecision.Transition.BACKOFF_ELAPSED, previous, Duration.ZERO);
        }
        return new SchedulingDecision(SchedulingDecision.Transition.BACKOFF_WAIT, previous, required.minus(elapsed));
    }

    /**
     * Counts one executed attempt, successful or not.
     */
    public RecoveryState recordAttempt(RecoveryState state, Instant now) {
        return state.withAttempt(now);
    }

    public boolean isMilestone(int attemptCount) {
        return attemptCount > 0 && attemptCount % milestoneEvery == 0;
    }

    public BackoffPolicy policyFor(RecoveryType type) {
        return policies.get(type.backoffClass());
    }
}
