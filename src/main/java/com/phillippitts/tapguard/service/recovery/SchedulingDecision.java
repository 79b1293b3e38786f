package com.phillippitts.tapguard.service.recovery;

import com.phillippitts.tapguard.domain.RecoveryState;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of {@link RecoveryScheduler#decide}.
 *
 * @param transition    how the classification relates to the previous state
 * @param state         state to carry forward; for executing transitions the attempt is
 *                      not yet counted
 * @param remainingWait time left before the next attempt is due, zero unless waiting
 */
public record SchedulingDecision(Transition transition, RecoveryState state, Duration remainingWait) {

    public enum Transition {
        /** Healthy and was healthy. */
        HEALTHY,
        /** Healthy after a failure; state reset. */
        RECOVERED,
        /** A type different from the previous one; attempt immediately. */
        NEW_FAILURE,
        /** Same type and its backoff wait has elapsed. */
        BACKOFF_ELAPSED,
        /** Same type, still inside its backoff wait. */
        BACKOFF_WAIT
    }

    public SchedulingDecision {
        Objects.requireNonNull(transition, "transition");
        Objects.requireNonNull(state, "state");
        remainingWait = remainingWait == null ? Duration.ZERO : remainingWait;
    }

    public boolean shouldExecute() {
        return transition == Transition.NEW_FAILURE || transition == Transition.BACKOFF_ELAPSED;
    }
}
