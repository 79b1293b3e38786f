package com.phillippitts.tapguard.domain;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Ordered wait sequence for one backoff class; the last entry repeats as a ceiling.
 *
 * <p>The wait before the next attempt is looked up by the number of attempts already made
 * for the current recovery type: after the first attempt the first entry applies, after
 * the second the second entry, and so on until the ceiling.
 */
public record BackoffPolicy(BackoffClass backoffClass, List<Duration> waits) {

    public BackoffPolicy {
        Objects.requireNonNull(backoffClass, "backoffClass");
        Objects.requireNonNull(waits, "waits");
        if (waits.isEmpty()) {
            throw new IllegalArgumentException("waits must not be empty");
        }
        for (Duration wait : waits) {
            if (wait == null || wait.isNegative() || wait.isZero()) {
                throw new IllegalArgumentException("waits must be positive: " + waits);
            }
        }
        waits = List.copyOf(waits);
    }

    public static BackoffPolicy ofSeconds(BackoffClass backoffClass, List<Integer> seconds) {
        Objects.requireNonNull(seconds, "seconds");
        return new BackoffPolicy(backoffClass, seconds.stream().map(Duration::ofSeconds).toList());
    }

    /**
     * Required wait after {@code attemptsMade} executed attempts.
     *
     * @return {@link Duration#ZERO} when no attempt has been made yet
     */
    public Duration requiredWaitAfter(int attemptsMade) {
        if (attemptsMade <= 0) {
            return Duration.ZERO;
        }
        int index = Math.min(attemptsMade - 1, waits.size() - 1);
        return waits.get(index);
    }

    public Duration ceiling() {
        return waits.get(waits.size() - 1);
    }
}
