package com.phillippitts.tapguard.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Local record of the active payment intent (transaction).
 *
 * @param id                 payment intent identifier issued by the payment backend
 * @param createdAt          creation time; the backend expires intents after a bounded window
 * @param awaitingInputSince when the reader entered the awaiting-input sub-state for this
 *                           intent, or {@code null} if it is not collecting
 */
public record PaymentIntentRecord(String id, Instant createdAt, Instant awaitingInputSince) {

    public PaymentIntentRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(createdAt, "createdAt");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
    }

    public static PaymentIntentRecord created(String id, Instant createdAt) {
        return new PaymentIntentRecord(id, createdAt, null);
    }

    public boolean isAwaitingInput() {
        return awaitingInputSince != null;
    }

    public Duration age(Instant now) {
        return Duration.between(createdAt, now);
    }

    public Optional<Duration> awaitingInputFor(Instant now) {
        if (awaitingInputSince == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(awaitingInputSince, now));
    }

    public PaymentIntentRecord awaitingInputFrom(Instant since) {
        return new PaymentIntentRecord(id, createdAt, since);
    }
}
