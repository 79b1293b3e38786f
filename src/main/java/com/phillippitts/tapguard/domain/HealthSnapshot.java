package com.phillippitts.tapguard.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable point-in-time view of reader, connectivity and transaction state.
 *
 * <p>A fresh snapshot is sampled for every recovery cycle. Fields that could not be read
 * carry their explicit unknown variant ({@link Signal#UNKNOWN},
 * {@link ReaderConnectionState#UNKNOWN}, {@link ReaderReadiness#UNKNOWN}); optional
 * collaborator records are {@code null} when absent.
 */
public record HealthSnapshot(
        Instant sampledAt,
        ReaderConnectionState readerConnectionState,
        ReaderReadiness readerReadiness,
        Signal readerOnline,
        Signal sdkNetworkOnline,
        Signal offlineModeEnabled,
        TerminalLayout layout,
        PaymentIntentRecord paymentIntent,
        DisconnectRecord lastDisconnect,
        Signal softwareUpdateInProgress,
        Signal inPaymentSession,
        String boundReaderId
) {

    public HealthSnapshot {
        Objects.requireNonNull(sampledAt, "sampledAt");
        Objects.requireNonNull(readerConnectionState, "readerConnectionState");
        Objects.requireNonNull(readerReadiness, "readerReadiness");
        Objects.requireNonNull(readerOnline, "readerOnline");
        Objects.requireNonNull(sdkNetworkOnline, "sdkNetworkOnline");
        Objects.requireNonNull(offlineModeEnabled, "offlineModeEnabled");
        Objects.requireNonNull(layout, "layout");
        Objects.requireNonNull(softwareUpdateInProgress, "softwareUpdateInProgress");
        Objects.requireNonNull(inPaymentSession, "inPaymentSession");
    }

    public Optional<PaymentIntentRecord> currentPaymentIntent() {
        return Optional.ofNullable(paymentIntent);
    }

    public Optional<DisconnectRecord> lastDisconnectRecord() {
        return Optional.ofNullable(lastDisconnect);
    }

    public Optional<String> boundReader() {
        return Optional.ofNullable(boundReaderId);
    }

    public boolean isZeroTouch() {
        return layout == TerminalLayout.ZERO_TOUCH;
    }

    public static Builder builder(Instant sampledAt) {
        return new Builder(sampledAt);
    }

    /**
     * Builder starting from an all-unknown snapshot in the manual layout.
     */
    public static final class Builder {
        private final Instant sampledAt;
        private ReaderConnectionState readerConnectionState = ReaderConnectionState.UNKNOWN;
        private ReaderReadiness readerReadiness = ReaderReadiness.UNKNOWN;
        private Signal readerOnline = Signal.UNKNOWN;
        private Signal sdkNetworkOnline = Signal.UNKNOWN;
        private Signal offlineModeEnabled = Signal.UNKNOWN;
        private TerminalLayout layout = TerminalLayout.MANUAL;
        private PaymentIntentRecord paymentIntent;
        private DisconnectRecord lastDisconnect;
        private Signal softwareUpdateInProgress = Signal.UNKNOWN;
        private Signal inPaymentSession = Signal.UNKNOWN;
        private String boundReaderId;

        private Builder(Instant sampledAt) {
            this.sampledAt = Objects.requireNonNull(sampledAt, "sampledAt");
        }

        public Builder readerConnectionState(ReaderConnectionState value) {
            this.readerConnectionState = value;
            return this;
        }

        public Builder readerReadiness(ReaderReadiness value) {
            this.readerReadiness = value;
            return this;
        }

        public Builder readerOnline(Signal value) {
            this.readerOnline = value;
            return this;
        }

        public Builder sdkNetworkOnline(Signal value) {
            this.sdkNetworkOnline = value;
            return this;
        }

        public Builder offlineModeEnabled(Signal value) {
            this.offlineModeEnabled = value;
            return this;
        }

        public Builder layout(TerminalLayout value) {
            this.layout = value;
            return this;
        }

        public Builder paymentIntent(PaymentIntentRecord value) {
            this.paymentIntent = value;
            return this;
        }

        public Builder lastDisconnect(DisconnectRecord value) {
            this.lastDisconnect = value;
            return this;
        }

        public Builder softwareUpdateInProgress(Signal value) {
            this.softwareUpdateInProgress = value;
            return this;
        }

        public Builder inPaymentSession(Signal value) {
            this.inPaymentSession = value;
            return this;
        }

        public Builder boundReaderId(String value) {
            this.boundReaderId = value;
            return this;
        }

        public HealthSnapshot build() {
            return new HealthSnapshot(sampledAt, readerConnectionState, readerReadiness, readerOnline,
                    sdkNetworkOnline, offlineModeEnabled, layout, paymentIntent, lastDisconnect,
                    softwareUpdateInProgress, inPaymentSession, boundReaderId);
        }
    }
}
