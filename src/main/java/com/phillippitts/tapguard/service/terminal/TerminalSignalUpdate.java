package com.phillippitts.tapguard.service.terminal;

import java.time.Instant;
import java.util.List;

/**
 * Partial update pushed by the transport bridge.
 *
 * <p>Every field is optional. Absent or {@code null} fields keep their previous value;
 * names listed in {@code unknownFields} are reset to unknown.
 *
 * @param readerConnectionState   e.g. {@code "connected"}, {@code "not-connected"}
 * @param readerReadiness         e.g. {@code "ready"}, {@code "awaiting-input"}
 * @param layout                  {@code "MANUAL"} or {@code "ZERO_TOUCH"}
 * @param paymentIntent           replaces the active transaction record
 * @param clearPaymentIntent      drops the active transaction record
 * @param lastDisconnect          last disconnect reported by the reader
 * @param clearLastDisconnect     drops the last disconnect record
 * @param unknownFields           names of scalar fields to reset to unknown
 */
public record TerminalSignalUpdate(
        String readerConnectionState,
        String readerReadiness,
        Boolean readerOnline,
        Boolean sdkNetworkOnline,
        Boolean offlineModeEnabled,
        Boolean softwareUpdateInProgress,
        Boolean inPaymentSession,
        String layout,
        String boundReaderId,
        PaymentIntentSignal paymentIntent,
        Boolean clearPaymentIntent,
        DisconnectSignal lastDisconnect,
        Boolean clearLastDisconnect,
        List<String> unknownFields
) {

    public TerminalSignalUpdate {
        unknownFields = unknownFields == null ? List.of() : List.copyOf(unknownFields);
    }

    /**
     * Transaction record as pushed by the bridge.
     */
    public record PaymentIntentSignal(String id, Instant createdAt, Instant awaitingInputSince) {
    }

    /**
     * Disconnect report as pushed by the bridge.
     */
    public record DisconnectSignal(String reason, Instant at) {
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent construction for host integrations that call the registry in-process.
     */
    public static final class Builder {
        private String readerConnectionState;
        private String readerReadiness;
        private Boolean readerOnline;
        private Boolean sdkNetworkOnline;
        private Boolean offlineModeEnabled;
        private Boolean softwareUpdateInProgress;
        private Boolean inPaymentSession;
        private String layout;
        private String boundReaderId;
        private PaymentIntentSignal paymentIntent;
        private Boolean clearPaymentIntent;
        private DisconnectSignal lastDisconnect;
        private Boolean clearLastDisconnect;
        private List<String> unknownFields;

        private Builder() {
        }

        public Builder readerConnectionState(String value) {
            this.readerConnectionState = value;
            return this;
        }

        public Builder readerReadiness(String value) {
            this.readerReadiness = value;
            return this;
        }

        public Builder readerOnline(Boolean value) {
            this.readerOnline = value;
            return this;
        }

        public Builder sdkNetworkOnline(Boolean value) {
            this.sdkNetworkOnline = value;
            return this;
        }

        public Builder offlineModeEnabled(Boolean value) {
            this.offlineModeEnabled = value;
            return this;
        }

        public Builder softwareUpdateInProgress(Boolean value) {
            this.softwareUpdateInProgress = value;
            return this;
        }

        public Builder inPaymentSession(Boolean value) {
            this.inPaymentSession = value;
            return this;
        }

        public Builder layout(String value) {
            this.layout = value;
            return this;
        }

        public Builder boundReaderId(String value) {
            this.boundReaderId = value;
            return this;
        }

        public Builder paymentIntent(String id, Instant createdAt, Instant awaitingInputSince) {
            this.paymentIntent = new PaymentIntentSignal(id, createdAt, awaitingInputSince);
            return this;
        }

        public Builder clearPaymentIntent() {
            this.clearPaymentIntent = Boolean.TRUE;
            return this;
        }

        public Builder lastDisconnect(String reason, Instant at) {
            this.lastDisconnect = new DisconnectSignal(reason, at);
            return this;
        }

        public Builder clearLastDisconnect() {
            this.clearLastDisconnect = Boolean.TRUE;
            return this;
        }

        public Builder unknownFields(String... names) {
            this.unknownFields = List.of(names);
            return this;
        }

        public TerminalSignalUpdate build() {
            return new TerminalSignalUpdate(readerConnectionState, readerReadiness, readerOnline,
                    sdkNetworkOnline, offlineModeEnabled, softwareUpdateInProgress, inPaymentSession,
                    layout, boundReaderId, paymentIntent, clearPaymentIntent, lastDisconnect,
                    clearLastDisconnect, unknownFields);
        }
    }
}
