package com.phillippitts.tapguard.service.terminal;

import com.phillippitts.tapguard.config.recovery.TerminalProperties;
import com.phillippitts.tapguard.domain.DisconnectReason;
import com.phillippitts.tapguard.domain.PaymentIntentRecord;
import com.phillippitts.tapguard.domain.ReaderConnectionState;
import com.phillippitts.tapguard.domain.ReaderReadiness;
import com.phillippitts.tapguard.domain.Signal;
import com.phillippitts.tapguard.domain.TerminalLayout;
import com.phillippitts.tapguard.exception.InvalidSignalException;
import com.phillippitts.tapguard.testutil.MutableClock;
import com.phillippitts.tapguard.testutil.SignalUpdates;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.phillippitts.tapguard.testutil.Snapshots.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TerminalSignalRegistryTest {

    private MutableClock clock;
    private TerminalSignalRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        registry = new TerminalSignalRegistry(TerminalProperties.of(TerminalLayout.MANUAL), clock);
    }

    @Test
    void everythingStartsUnknown() {
        assertThat(registry.readerConnectionState()).isEqualTo(ReaderConnectionState.UNKNOWN);
        assertThat(registry.readerReadiness()).isEqualTo(ReaderReadiness.UNKNOWN);
        assertThat(registry.sdkNetworkOnline()).isEqualTo(Signal.UNKNOWN);
        assertThat(registry.inPaymentSession()).isEqualTo(Signal.UNKNOWN);
        assertThat(registry.layout()).isEqualTo(TerminalLayout.MANUAL);
        assertThat(registry.current()).isEmpty();
        assertThat(registry.lastDisconnect()).isEmpty();
    }

    @Test
    void partialUpdateKeepsOtherFields() {
        registry.apply(SignalUpdates.healthy().build());

        registry.apply(TerminalSignalUpdate.builder().readerReadiness("not-ready").build());

        assertThat(registry.readerReadiness()).isEqualTo(ReaderReadiness.NOT_READY);
        assertThat(registry.readerConnectionState()).isEqualTo(ReaderConnectionState.CONNECTED);
        assertThat(registry.sdkNetworkOnline()).isEqualTo(Signal.TRUE);
        assertThat(registry.boundReaderId()).hasValue("rdr_0001");
    }

    @Test
    void unknownFieldsResetToUnknown() {
        registry.apply(SignalUpdates.healthy().build());

        registry.apply(TerminalSignalUpdate.builder().unknownFields("readerOnline", "boundReaderId").build());

        assertThat(registry.readerOnline()).isEqualTo(Signal.UNKNOWN);
        assertThat(registry.boundReaderId()).isEmpty();
        assertThat(registry.sdkNetworkOnline()).isEqualTo(Signal.TRUE);
    }

    @Test
    void invalidPushChangesNothing() {
        registry.apply(SignalUpdates.healthy().build());

        assertThatThrownBy(() -> registry.apply(TerminalSignalUpdate.builder()
                .sdkNetworkOnline(false)
                .readerReadiness("dancing")
                .build()))
                .isInstanceOf(InvalidSignalException.class)
                .satisfies(e -> assertThat(((InvalidSignalException) e).getField()).isEqualTo("readerReadiness"));

        assertThat(registry.sdkNetworkOnline()).isEqualTo(Signal.TRUE);
        assertThat(registry.readerReadiness()).isEqualTo(ReaderReadiness.READY);
    }

    @Test
    void rejectsMalformedRecordsAndUnresettableFields() {
        assertThatThrownBy(() -> registry.apply(TerminalSignalUpdate.builder()
                .paymentIntent(" ", T0, null).build()))
                .isInstanceOf(InvalidSignalException.class);
        assertThatThrownBy(() -> registry.apply(TerminalSignalUpdate.builder()
                .lastDisconnect("security-reboot", null).build()))
                .isInstanceOf(InvalidSignalException.class);
        assertThatThrownBy(() -> registry.apply(TerminalSignalUpdate.builder()
                .unknownFields("layout").build()))
                .isInstanceOf(InvalidSignalException.class);
        assertThatThrownBy(() -> registry.apply(TerminalSignalUpdate.builder()
                .layout("kiosk").build()))
                .isInstanceOf(InvalidSignalException.class);
    }

    @Test
    void layoutMayBeOverriddenByPush() {
        registry.apply(TerminalSignalUpdate.builder().layout("zero-touch").build());

        assertThat(registry.layout()).isEqualTo(TerminalLayout.ZERO_TOUCH);
    }

    @Test
    void disconnectRecordsCanBeSetAndCleared() {
        registry.apply(TerminalSignalUpdate.builder().lastDisconnect("security-reboot", T0).build());
        assertThat(registry.lastDisconnect()).hasValueSatisfying(d -> {
            assertThat(d.reason()).isEqualTo(DisconnectReason.SECURITY_REBOOT);
            assertThat(d.at()).isEqualTo(T0);
        });

        registry.apply(TerminalSignalUpdate.builder().clearLastDisconnect().build());
        assertThat(registry.lastDisconnect()).isEmpty();
    }

    @Test
    void awaitingInputIsStampedOnReadinessTransitions() {
        registry.apply(SignalUpdates.healthy().build());
        registry.apply(TerminalSignalUpdate.builder().paymentIntent("pi_0001", T0, null).build());

        clock.advanceSeconds(5);
        registry.apply(TerminalSignalUpdate.builder().readerReadiness("awaiting-input").build());
        assertThat(registry.current()).map(PaymentIntentRecord::awaitingInputSince).hasValue(T0.plusSeconds(5));

        clock.advanceSeconds(5);
        registry.apply(TerminalSignalUpdate.builder().readerReadiness("awaiting-input").build());
        assertThat(registry.current()).map(PaymentIntentRecord::awaitingInputSince).hasValue(T0.plusSeconds(5));

        registry.apply(TerminalSignalUpdate.builder().readerReadiness("ready").build());
        assertThat(registry.current()).hasValueSatisfying(p -> assertThat(p.isAwaitingInput()).isFalse());
    }

    @Test
    void pushedTransactionTakesPrecedenceAndCanBeCleared() {
        registry.apply(TerminalSignalUpdate.builder()
                .readerReadiness("awaiting-input")
                .paymentIntent("pi_0001", T0.minusSeconds(60), T0.minusSeconds(30))
                .build());
        assertThat(registry.current()).map(PaymentIntentRecord::awaitingInputSince).hasValue(T0.minusSeconds(30));

        registry.apply(TerminalSignalUpdate.builder().clearPaymentIntent().build());
        assertThat(registry.current()).isEmpty();
    }

    @Test
    void clearOnlyRemovesMatchingTransaction() {
        registry.record(PaymentIntentRecord.created("pi_0001", T0));

        assertThat(registry.clear("pi_other")).isFalse();
        assertThat(registry.current()).isPresent();
        assertThat(registry.clear("pi_0001")).isTrue();
        assertThat(registry.current()).isEmpty();
    }

    @Test
    void connectivityListenersSeeOnlyKnownTransitions() {
        List<ConnectivityChange> changes = new ArrayList<>();
        registry.addListener(changes::add);

        registry.apply(TerminalSignalUpdate.builder().sdkNetworkOnline(true).build());
        registry.apply(TerminalSignalUpdate.builder().sdkNetworkOnline(true).build());
        registry.apply(TerminalSignalUpdate.builder().sdkNetworkOnline(false).build());
        registry.apply(TerminalSignalUpdate.builder().unknownFields("sdkNetworkOnline").build());
        registry.apply(TerminalSignalUpdate.builder().sdkNetworkOnline(true).build());

        assertThat(changes).singleElement().satisfies(change -> {
            assertThat(change.wentOffline()).isTrue();
            assertThat(change.at()).isEqualTo(T0);
        });
    }

    @Test
    void failingListenerDoesNotBlockOthers() {
        List<ConnectivityChange> changes = new ArrayList<>();
        registry.addListener(change -> {
            throw new IllegalStateException("listener broke");
        });
        registry.addListener(changes::add);
        registry.apply(TerminalSignalUpdate.builder().sdkNetworkOnline(true).build());

        registry.apply(TerminalSignalUpdate.builder().sdkNetworkOnline(false).build());

        assertThat(changes).hasSize(1);
    }
}
