package com.phillippitts.tapguard.service.recovery.fastpath;

import com.phillippitts.tapguard.config.recovery.RecoveryProperties;
import com.phillippitts.tapguard.config.recovery.TerminalProperties;
import com.phillippitts.tapguard.domain.OfflineBehavior;
import com.phillippitts.tapguard.domain.PaymentIntentRecord;
import com.phillippitts.tapguard.domain.PaymentIntentRequest;
import com.phillippitts.tapguard.domain.TerminalLayout;
import com.phillippitts.tapguard.service.recovery.TransactionCoordinator;
import com.phillippitts.tapguard.service.terminal.TerminalSignalRegistry;
import com.phillippitts.tapguard.service.terminal.TerminalSignalUpdate;
import com.phillippitts.tapguard.testutil.EventCapturingPublisher;
import com.phillippitts.tapguard.testutil.FakePaymentIntentGateway;
import com.phillippitts.tapguard.testutil.ManualTaskScheduler;
import com.phillippitts.tapguard.testutil.MutableClock;
import com.phillippitts.tapguard.testutil.SignalUpdates;
import com.phillippitts.tapguard.testutil.SyncExecutor;
import com.phillippitts.tapguard.testutil.TestProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static com.phillippitts.tapguard.testutil.Snapshots.T0;
import static org.assertj.core.api.Assertions.assertThat;

class NetworkBlipHandlerTest {

    private final MutableClock clock = new MutableClock(T0);
    private final FakePaymentIntentGateway gateway = new FakePaymentIntentGateway(clock);
    private final ManualTaskScheduler scheduler = new ManualTaskScheduler();
    private TerminalSignalRegistry registry;
    private NetworkBlipHandler handler;

    @AfterEach
    void tearDown() {
        if (handler != null) {
            handler.stop();
        }
    }

    @Test
    void flipWhileAwaitingInputCancelsThenRecreatesAfterSettle() {
        start(TerminalLayout.ZERO_TOUCH);
        registry.record(PaymentIntentRecord.created("pi_live_0001", T0.minusSeconds(60)));

        registry.apply(TerminalSignalUpdate.builder().sdkNetworkOnline(false).build());

        assertThat(gateway.calls()).containsExactly(
                "cancel-payment-collection:pi_live_0001", "cancel-payment-intent:pi_live_0001");
        assertThat(scheduler.pendingStartTimes()).containsExactly(T0.plusMillis(500));
        assertThat(handler.isBlipInProgress()).isTrue();

        scheduler.runAll();

        assertThat(gateway.count("create-payment-intent")).isEqualTo(1);
        assertThat(gateway.requests()).extracting(PaymentIntentRequest::offlineBehavior)
                .containsExactly(OfflineBehavior.FORCE_OFFLINE);
        assertThat(handler.isBlipInProgress()).isFalse();
        assertThat(registry.current()).map(PaymentIntentRecord::id).hasValue("pi_new_1");
    }

    @Test
    void overlappingFlipsProduceOneReplacement() {
        start(TerminalLayout.ZERO_TOUCH);
        registry.record(PaymentIntentRecord.created("pi_live_0001", T0.minusSeconds(60)));

        registry.apply(TerminalSignalUpdate.builder().sdkNetworkOnline(false).build());
        registry.apply(TerminalSignalUpdate.builder().sdkNetworkOnline(true).build());
        registry.apply(TerminalSignalUpdate.builder().sdkNetworkOnline(false).build());
        scheduler.runAll();

        assertThat(gateway.count("cancel-payment-intent")).isEqualTo(1);
        assertThat(gateway.count("create-payment-intent")).isEqualTo(1);
    }

    @Test
    void laterFlipAfterCompletionIsHandledAgain() {
        start(TerminalLayout.ZERO_TOUCH);
        registry.record(PaymentIntentRecord.created("pi_live_0001", T0.minusSeconds(60)));

        registry.apply(TerminalSignalUpdate.builder().sdkNetworkOnline(false).build());
        scheduler.runAll();
        registry.apply(TerminalSignalUpdate.builder().sdkNetworkOnline(true).build());
        scheduler.runAll();

        assertThat(gateway.count("cancel-payment-intent")).isEqualTo(2);
        assertThat(gateway.calls()).contains("cancel-payment-intent:pi_new_1");
        assertThat(gateway.requests()).extracting(PaymentIntentRequest::offlineBehavior)
                .containsExactly(OfflineBehavior.FORCE_OFFLINE, OfflineBehavior.PREFER_ONLINE);
    }

    @Test
    void manualLayoutIsIgnored() {
        start(TerminalLayout.MANUAL);
        registry.record(PaymentIntentRecord.created("pi_live_0001", T0.minusSeconds(60)));

        registry.apply(TerminalSignalUpdate.builder().sdkNetworkOnline(false).build());

        assertThat(gateway.calls()).isEmpty();
        assertThat(scheduler.pendingCount()).isZero();
    }

    @Test
    void transactionNotAwaitingInputIsIgnored() {
        start(TerminalLayout.ZERO_TOUCH);
        registry.apply(TerminalSignalUpdate.builder().readerReadiness("ready").build());
        registry.record(PaymentIntentRecord.created("pi_live_0001", T0.minusSeconds(60)));

        registry.apply(TerminalSignalUpdate.builder().sdkNetworkOnline(false).build());

        assertThat(gateway.calls()).isEmpty();
    }

    @Test
    void stoppedHandlerNoLongerListens() {
        start(TerminalLayout.ZERO_TOUCH);
        registry.record(PaymentIntentRecord.created("pi_live_0001", T0.minusSeconds(60)));
        handler.stop();

        registry.apply(TerminalSignalUpdate.builder().sdkNetworkOnline(false).build());

        assertThat(handler.isRunning()).isFalse();
        assertThat(gateway.calls()).isEmpty();
    }

    private void start(TerminalLayout layout) {
        registry = new TerminalSignalRegistry(TerminalProperties.of(layout), clock);
        registry.apply(SignalUpdates.healthy().readerReadiness("awaiting-input").offlineModeEnabled(true).build());
        RecoveryProperties props = TestProperties.recovery().blipSettleMillis(500).build();
        TransactionCoordinator coordinator = new TransactionCoordinator(gateway, registry, registry,
                TerminalProperties.of(layout), props, scheduler, new EventCapturingPublisher(), clock);
        handler = new NetworkBlipHandler(registry, registry, registry, coordinator, props, new SyncExecutor());
        handler.start();
    }
}
