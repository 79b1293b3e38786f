package com.phillippitts.tapguard.config.recovery;

import com.phillippitts.tapguard.domain.TerminalLayout;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecoveryPropertiesTest {

    @Test
    void absentValuesTakeDefaults() {
        RecoveryProperties p = RecoveryProperties.defaults();

        assertThat(p.isEnabled()).isTrue();
        assertThat(p.getPollingIntervalSeconds()).isEqualTo(30);
        assertThat(p.getSecurityRebootGrace()).isEqualTo(Duration.ofSeconds(120));
        assertThat(p.getFastBackoffSchedule()).containsExactly(30, 60, 120, 300);
        assertThat(p.getSlowBackoffSchedule()).containsExactly(60, 120, 300, 600);
        assertThat(p.getPaymentIntentHardTimeout()).isEqualTo(Duration.ofMinutes(60));
        assertThat(p.getPaymentIntentProactiveRefresh()).isEqualTo(Duration.ofMinutes(50));
        assertThat(p.getStuckAwaitingInput()).isEqualTo(Duration.ofMinutes(5));
        assertThat(p.getMilestoneEveryAttempts()).isEqualTo(10);
        assertThat(p.getNetworkBlipSettle()).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    void emptyScheduleFallsBackToDefault() {
        RecoveryProperties p = new RecoveryProperties(null, null, null, null, List.of(), null, null, null, null,
                null, null, null, null);

        assertThat(p.getFastBackoffSchedule()).isEqualTo(RecoveryProperties.DEFAULT_FAST_SCHEDULE);
    }

    @Test
    void proactiveRefreshMustPrecedeHardTimeout() {
        assertThatThrownBy(() -> new RecoveryProperties(null, null, null, null, null, null, 3000, 3000, null,
                null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("proactive-refresh");
    }

    @Test
    void terminalDefaults() {
        TerminalProperties t = new TerminalProperties(null, " ", null);

        assertThat(t.getLayout()).isEqualTo(TerminalLayout.MANUAL);
        assertThat(t.getDeviceTypeFilter()).isEqualTo("INTERNAL");
        assertThat(t.getTapToPay().amount()).isEqualTo(100L);
        assertThat(t.getTapToPay().currency()).isEqualTo("usd");
    }
}
