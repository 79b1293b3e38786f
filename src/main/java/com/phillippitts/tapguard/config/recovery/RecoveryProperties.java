package com.phillippitts.tapguard.config.recovery;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Typed properties for the recovery engine (prefix {@code terminal.recovery}).
 *
 * <p>Absent values fall back to the defaults used in the field. Values are validated on
 * startup for fail-fast behavior.
 */
@Validated
@ConfigurationProperties(prefix = "terminal.recovery")
public class RecoveryProperties {

    static final List<Integer> DEFAULT_FAST_SCHEDULE = List.of(30, 60, 120, 300);
    static final List<Integer> DEFAULT_SLOW_SCHEDULE = List.of(60, 120, 300, 600);

    /** Master switch; when false cycles are skipped but signals are still accepted. */
    private final boolean enabled;

    /** Period of the timed health cycle. */
    @Positive
    private final int pollingIntervalSeconds;

    /** Delay before the first timed cycle after startup. */
    @Min(0)
    private final int initialDelaySeconds;

    /** Recovery is held off this long after a security-reboot disconnect. */
    @Positive
    private final int securityRebootGraceSeconds;

    /** Waits for reader-related failures; the last value repeats. */
    @NotEmpty
    private final List<@Positive Integer> fastBackoffSchedule;

    /** Waits for network outages; the last value repeats. */
    @NotEmpty
    private final List<@Positive Integer> slowBackoffSchedule;

    @Positive
    private final int paymentIntentHardTimeoutSeconds;

    @Positive
    private final int paymentIntentProactiveRefreshSeconds;

    @Positive
    private final int stuckAwaitingInputSeconds;

    /** A milestone summary is emitted every N attempts of the same type. */
    @Positive
    private final int milestoneEveryAttempts;

    /** Upper bound on cancel, create and connect calls to the bridge. */
    @Positive
    private final int sdkCallTimeoutSeconds;

    /** Upper bound on waiting for the bound reader to reappear during discovery. */
    @Positive
    private final int discoveryTimeoutSeconds;

    /** Delay between cancel and recreate on a connectivity flip. */
    @Min(0)
    private final int networkBlipSettleMillis;

    @ConstructorBinding
    public RecoveryProperties(Boolean enabled,
                              Integer pollingIntervalSeconds,
                              Integer initialDelaySeconds,
                              Integer securityRebootGraceSeconds,
                              List<Integer> fastBackoffSchedule,
                              List<Integer> slowBackoffSchedule,
                              Integer paymentIntentHardTimeoutSeconds,
                              Integer paymentIntentProactiveRefreshSeconds,
                              Integer stuckAwaitingInputSeconds,
                              Integer milestoneEveryAttempts,
                              Integer sdkCallTimeoutSeconds,
                              Integer discoveryTimeoutSeconds,
                              Integer networkBlipSettleMillis) {
        this.enabled = enabled == null || enabled;
        this.pollingIntervalSeconds = pollingIntervalSeconds == null ? 30 : pollingIntervalSeconds;
        this.initialDelaySeconds = initialDelaySeconds == null ? 5 : initialDelaySeconds;
        this.securityRebootGraceSeconds = securityRebootGraceSeconds == null ? 120 : securityRebootGraceSeconds;
        this.fastBackoffSchedule = (fastBackoffSchedule == null || fastBackoffSchedule.isEmpty())
                ? DEFAULT_FAST_SCHEDULE
                : List.copyOf(fastBackoffSchedule);
        this.slowBackoffSchedule = (slowBackoffSchedule == null || slowBackoffSchedule.isEmpty())
                ? DEFAULT_SLOW_SCHEDULE
                : List.copyOf(slowBackoffSchedule);
        this.paymentIntentHardTimeoutSeconds =
                paymentIntentHardTimeoutSeconds == null ? 3600 : paymentIntentHardTimeoutSeconds;
        this.paymentIntentProactiveRefreshSeconds =
                paymentIntentProactiveRefreshSeconds == null ? 3000 : paymentIntentProactiveRefreshSeconds;
        this.stuckAwaitingInputSeconds = stuckAwaitingInputSeconds == null ? 300 : stuckAwaitingInputSeconds;
        this.milestoneEveryAttempts = milestoneEveryAttempts == null ? 10 : milestoneEveryAttempts;
        this.sdkCallTimeoutSeconds = sdkCallTimeoutSeconds == null ? 15 : sdkCallTimeoutSeconds;
        this.discoveryTimeoutSeconds = discoveryTimeoutSeconds == null ? 60 : discoveryTimeoutSeconds;
        this.networkBlipSettleMillis = networkBlipSettleMillis == null ? 500 : networkBlipSettleMillis;

        if (this.paymentIntentProactiveRefreshSeconds >= this.paymentIntentHardTimeoutSeconds) {
            throw new IllegalArgumentException(
                    "terminal.recovery.payment-intent-proactive-refresh-seconds must be below "
                            + "payment-intent-hard-timeout-seconds");
        }
    }

    /**
     * All defaults; convenient for tests and manual instantiation.
     */
    public static RecoveryProperties defaults() {
        return new RecoveryProperties(null, null, null, null, null, null, null, null, null, null, null,
                null, null);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int getPollingIntervalSeconds() {
        return pollingIntervalSeconds;
    }

    public int getInitialDelaySeconds() {
        return initialDelaySeconds;
    }

    public int getSecurityRebootGraceSeconds() {
        return securityRebootGraceSeconds;
    }

    public Duration getSecurityRebootGrace() {
        return Duration.ofSeconds(securityRebootGraceSeconds);
    }

    public List<Integer> getFastBackoffSchedule() {
        return fastBackoffSchedule;
    }

    public List<Integer> getSlowBackoffSchedule() {
        return slowBackoffSchedule;
    }

    public int getPaymentIntentHardTimeoutSeconds() {
        return paymentIntentHardTimeoutSeconds;
    }

    public Duration getPaymentIntentHardTimeout() {
        return Duration.ofSeconds(paymentIntentHardTimeoutSeconds);
    }

    public int getPaymentIntentProactiveRefreshSeconds() {
        return paymentIntentProactiveRefreshSeconds;
    }

    public Duration getPaymentIntentProactiveRefresh() {
        return Duration.ofSeconds(paymentIntentProactiveRefreshSeconds);
    }

    public int getStuckAwaitingInputSeconds() {
        return stuckAwaitingInputSeconds;
    }

    public Duration getStuckAwaitingInput() {
        return Duration.ofSeconds(stuckAwaitingInputSeconds);
    }

    public int getMilestoneEveryAttempts() {
        return milestoneEveryAttempts;
    }

    public Duration getSdkCallTimeout() {
        return Duration.ofSeconds(sdkCallTimeoutSeconds);
    }

    public int getSdkCallTimeoutSeconds() {
        return sdkCallTimeoutSeconds;
    }

    public Duration getDiscoveryTimeout() {
        return Duration.ofSeconds(discoveryTimeoutSeconds);
    }

    public int getDiscoveryTimeoutSeconds() {
        return discoveryTimeoutSeconds;
    }

    public Duration getNetworkBlipSettle() {
        return Duration.ofMillis(networkBlipSettleMillis);
    }

    public int getNetworkBlipSettleMillis() {
        return networkBlipSettleMillis;
    }
}
