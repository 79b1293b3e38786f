package com.phillippitts.tapguard.service.metrics;

import com.phillippitts.tapguard.service.recovery.CycleReport;
import com.phillippitts.tapguard.service.recovery.event.LifecycleActionEvent;
import com.phillippitts.tapguard.service.recovery.event.RecoveryCycleEvent;
import com.phillippitts.tapguard.service.recovery.event.RecoverySucceededEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Recovery counters fed from application events.
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class RecoveryMetrics {

    private static final String METRIC_PREFIX = "tapguard";

    private final MeterRegistry registry;

    public RecoveryMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @EventListener
    public void onCycle(RecoveryCycleEvent event) {
        CycleReport report = event.report();
        incrementCycle(report.action().tag());
        if (report.action().isAttempt() && report.classification() != null) {
            incrementAttempt(tag(report.classification().name()), report.action().tag());
        }
    }

    @EventListener
    public void onSucceeded(RecoverySucceededEvent event) {
        Counter.builder(METRIC_PREFIX + ".recovery.successes")
                .description("Transitions from a failure back to healthy")
                .tag("type", tag(event.type().name()))
                .register(registry)
                .increment();
    }

    @EventListener
    public void onLifecycleAction(LifecycleActionEvent event) {
        Counter.builder(METRIC_PREFIX + ".lifecycle.actions")
                .description("Transaction cancel/recreate operations by reason and result")
                .tag("action", event.action().tag())
                .tag("result", event.status().tag())
                .register(registry)
                .increment();
    }

    /**
     * Increments the cycle counter.
     *
     * @param outcome cycle action tag (suppressed, healthy, backoff-wait ...)
     */
    public void incrementCycle(String outcome) {
        Counter.builder(METRIC_PREFIX + ".recovery.cycles")
                .description("Recovery cycles by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementAttempt(String type, String result) {
        Counter.builder(METRIC_PREFIX + ".recovery.attempts")
                .description("Executed recovery attempts by type and result")
                .tag("type", type)
                .tag("result", result)
                .register(registry)
                .increment();
    }

    private static String tag(String enumName) {
        return enumName.toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
