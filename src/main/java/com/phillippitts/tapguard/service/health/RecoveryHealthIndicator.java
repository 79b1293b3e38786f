package com.phillippitts.tapguard.service.health;

import com.phillippitts.tapguard.domain.RecoveryState;
import com.phillippitts.tapguard.service.recovery.CycleAction;
import com.phillippitts.tapguard.service.recovery.CycleReport;
import com.phillippitts.tapguard.service.recovery.RecoveryStatusBoard;
import com.phillippitts.tapguard.util.TimeUtils;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Health indicator for the recovery engine.
 *
 * <ul>
 *   <li>UNKNOWN: no cycle has completed yet</li>
 *   <li>UP: last classification healthy, or cycle suppressed while healthy</li>
 *   <li>RECOVERING: a failure is being remediated</li>
 * </ul>
 *
 * <p>Never reports DOWN: the engine retries indefinitely and the process stays useful
 * while it does. Exposed via /actuator/health.
 */
@Component
public class RecoveryHealthIndicator implements HealthIndicator {

    static final String RECOVERING = "RECOVERING";

    private final RecoveryStatusBoard board;
    private final Clock clock;

    public RecoveryHealthIndicator(RecoveryStatusBoard board, Clock clock) {
        this.board = board;
        this.clock = clock;
    }

    @Override
    public Health health() {
        RecoveryStatusBoard.View view = board.view();
        CycleReport last = view.lastReport();
        if (last == null) {
            return Health.unknown().withDetail("status", "No recovery cycle has run yet").build();
        }
        RecoveryState state = view.state();

        Health.Builder builder = state.isRecovering() ? Health.status(RECOVERING) : Health.up();
        builder.withDetail("lastCycle", last.at().toString())
                .withDetail("lastAction", last.action().tag());
        if (state.isRecovering()) {
            builder.withDetail("recoveryType", state.recoveryType().name())
                    .withDetail("attempts", state.attemptCount())
                    .withDetail("elapsed", TimeUtils.describe(state.elapsedSinceFirstFailure(clock.instant())));
        }
        if (last.action() == CycleAction.SUPPRESSED) {
            builder.withDetail("suppressed", last.skipReason());
        }
        return builder.build();
    }
}
