package com.phillippitts.tapguard.service.recovery;

import com.phillippitts.tapguard.domain.RecoveryState;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view of the recovery state for observers (status endpoint, health indicator).
 *
 * <p>Written only by {@link RecoveryCycleRunner}.
 */
@Component
public class RecoveryStatusBoard {

    private volatile View view = new View(RecoveryState.healthy(), null);

    void publish(RecoveryState state, CycleReport report) {
        view = new View(Objects.requireNonNull(state, "state"), report);
    }

    public RecoveryState state() {
        return view.state();
    }

    public Optional<CycleReport> lastReport() {
        return Optional.ofNullable(view.lastReport());
    }

    /**
     * State and report read together.
     */
    public View view() {
        return view;
    }

    public record View(RecoveryState state, CycleReport lastReport) {
    }
}
