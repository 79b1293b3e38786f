package com.phillippitts.tapguard.service.recovery;

import com.phillippitts.tapguard.domain.HealthSnapshot;
import com.phillippitts.tapguard.domain.ReaderConnectionState;
import com.phillippitts.tapguard.domain.ReaderReadiness;
import com.phillippitts.tapguard.domain.RecoveryType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * Classifies a snapshot into exactly one {@link RecoveryType}.
 *
 * <p>The rules are evaluated top to bottom and the first match wins; the last rule always
 * matches, so classification is total. Only a {@code TRUE} signal counts as positive:
 * an unknown "online" reading is offline, an unknown "offline mode" reading is disabled, and
 * an unknown connection state or readiness fails the connected/ready checks.
 *
 * <p>The two offline-mode exemptions classify as healthy, so they need a reported
 * {@code FALSE} online reading. An unknown reading with offline mode on falls through to the
 * reader checks instead of being exempted.
 *
 * <p>Notes on the table:
 * <ul>
 *   <li>{@code reader-offline} can only match when the SDK network is offline, which
 *       {@code sdk-offline} or {@code offline-operation} has already claimed. It is kept so the
 *       table documents the full decision order.</li>
 *   <li>{@code reader-offline-with-offline-mode} exists because readers without their own
 *       network egress report offline at the hardware layer while fully functional.</li>
 * </ul>
 */
@Component
public class ConditionEvaluator {

    public static final List<ConditionRule> RULES = List.of(
            new ConditionRule("sdk-offline",
                    s -> !s.sdkNetworkOnline().isTrue() && !s.offlineModeEnabled().isTrue(),
                    RecoveryType.SDK_OFFLINE),
            new ConditionRule("offline-operation",
                    s -> s.sdkNetworkOnline().isFalse() && s.offlineModeEnabled().isTrue(),
                    RecoveryType.NONE),
            new ConditionRule("reader-disconnected",
                    s -> s.readerConnectionState() != ReaderConnectionState.CONNECTED,
                    RecoveryType.READER_DISCONNECTED),
            new ConditionRule("reader-offline",
                    s -> !s.readerOnline().isTrue()
                            && !s.offlineModeEnabled().isTrue()
                            && !s.sdkNetworkOnline().isTrue(),
                    RecoveryType.READER_OFFLINE),
            new ConditionRule("reader-offline-with-offline-mode",
                    s -> s.readerOnline().isFalse() && s.offlineModeEnabled().isTrue(),
                    RecoveryType.NONE),
            new ConditionRule("tap-to-pay-not-waiting",
                    s -> s.isZeroTouch() && s.readerReadiness() != ReaderReadiness.AWAITING_INPUT,
                    RecoveryType.TAP_TO_PAY_NOT_WAITING),
            new ConditionRule("reader-not-ready",
                    s -> !s.isZeroTouch()
                            && s.readerReadiness() != ReaderReadiness.READY
                            && s.readerReadiness() != ReaderReadiness.AWAITING_INPUT,
                    RecoveryType.READER_NOT_READY),
            new ConditionRule("healthy", s -> true, RecoveryType.NONE)
    );

    public RecoveryType classify(HealthSnapshot snapshot) {
        return match(snapshot).outcome();
    }

    /**
     * @return the first rule matching the snapshot
     */
    public ConditionRule match(HealthSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        for (ConditionRule rule : RULES) {
            if (rule.matches(snapshot)) {
                return rule;
            }
        }
        throw new IllegalStateException("Classification table has no catch-all rule");
    }
}
