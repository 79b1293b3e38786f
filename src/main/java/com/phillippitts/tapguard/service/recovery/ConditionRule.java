package com.phillippitts.tapguard.service.recovery;

import com.phillippitts.tapguard.domain.HealthSnapshot;
import com.phillippitts.tapguard.domain.RecoveryType;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * One row of the classification table: when {@code condition} holds, the snapshot is
 * classified as {@code outcome}.
 */
public record ConditionRule(String name, Predicate<HealthSnapshot> condition, RecoveryType outcome) {

    public ConditionRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(outcome, "outcome");
    }

    public boolean matches(HealthSnapshot snapshot) {
        return condition.test(snapshot);
    }
}
