package com.ryuqq.provisioner.application.teardown;

import com.ryuqq.provisioner.core.model.DeploymentRecord;
import com.ryuqq.provisioner.core.outcome.Fail;
import com.ryuqq.provisioner.core.outcome.Outcome;

import java.util.List;
import java.util.Optional;

/**
 * Result of a destroy run.
 *
 * <ul>
 *   <li><strong>nothing to destroy:</strong> no record existed, no provider was called</li>
 *   <li><strong>cleared:</strong> every deletion succeeded and the record was removed</li>
 *   <li><strong>incomplete:</strong> at least one deletion failed; the record with the
 *       progress made is kept for the next run</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class TeardownReport {

    private final List<Outcome> outcomes;
    private final DeploymentRecord remainingOrNull;

    private TeardownReport(List<Outcome> outcomes, DeploymentRecord remainingOrNull) {
        if (outcomes == null) {
            throw new IllegalArgumentException("outcomes cannot be null");
        }
        this.outcomes = List.copyOf(outcomes);
        this.remainingOrNull = remainingOrNull;
    }

    public static TeardownReport nothingToDestroy() {
        return new TeardownReport(List.of(), null);
    }

    /**
     * @throws IllegalArgumentException if an outcome is a Fail
     */
    public static TeardownReport cleared(List<Outcome> outcomes) {
        if (outcomes != null && outcomes.stream().anyMatch(Outcome::isFail)) {
            throw new IllegalArgumentException("cleared report cannot contain a Fail outcome");
        }
        return new TeardownReport(outcomes, null);
    }

    /**
     * @param remaining record kept in the State Store
     * @param outcomes every attempted deletion, at least one Fail
     */
    public static TeardownReport incomplete(DeploymentRecord remaining, List<Outcome> outcomes) {
        if (remaining == null) {
            throw new IllegalArgumentException("remaining cannot be null for incomplete report");
        }
        if (outcomes == null || outcomes.stream().noneMatch(Outcome::isFail)) {
            throw new IllegalArgumentException("incomplete report needs at least one Fail outcome");
        }
        return new TeardownReport(outcomes, remaining);
    }

    public boolean isSuccess() {
        return remainingOrNull == null;
    }

    public List<Outcome> getOutcomes() {
        return outcomes;
    }

    public List<Fail> failures() {
        return outcomes.stream()
            .filter(Outcome::isFail)
            .map(Fail.class::cast)
            .toList();
    }

    /**
     * @return record left in the State Store, empty when it was cleared or never existed
     */
    public Optional<DeploymentRecord> remaining() {
        return Optional.ofNullable(remainingOrNull);
    }

    @Override
    public String toString() {
        return "TeardownReport{success=" + isSuccess() + ", steps=" + outcomes.size()
            + ", failures=" + failures().size() + "}";
    }
}
