package com.ryuqq.provisioner.application.orchestrator;

import com.ryuqq.provisioner.core.model.DeploymentRecord;
import com.ryuqq.provisioner.core.outcome.Fail;
import com.ryuqq.provisioner.core.outcome.Outcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Result of an apply run.
 *
 * <p>Two possible shapes:</p>
 * <ul>
 *   <li><strong>completed:</strong> every step produced an Ok</li>
 *   <li><strong>aborted:</strong> the last outcome is the Fail that stopped the run; earlier
 *       steps are recorded in the record</li>
 * </ul>
 *
 * <p><strong>Immutability:</strong> cannot change after construction.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class ApplyReport {

    private final DeploymentRecord record;
    private final List<Outcome> outcomes;
    private final Fail failureOrNull;

    private ApplyReport(DeploymentRecord record, List<Outcome> outcomes, Fail failureOrNull) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (outcomes == null) {
            throw new IllegalArgumentException("outcomes cannot be null");
        }
        this.record = record;
        this.outcomes = List.copyOf(outcomes);
        this.failureOrNull = failureOrNull;
    }

    /**
     * Report of a run where every step succeeded.
     *
     * @throws IllegalArgumentException if an outcome is a Fail
     */
    public static ApplyReport completed(DeploymentRecord record, List<Outcome> outcomes) {
        if (outcomes != null && outcomes.stream().anyMatch(Outcome::isFail)) {
            throw new IllegalArgumentException("completed report cannot contain a Fail outcome");
        }
        return new ApplyReport(record, outcomes, null);
    }

    /**
     * Report of a run stopped by a failing step.
     *
     * @param record record as persisted when the run stopped
     * @param outcomes outcomes of the steps before the failure
     * @param failure failure that stopped the run
     */
    public static ApplyReport aborted(DeploymentRecord record, List<Outcome> outcomes, Fail failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null for aborted report");
        }
        if (outcomes == null) {
            throw new IllegalArgumentException("outcomes cannot be null");
        }
        List<Outcome> all = new ArrayList<>(outcomes);
        all.add(failure);
        return new ApplyReport(record, all, failure);
    }

    public boolean isSuccess() {
        return failureOrNull == null;
    }

    public DeploymentRecord getRecord() {
        return record;
    }

    public List<Outcome> getOutcomes() {
        return outcomes;
    }

    public Optional<Fail> failure() {
        return Optional.ofNullable(failureOrNull);
    }

    @Override
    public String toString() {
        return "ApplyReport{success=" + isSuccess()
            + ", runSuffix=" + record.runSuffix()
            + ", steps=" + outcomes.size()
            + (failureOrNull == null ? "" : ", failure=" + failureOrNull.key())
            + "}";
    }
}
