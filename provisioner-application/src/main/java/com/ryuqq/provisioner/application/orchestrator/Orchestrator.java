package com.ryuqq.provisioner.application.orchestrator;

/**
 * Apply use case: provisions every resource of the deployment plan.
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ApplyReport report = orchestrator.apply();
 * if (!report.isSuccess()) {
 *     Fail failure = report.failure().orElseThrow();
 *     // completed steps stay recorded; re-running apply resumes
 * }
 * </pre>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public interface Orchestrator {

    /**
     * Runs the plan to completion or to the first failing step.
     *
     * <p>Re-running after a partial failure resumes against the recorded state: resources
     * that still exist are reused, missing ones are created.</p>
     *
     * @return report with one outcome per attempted step and the final record
     * @throws com.ryuqq.provisioner.core.exception.StateStoreException if the record cannot be read or written
     */
    ApplyReport apply();
}
