package com.ryuqq.provisioner.core.exception;

/**
 * Error taxonomy shared by providers and engines.
 *
 * <ul>
 *   <li>{@link #ALREADY_EXISTS} and {@link #NOT_FOUND} are recovered inside providers and
 *       never abort a run.</li>
 *   <li>{@link #TRANSIENT} is raised once a bounded readiness poll gives up.</li>
 *   <li>{@link #FATAL} aborts the current step and the run.</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum ErrorCategory {

    ALREADY_EXISTS,

    NOT_FOUND,

    TRANSIENT,

    FATAL;

    /**
     * @return true if a provider can treat the error as success
     */
    public boolean isRecoverable() {
        return this == ALREADY_EXISTS || this == NOT_FOUND;
    }
}
