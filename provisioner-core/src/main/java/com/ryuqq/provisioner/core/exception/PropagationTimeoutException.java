package com.ryuqq.provisioner.core.exception;

import java.time.Duration;

/**
 * A dependent resource did not become visible within the readiness bound.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class PropagationTimeoutException extends ProvisioningException {

    private final String condition;
    private final Duration waited;

    public PropagationTimeoutException(String condition, Duration waited, int attempts) {
        super(ErrorCategory.TRANSIENT,
            String.format("Gave up waiting for %s after %d ms (%d attempts)", condition, waited.toMillis(), attempts));
        this.condition = condition;
        this.waited = waited;
    }

    public String getCondition() {
        return condition;
    }

    public Duration getWaited() {
        return waited;
    }
}
