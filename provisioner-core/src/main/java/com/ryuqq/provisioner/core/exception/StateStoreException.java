package com.ryuqq.provisioner.core.exception;

/**
 * The State Store could not read or write the deployment record.
 *
 * <p>Always fatal: a run must never continue on top of a record it could not persist.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class StateStoreException extends ProvisioningException {

    public StateStoreException(String message, Throwable cause) {
        super(ErrorCategory.FATAL, message, cause);
    }
}
