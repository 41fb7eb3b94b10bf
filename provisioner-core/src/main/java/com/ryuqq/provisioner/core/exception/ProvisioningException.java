package com.ryuqq.provisioner.core.exception;

/**
 * Failure of a provisioning or teardown step.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class ProvisioningException extends RuntimeException {

    private final ErrorCategory category;

    public ProvisioningException(ErrorCategory category, String message) {
        super(message);
        this.category = requireCategory(category);
    }

    public ProvisioningException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = requireCategory(category);
    }

    /**
     * Shortcut for a fatal error.
     */
    public static ProvisioningException fatal(String message, Throwable cause) {
        return new ProvisioningException(ErrorCategory.FATAL, message, cause);
    }

    public static ProvisioningException fatal(String message) {
        return new ProvisioningException(ErrorCategory.FATAL, message);
    }

    public ErrorCategory getCategory() {
        return category;
    }

    private static ErrorCategory requireCategory(ErrorCategory category) {
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        return category;
    }
}
