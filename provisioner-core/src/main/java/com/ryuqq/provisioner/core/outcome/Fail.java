package com.ryuqq.provisioner.core.outcome;

import com.ryuqq.provisioner.core.exception.ErrorCategory;
import com.ryuqq.provisioner.core.exception.ProvisioningException;
import com.ryuqq.provisioner.core.model.ResourceKey;

/**
 * Failed step, attributed to the resource it was working on.
 *
 * <p><strong>Examples:</strong></p>
 * <ul>
 *   <li>Missing function source file (FATAL)</li>
 *   <li>Permission not visible in the function policy in time (TRANSIENT)</li>
 *   <li>Unexpected SDK error while deleting a bucket (FATAL)</li>
 * </ul>
 *
 * @param key resource key
 * @param errorCode error category name (e.g. FATAL, TRANSIENT)
 * @param message error message
 * @param cause simple name of the originating exception (nullable)
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record Fail(
    ResourceKey key,
    String errorCode,
    String message,
    String cause
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if key is null, or errorCode or message is blank
     */
    public Fail {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause may be null
    }

    public static Fail of(ResourceKey key, ErrorCategory category, String message) {
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        return new Fail(key, category.name(), message, null);
    }

    /**
     * Fail derived from an exception raised by a provider or the State Store.
     *
     * <p>{@link ProvisioningException}s keep their category; anything else is FATAL.</p>
     *
     * @param key resource key
     * @param error exception
     * @return Fail
     */
    public static Fail from(ResourceKey key, Exception error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        ErrorCategory category = error instanceof ProvisioningException pe
            ? pe.getCategory()
            : ErrorCategory.FATAL;
        String message = error.getMessage() == null || error.getMessage().isBlank()
            ? error.getClass().getSimpleName()
            : error.getMessage();
        return new Fail(key, category.name(), message, error.getClass().getSimpleName());
    }

    public ErrorCategory category() {
        return ErrorCategory.valueOf(errorCode);
    }
}
