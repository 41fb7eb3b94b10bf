package com.ryuqq.provisioner.core.outcome;

import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.model.ResourceKey;
import com.ryuqq.provisioner.core.statemachine.ResourceStatus;

/**
 * Successful step.
 *
 * @param key resource key
 * @param identifier provider identifier after the step
 * @param status status written to the record (CREATED, VERIFIED or DELETED)
 * @param message operator-facing message (nullable)
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record Ok(
    ResourceKey key,
    String identifier,
    ResourceStatus status,
    String message
) implements Outcome {

    public Ok {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("identifier cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        // message may be null
    }

    /**
     * Ok built from the handle that was written to the record.
     */
    public static Ok of(ResourceHandle handle, String message) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        return new Ok(handle.key(), handle.identifier(), handle.status(), message);
    }
}
