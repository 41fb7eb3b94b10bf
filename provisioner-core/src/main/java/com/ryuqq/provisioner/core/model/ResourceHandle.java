package com.ryuqq.provisioner.core.model;

import com.ryuqq.provisioner.core.statemachine.ResourceStatus;
import com.ryuqq.provisioner.core.statemachine.StatusTransition;

import java.time.Instant;

/**
 * Outcome of provisioning one resource, as persisted in the deployment record.
 *
 * <p>The identifier is the provider-assigned stable reference (ARN, id or URL). A handle
 * never changes its identifier: a recreated resource produces a new handle through
 * {@link #recreated(String, Instant)}.</p>
 *
 * @param key resource key
 * @param name physical name derived from the run suffix
 * @param identifier provider-assigned identifier
 * @param status lifecycle status
 * @param updatedAt last time the handle was written
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record ResourceHandle(
    ResourceKey key,
    String name,
    String identifier,
    ResourceStatus status,
    Instant updatedAt
) {

    public ResourceHandle {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("identifier cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (updatedAt == null) {
            throw new IllegalArgumentException("updatedAt cannot be null");
        }
    }

    /**
     * Handle for a resource that was just created (or converged) by a provider.
     */
    public static ResourceHandle created(ResourceKey key, String name, String identifier, Instant now) {
        return new ResourceHandle(key, name, identifier, ResourceStatus.CREATED, now);
    }

    public ResourceKind kind() {
        return key.kind();
    }

    /**
     * Marks the handle as confirmed against remote state, keeping its identifier.
     *
     * @param now timestamp
     * @return verified handle
     * @throws IllegalStateException if the current status does not allow the transition
     */
    public ResourceHandle verified(Instant now) {
        return withStatus(ResourceStatus.VERIFIED, now);
    }

    /**
     * Replaces this handle after the resource had to be created again.
     *
     * @param newIdentifier identifier returned by the provider
     * @param now timestamp
     * @return new handle with status CREATED
     */
    public ResourceHandle recreated(String newIdentifier, Instant now) {
        StatusTransition.validate(status, ResourceStatus.CREATED);
        return new ResourceHandle(key, name, newIdentifier, ResourceStatus.CREATED, now);
    }

    public ResourceHandle deleted(Instant now) {
        return withStatus(ResourceStatus.DELETED, now);
    }

    public boolean isDeleted() {
        return status == ResourceStatus.DELETED;
    }

    private ResourceHandle withStatus(ResourceStatus next, Instant now) {
        return new ResourceHandle(key, name, identifier, StatusTransition.transition(status, next), now);
    }
}
