package com.ryuqq.provisioner.adapter.runner;

import com.ryuqq.provisioner.core.model.ResourceHandle;

/**
 * Handle written by the {@link Reconciler} and the action that produced it.
 *
 * @param handle handle to record
 * @param action action taken
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record ReconcileResult(ResourceHandle handle, ReconcileAction action) {

    public ReconcileResult {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
    }
}
