package com.ryuqq.provisioner.core.statemachine;

/**
 * Lifecycle status of a provisioned resource.
 *
 * <p><strong>State transition diagram:</strong></p>
 * <pre>
 * PENDING
 *    │
 *    ├─► CREATED ◄──┐ (re-converged / recreated after drift)
 *    │      │       │
 *    │      ▼       │
 *    └─► VERIFIED ──┘
 *
 * PENDING / CREATED / VERIFIED ─► DELETED (teardown)
 *
 * Forbidden:
 * - DELETED → * (terminal)
 * - * → PENDING
 * </pre>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum ResourceStatus {

    /**
     * Declared but not yet provisioned.
     */
    PENDING,

    /**
     * Created (or updated in place) by a provider during the current run.
     */
    CREATED,

    /**
     * Recorded earlier and confirmed to still exist remotely.
     */
    VERIFIED,

    /**
     * Removed by teardown.
     */
    DELETED;

    /**
     * @return true for DELETED
     */
    public boolean isTerminal() {
        return this == DELETED;
    }

    /**
     * @return true when the resource is expected to exist remotely
     */
    public boolean isLive() {
        return this == CREATED || this == VERIFIED;
    }
}
