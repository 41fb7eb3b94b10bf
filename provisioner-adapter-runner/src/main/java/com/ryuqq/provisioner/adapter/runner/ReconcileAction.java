package com.ryuqq.provisioner.adapter.runner;

/**
 * What the {@link Reconciler} did for one resource.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum ReconcileAction {

    /** No prior handle; the provider created the resource. */
    CREATED("created"),

    /** Prior handle confirmed remotely; no create call. */
    VERIFIED("verified"),

    /** Create-or-update ran and returned the recorded identifier. */
    CONVERGED("converged"),

    /** Recorded resource was gone or replaced; a new handle was written. */
    RECREATED("recreated");

    private final String label;

    ReconcileAction(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
