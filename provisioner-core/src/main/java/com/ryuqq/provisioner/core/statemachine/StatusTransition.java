package com.ryuqq.provisioner.core.statemachine;

/**
 * Validation and execution of resource status transitions.
 *
 * <p><strong>Allowed transitions:</strong></p>
 * <ul>
 *   <li>PENDING → CREATED | VERIFIED | DELETED</li>
 *   <li>CREATED → CREATED | VERIFIED | DELETED</li>
 *   <li>VERIFIED → CREATED | VERIFIED | DELETED</li>
 * </ul>
 *
 * <p><strong>Invariants:</strong></p>
 * <ul>
 *   <li>DELETED is terminal</li>
 *   <li>No transition ever returns to PENDING</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class StatusTransition {

    // Utility class - prevent instantiation
    private StatusTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Validates a transition.
     *
     * @param from current status
     * @param to target status
     * @throws IllegalArgumentException if from or to is null
     * @throws IllegalStateException if the transition is not allowed
     */
    public static void validate(ResourceStatus from, ResourceStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Statuses cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal status: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case PENDING, CREATED, VERIFIED -> to != ResourceStatus.PENDING;
            case DELETED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid status transition: %s → %s", from, to)
            );
        }
    }

    /**
     * Validates and returns the target status.
     *
     * @param current current status
     * @param next target status
     * @return next
     * @throws IllegalArgumentException if current or next is null
     * @throws IllegalStateException if the transition is not allowed
     */
    public static ResourceStatus transition(ResourceStatus current, ResourceStatus next) {
        validate(current, next);
        return next;
    }
}
