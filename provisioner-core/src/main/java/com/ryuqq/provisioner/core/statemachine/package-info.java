/**
 * Resource status state machine.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.core.statemachine.ResourceStatus} - Resource lifecycle statuses (enum)</li>
 *   <li>{@link com.ryuqq.provisioner.core.statemachine.StatusTransition} - Transition validation</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * ResourceStatus status = ResourceStatus.PENDING;
 * status = StatusTransition.transition(status, ResourceStatus.CREATED);
 * status = StatusTransition.transition(status, ResourceStatus.VERIFIED);
 * status = StatusTransition.transition(status, ResourceStatus.DELETED);
 *
 * // throws IllegalStateException
 * StatusTransition.validate(status, ResourceStatus.CREATED);
 * </pre>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.core.statemachine;
