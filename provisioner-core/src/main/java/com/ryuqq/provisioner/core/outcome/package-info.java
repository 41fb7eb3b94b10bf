/**
 * Step outcome package.
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.core.outcome.Outcome} - Sealed interface (permits Ok, Fail)</li>
 * </ul>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.core.outcome.Ok} - Resource reached its target status</li>
 *   <li>{@link com.ryuqq.provisioner.core.outcome.Fail} - Step failed, error attributed to the resource</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * for (Outcome outcome : report.outcomes()) {
 *     if (outcome instanceof Fail fail) {
 *         log.error("{} failed: {}", fail.key(), fail.message());
 *     }
 * }
 * </pre>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.core.outcome;
