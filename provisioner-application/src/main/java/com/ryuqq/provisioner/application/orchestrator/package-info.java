/**
 * Apply use case.
 *
 * <h2>Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.application.orchestrator.Orchestrator} - Dependency-ordered, resumable apply</li>
 *   <li>{@link com.ryuqq.provisioner.application.orchestrator.ApplyReport} - Outcomes and resulting record</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal:</strong> ports here, implementations in adapter-runner</li>
 *   <li><strong>Immutability:</strong> reports cannot change after construction</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
package com.ryuqq.provisioner.application.orchestrator;
