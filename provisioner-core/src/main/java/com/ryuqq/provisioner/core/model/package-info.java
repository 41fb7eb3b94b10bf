/**
 * Core domain model: deployment identity and the persisted record of provisioned resources.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.core.model.RunSuffix} - Stable per-deployment naming token</li>
 *   <li>{@link com.ryuqq.provisioner.core.model.ResourceKey} - Kind + logical name</li>
 *   <li>{@link com.ryuqq.provisioner.core.model.ResourceHandle} - Provider identifier and status of one resource</li>
 * </ul>
 *
 * <h2>Aggregate</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.core.model.DeploymentRecord} - Unit of persisted state for one deployment</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> every mutation returns a new instance</li>
 *   <li><strong>Validation:</strong> constructors reject invalid values</li>
 *   <li><strong>Determinism:</strong> physical names are a pure function of the run suffix</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.core.model;
