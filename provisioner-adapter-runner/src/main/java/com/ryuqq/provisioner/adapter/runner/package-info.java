/**
 * Runner Adapter Layer - apply and teardown engines.
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.adapter.runner.SequentialOrchestrator} - Dependency-ordered, resumable apply</li>
 *   <li>{@link com.ryuqq.provisioner.adapter.runner.TeardownEngine} - Ordered, failure-tolerant teardown</li>
 *   <li>{@link com.ryuqq.provisioner.adapter.runner.Reconciler} - Per-resource create / verify / converge decision</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <pre>
 * adapter-runner (SequentialOrchestrator, TeardownEngine)
 *   ↓ implements
 * application (Orchestrator, Teardown)
 *   ↓ depends on
 * core (DeploymentRecord, DeploymentPlan, Outcome, ResourceStatus)
 *   ↓ depends on
 * core/spi (StateStore, ResourceProvider, AccountResolver)
 * </pre>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
package com.ryuqq.provisioner.adapter.runner;
