/**
 * Bounded readiness polling for eventually consistent resources.
 *
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.core.readiness.ReadinessWaiter} - Poll until ready or give up</li>
 *   <li>{@link com.ryuqq.provisioner.core.readiness.BackoffCalculator} - Exponential backoff with jitter</li>
 *   <li>{@link com.ryuqq.provisioner.core.readiness.ReadinessConfig} - Wait bound and delays</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.core.readiness;
