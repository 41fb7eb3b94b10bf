/**
 * Destroy use case.
 *
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.application.teardown.Teardown} - Ordered, failure-tolerant teardown</li>
 *   <li>{@link com.ryuqq.provisioner.application.teardown.TeardownReport} - Outcomes and remaining record</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
package com.ryuqq.provisioner.application.teardown;
