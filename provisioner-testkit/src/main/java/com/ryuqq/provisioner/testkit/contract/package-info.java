/**
 * Reusable SPI contract tests.
 *
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.testkit.contract.AbstractStateStoreContractTest} - State Store contract</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.testkit.contract;
