/**
 * Fake cloud for engine tests.
 *
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.testkit.cloud.FakeCloud} - Live resources, call counters, failure injection</li>
 *   <li>{@link com.ryuqq.provisioner.testkit.cloud.FakeResourceProvider} - Provider contract over the fake cloud</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.testkit.cloud;
