/**
 * Service Provider Interfaces implemented by adapters.
 *
 * <h2>Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.core.spi.StateStore} - Persistent deployment record</li>
 *   <li>{@link com.ryuqq.provisioner.core.spi.ResourceProvider} - Idempotent create / describe / delete per resource kind</li>
 *   <li>{@link com.ryuqq.provisioner.core.spi.AccountResolver} - Execution role lookup</li>
 * </ul>
 *
 * <h2>Value Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.core.spi.ResourceRequest} - Input of a create call</li>
 *   <li>{@link com.ryuqq.provisioner.core.spi.ResourceDetails} - Remote attributes of a resource</li>
 * </ul>
 *
 * <h2>Implementation Guidelines</h2>
 * <ul>
 *   <li>Providers never read the process environment; everything they need is passed in</li>
 *   <li>Providers are blocking and rely on the SDK's own timeouts</li>
 *   <li>State Stores assume a single writer</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.core.spi;
