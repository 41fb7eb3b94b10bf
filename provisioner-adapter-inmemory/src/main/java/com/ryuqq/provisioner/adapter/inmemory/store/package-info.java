/**
 * In-memory State Store adapter.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.adapter.inmemory.store.InMemoryStateStore}:
 *       implementation of {@link com.ryuqq.provisioner.core.spi.StateStore} with save history</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Suitable for contract tests, engine tests and dry runs</li>
 * </ul>
 *
 * @see com.ryuqq.provisioner.core.spi.StateStore
 * @author Provisioner Team
 * @since 1.0.0
 */
package com.ryuqq.provisioner.adapter.inmemory.store;
