/**
 * File-backed State Store.
 *
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.adapter.file.store.FileStateStore} - Crash-safe JSON state file (Jackson)</li>
 * </ul>
 *
 * @see com.ryuqq.provisioner.core.spi.StateStore
 * @author Provisioner Team
 * @since 1.0.0
 */
package com.ryuqq.provisioner.adapter.file.store;
