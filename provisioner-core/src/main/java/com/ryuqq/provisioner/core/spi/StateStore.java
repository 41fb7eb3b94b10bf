package com.ryuqq.provisioner.core.spi;

import com.ryuqq.provisioner.core.model.DeploymentRecord;

import java.util.Optional;

/**
 * Persistent storage SPI for the deployment record.
 *
 * <p>The State Store is the single source of truth for what a previous run provisioned.
 * Engines read it once at the start of a run and write it after every completed step.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>{@link #save(DeploymentRecord)} is atomic with respect to a process crash: after a
 *       crash, {@link #load()} returns either the previous or the new record, never a mix</li>
 *   <li>{@link #load()} returns empty when nothing was stored; absence means a fresh deployment</li>
 *   <li>single writer: concurrent runs against the same store are unsupported</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public interface StateStore {

    /**
     * Reads the current deployment record.
     *
     * @return record, or empty when none exists
     * @throws com.ryuqq.provisioner.core.exception.StateStoreException if the stored content is unreadable
     */
    Optional<DeploymentRecord> load();

    /**
     * Replaces the stored record.
     *
     * @param record record to persist
     * @throws IllegalArgumentException if record is null
     * @throws com.ryuqq.provisioner.core.exception.StateStoreException if the write fails
     */
    void save(DeploymentRecord record);

    /**
     * Removes the stored record. Clearing an empty store is a no-op.
     *
     * @throws com.ryuqq.provisioner.core.exception.StateStoreException if the removal fails
     */
    void clear();
}
