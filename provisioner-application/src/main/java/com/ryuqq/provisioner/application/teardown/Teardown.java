package com.ryuqq.provisioner.application.teardown;

/**
 * Destroy use case: removes every resource recorded in the State Store.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public interface Teardown {

    /**
     * Deletes every live recorded resource in teardown order.
     *
     * <p>An empty State Store is an immediate success. Failed deletions do not stop the
     * remaining ones; the record is cleared only when all of them succeeded.</p>
     *
     * @return report with one outcome per attempted deletion
     * @throws com.ryuqq.provisioner.core.exception.StateStoreException if the record cannot be read or written
     */
    TeardownReport destroy();
}
