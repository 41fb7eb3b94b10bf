package com.ryuqq.provisioner.adapter.inmemory.store;

import com.ryuqq.provisioner.core.model.DeploymentRecord;
import com.ryuqq.provisioner.core.spi.StateStore;
import com.ryuqq.provisioner.testkit.contract.AbstractStateStoreContractTest;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract tests for {@link InMemoryStateStore}.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
class InMemoryStateStoreContractTest extends AbstractStateStoreContractTest {

    @Override
    protected StateStore createStore() {
        return new InMemoryStateStore();
    }

    @Test
    void history_RecordsEverySave() {
        // Given
        InMemoryStateStore inMemory = (InMemoryStateStore) store;
        DeploymentRecord first = DeploymentRecord.start(SUFFIX);
        DeploymentRecord second = sampleRecord();

        // When
        inMemory.save(first);
        inMemory.save(second);
        inMemory.clear();

        // Then
        assertThat(inMemory.history()).containsExactly(first, second);
        assertThat(inMemory.saveCount()).isEqualTo(2);
        assertThat(inMemory.load()).isEmpty();
    }

    @Test
    void constructor_InitialRecord_IsLoaded() {
        DeploymentRecord initial = sampleRecord();

        assertThat(new InMemoryStateStore(initial).load()).contains(initial);
    }
}
