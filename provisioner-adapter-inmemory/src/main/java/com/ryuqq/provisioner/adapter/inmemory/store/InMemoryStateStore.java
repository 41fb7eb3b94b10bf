package com.ryuqq.provisioner.adapter.inmemory.store;

import com.ryuqq.provisioner.core.model.DeploymentRecord;
import com.ryuqq.provisioner.core.spi.StateStore;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of {@link StateStore} for tests and dry runs.
 *
 * <p>Every saved record is also appended to a history, so tests can check that the engines
 * persist after each step and not only at the end of a run.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for real deployments</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class InMemoryStateStore implements StateStore {

    private final AtomicReference<DeploymentRecord> current = new AtomicReference<>();
    private final List<DeploymentRecord> history = new CopyOnWriteArrayList<>();

    public InMemoryStateStore() {
    }

    /**
     * Store that already holds a record, as left behind by an earlier run.
     */
    public InMemoryStateStore(DeploymentRecord initial) {
        if (initial == null) {
            throw new IllegalArgumentException("initial cannot be null");
        }
        current.set(initial);
    }

    @Override
    public Optional<DeploymentRecord> load() {
        return Optional.ofNullable(current.get());
    }

    @Override
    public void save(DeploymentRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        current.set(record);
        history.add(record);
    }

    @Override
    public void clear() {
        current.set(null);
    }

    /**
     * Every record passed to {@link #save(DeploymentRecord)}, oldest first.
     */
    public List<DeploymentRecord> history() {
        return List.copyOf(history);
    }

    public int saveCount() {
        return history.size();
    }
}
