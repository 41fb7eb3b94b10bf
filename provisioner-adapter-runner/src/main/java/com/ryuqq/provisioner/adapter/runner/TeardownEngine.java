package com.ryuqq.provisioner.adapter.runner;

import com.ryuqq.provisioner.application.teardown.Teardown;
import com.ryuqq.provisioner.application.teardown.TeardownReport;
import com.ryuqq.provisioner.core.exception.ErrorCategory;
import com.ryuqq.provisioner.core.exception.StateStoreException;
import com.ryuqq.provisioner.core.model.DeploymentRecord;
import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.outcome.Fail;
import com.ryuqq.provisioner.core.outcome.Ok;
import com.ryuqq.provisioner.core.outcome.Outcome;
import com.ryuqq.provisioner.core.spec.DeploymentPlan;
import com.ryuqq.provisioner.core.spec.ResourceSpec;
import com.ryuqq.provisioner.core.spi.ResourceProvider;
import com.ryuqq.provisioner.core.spi.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Teardown engine: deletes every live recorded resource, in reverse dependency order.
 *
 * <p><strong>Order:</strong></p>
 * <pre>
 * GATEWAY → TRIGGER → FUNCTION → TABLE → TOPIC → STORAGE
 * (within a kind: reverse of the order in which handles were recorded)
 * </pre>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>empty State Store: immediate success, no provider call</li>
 *   <li>each successful deletion marks the handle DELETED and is saved at once</li>
 *   <li>a failed deletion is reported and the next one is attempted</li>
 *   <li>the record is cleared only when every deletion succeeded</li>
 * </ul>
 *
 * <p>Handles whose key is no longer planned are deleted through a planned provider of their
 * kind that recognizes the recorded identifier.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class TeardownEngine implements Teardown {

    private static final Logger log = LoggerFactory.getLogger(TeardownEngine.class);

    private final StateStore store;
    private final DeploymentPlan plan;
    private final Clock clock;

    /**
     * @param store State Store
     * @param plan plan whose providers perform the deletions
     * @param clock clock for handle timestamps
     * @throws IllegalArgumentException if a dependency is null
     */
    public TeardownEngine(StateStore store, DeploymentPlan plan, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (plan == null) {
            throw new IllegalArgumentException("plan cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.plan = plan;
        this.clock = clock;
    }

    @Override
    public TeardownReport destroy() {
        Optional<DeploymentRecord> loaded = store.load();
        if (loaded.isEmpty()) {
            log.info("Nothing to destroy: no deployment recorded");
            return TeardownReport.nothingToDestroy();
        }

        DeploymentRecord record = loaded.get();
        List<ResourceHandle> ordered = teardownOrder(record);
        log.info("Teardown started: runSuffix={}, {} live resources", record.runSuffix(), ordered.size());

        List<Outcome> outcomes = new ArrayList<>();
        boolean failed = false;
        for (ResourceHandle handle : ordered) {
            Outcome outcome = tryDelete(handle);
            outcomes.add(outcome);
            if (outcome instanceof Ok) {
                record = record.withHandle(handle.deleted(clock.instant()));
                store.save(record);
            } else {
                failed = true;
            }
        }

        if (failed) {
            long remaining = record.liveHandles().size();
            log.error("Teardown incomplete: {} resources remain recorded in the State Store", remaining);
            return TeardownReport.incomplete(record, outcomes);
        }
        store.clear();
        log.info("Teardown completed: {} resources deleted, State Store cleared", outcomes.size());
        return TeardownReport.cleared(outcomes);
    }

    /**
     * Deletes one resource.
     *
     * <p>Exceptions are turned into a {@link Fail} so the remaining deletions still run.</p>
     */
    private Outcome tryDelete(ResourceHandle handle) {
        Optional<ResourceProvider> provider = providerFor(handle);
        if (provider.isEmpty()) {
            log.error("No provider for {} ({}), cannot delete {}", handle.key(), handle.kind(), handle.identifier());
            return Fail.of(handle.key(), ErrorCategory.FATAL,
                "No provider registered for " + handle.kind() + " identifier " + handle.identifier());
        }
        try {
            provider.get().delete(handle);
            log.info("deleted {} ({})", handle.key(), handle.name());
            return Ok.of(handle, "deleted");
        } catch (StateStoreException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to delete {} ({})", handle.key(), handle.identifier(), e);
            return Fail.from(handle.key(), e);
        }
    }

    private Optional<ResourceProvider> providerFor(ResourceHandle handle) {
        return plan.spec(handle.key())
            .map(ResourceSpec::provider)
            .or(() -> plan.fallbackProvider(handle));
    }

    private static List<ResourceHandle> teardownOrder(DeploymentRecord record) {
        List<ResourceHandle> live = record.liveHandles();
        List<ResourceHandle> ordered = new ArrayList<>(live);
        ordered.sort(Comparator
            .comparingInt((ResourceHandle handle) -> handle.kind().teardownRank())
            .thenComparing(Comparator.comparingInt((ResourceHandle handle) -> live.indexOf(handle)).reversed()));
        return ordered;
    }
}
