package com.ryuqq.provisioner.adapter.runner;

import com.ryuqq.provisioner.application.orchestrator.ApplyReport;
import com.ryuqq.provisioner.application.orchestrator.Orchestrator;
import com.ryuqq.provisioner.core.exception.StateStoreException;
import com.ryuqq.provisioner.core.model.DeploymentRecord;
import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.model.RunSuffix;
import com.ryuqq.provisioner.core.outcome.Fail;
import com.ryuqq.provisioner.core.outcome.Ok;
import com.ryuqq.provisioner.core.outcome.Outcome;
import com.ryuqq.provisioner.core.spec.DeploymentPlan;
import com.ryuqq.provisioner.core.spec.OutputRule;
import com.ryuqq.provisioner.core.spec.ResourceSpec;
import com.ryuqq.provisioner.core.spi.AccountResolver;
import com.ryuqq.provisioner.core.spi.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Dependency-ordered, resumable apply.
 *
 * <p><strong>Flow:</strong></p>
 * <ol>
 *   <li>load the record, or start a new one with a fresh run suffix and save it before any
 *       provider call</li>
 *   <li>for each spec in plan order:
 *     <ul>
 *       <li>resolve the role the first time a spec requires it</li>
 *       <li>reconcile the spec</li>
 *       <li>record the handle and its outputs, then save</li>
 *     </ul>
 *   </li>
 *   <li>stop at the first failure; completed steps stay recorded</li>
 * </ol>
 *
 * <p>Synchronous and single-threaded. Not safe for concurrent runs against the same
 * State Store.</p>
 *
 * <p><strong>Error Handling:</strong> a failing step ends the run with a {@link Fail} outcome
 * in the report. {@link StateStoreException} is not a step failure and propagates.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class SequentialOrchestrator implements Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(SequentialOrchestrator.class);

    private final StateStore store;
    private final DeploymentPlan plan;
    private final AccountResolver accountResolver;
    private final Reconciler reconciler;
    private final OrchestratorConfig config;
    private final Clock clock;

    /**
     * @param store State Store
     * @param plan validated plan
     * @param accountResolver role lookup, called at most once per run
     * @param config settings
     * @param clock clock for run suffix and timestamps
     * @throws IllegalArgumentException if a dependency is null
     */
    public SequentialOrchestrator(StateStore store, DeploymentPlan plan, AccountResolver accountResolver,
                                  OrchestratorConfig config, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (plan == null) {
            throw new IllegalArgumentException("plan cannot be null");
        }
        if (accountResolver == null) {
            throw new IllegalArgumentException("accountResolver cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.plan = plan;
        this.accountResolver = accountResolver;
        this.config = config;
        this.clock = clock;
        this.reconciler = new Reconciler(clock);
    }

    @Override
    public ApplyReport apply() {
        DeploymentRecord record = loadOrStart();
        log.info("Apply started: runSuffix={}, {} resources planned", record.runSuffix(), plan.size());

        List<Outcome> outcomes = new ArrayList<>();
        String roleArn = null;

        for (ResourceSpec spec : plan.orderedSpecs()) {
            ReconcileResult result;
            try {
                if (spec.requiresRole() && roleArn == null) {
                    roleArn = accountResolver.roleArn(config.roleName());
                    log.info("Resolved role {} -> {}", config.roleName(), roleArn);
                }
                result = reconciler.reconcile(spec, record, roleArn);
            } catch (StateStoreException e) {
                throw e;
            } catch (Exception e) {
                log.error("Apply aborted at {}: {}", spec.key(), e.getMessage(), e);
                return ApplyReport.aborted(record, outcomes, Fail.from(spec.key(), e));
            }

            record = withOutputs(record.withHandle(result.handle()), spec, result.handle());
            store.save(record);
            outcomes.add(Ok.of(result.handle(), result.action().label()));
        }

        log.info("Apply completed: {} resources, runSuffix={}", outcomes.size(), record.runSuffix());
        record.outputs().forEach((name, value) -> log.info("  {} = {}", name, value));
        return ApplyReport.completed(record, outcomes);
    }

    private DeploymentRecord loadOrStart() {
        return store.load()
            .map(existing -> {
                log.info("Resuming deployment {} ({} recorded resources)",
                    existing.runSuffix(), existing.resources().size());
                return existing;
            })
            .orElseGet(() -> {
                DeploymentRecord fresh = DeploymentRecord.start(RunSuffix.generate(clock));
                store.save(fresh);
                log.info("New deployment, runSuffix={}", fresh.runSuffix());
                return fresh;
            });
    }

    private static DeploymentRecord withOutputs(DeploymentRecord record, ResourceSpec spec, ResourceHandle handle) {
        DeploymentRecord updated = record;
        for (Map.Entry<String, OutputRule> output : spec.outputs().entrySet()) {
            updated = updated.withOutput(output.getKey(), output.getValue().value(handle));
        }
        return updated;
    }
}
