package com.ryuqq.provisioner.adapter.runner;

import com.ryuqq.provisioner.core.exception.ErrorCategory;
import com.ryuqq.provisioner.core.exception.ProvisioningException;
import com.ryuqq.provisioner.core.model.DeploymentRecord;
import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.model.ResourceKey;
import com.ryuqq.provisioner.core.spec.ReconcilePolicy;
import com.ryuqq.provisioner.core.spec.ResourceSpec;
import com.ryuqq.provisioner.core.spi.ResourceProvider;
import com.ryuqq.provisioner.core.spi.ResourceRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Idempotent reconciler: brings one declared resource in line with remote state.
 *
 * <p><strong>Decision table:</strong></p>
 * <pre>
 * prior handle │ policy           │ exists(name) │ action
 * ─────────────┼──────────────────┼──────────────┼──────────────────────────────────
 * none/DELETED │ any              │ -            │ create            → CREATED
 * live         │ REUSE_IF_PRESENT │ true         │ no call           → VERIFIED
 * live         │ REUSE_IF_PRESENT │ false        │ create            → RECREATED
 * live         │ CONVERGE         │ -            │ create-or-update  → CONVERGED (same id)
 *              │                  │              │                   → RECREATED (new id)
 * </pre>
 *
 * <p>The reconciler does not persist anything: the caller writes the returned handle to the
 * State Store before moving to the next resource.</p>
 *
 * <p><strong>Error Handling:</strong> a dependency without a live handle is a FATAL
 * {@link ProvisioningException}. Provider exceptions propagate unchanged.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class Reconciler {

    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    private final Clock clock;

    /**
     * @param clock clock for handle timestamps
     * @throws IllegalArgumentException if clock is null
     */
    public Reconciler(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    /**
     * Reconciles one resource against the current record.
     *
     * @param spec declared resource
     * @param record current deployment record
     * @param roleArn resolved role ARN, null when the spec does not require one
     * @return handle to record and the action taken
     * @throws ProvisioningException if a dependency has no live handle, or the provider fails
     */
    public ReconcileResult reconcile(ResourceSpec spec, DeploymentRecord record, String roleArn) {
        if (spec == null) {
            throw new IllegalArgumentException("spec cannot be null");
        }
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (spec.requiresRole() && (roleArn == null || roleArn.isBlank())) {
            throw new IllegalArgumentException("roleArn required for " + spec.key());
        }

        String name = spec.resolveName(record.runSuffix());
        ResourceProvider provider = spec.provider();
        Optional<ResourceHandle> prior = record.handle(spec.key()).filter(handle -> !handle.isDeleted());

        // 1. reuse a confirmed resource without calling create
        if (prior.isPresent() && spec.policy() == ReconcilePolicy.REUSE_IF_PRESENT) {
            if (provider.exists(name)) {
                ResourceHandle verified = prior.get().verified(now());
                log.info("verified {} ({}) -> {}", spec.key(), name, verified.identifier());
                return new ReconcileResult(verified, ReconcileAction.VERIFIED);
            }
            log.warn("{} ({}) is recorded but missing remotely, creating it again", spec.key(), name);
        }

        // 2. create, update or skip inside the provider
        ResourceRequest request = new ResourceRequest(
            name, record.runSuffix(), dependencies(spec, record), spec.requiresRole() ? roleArn : null);
        String identifier = provider.create(request);

        if (prior.isEmpty()) {
            ResourceHandle created = ResourceHandle.created(spec.key(), name, identifier, now());
            log.info("created {} ({}) -> {}", spec.key(), name, identifier);
            return new ReconcileResult(created, ReconcileAction.CREATED);
        }
        if (spec.policy() == ReconcilePolicy.CONVERGE && identifier.equals(prior.get().identifier())) {
            ResourceHandle converged = prior.get().verified(now());
            log.info("converged {} ({}) -> {}", spec.key(), name, identifier);
            return new ReconcileResult(converged, ReconcileAction.CONVERGED);
        }
        ResourceHandle recreated = prior.get().recreated(identifier, now());
        log.info("recreated {} ({}) -> {} (was {})", spec.key(), name, identifier, prior.get().identifier());
        return new ReconcileResult(recreated, ReconcileAction.RECREATED);
    }

    private Map<ResourceKey, ResourceHandle> dependencies(ResourceSpec spec, DeploymentRecord record) {
        Map<ResourceKey, ResourceHandle> resolved = new LinkedHashMap<>();
        for (ResourceKey dependency : spec.dependsOn()) {
            ResourceHandle handle = record.handle(dependency)
                .filter(h -> !h.isDeleted())
                .orElseThrow(() -> new ProvisioningException(ErrorCategory.FATAL,
                    "Missing dependency " + dependency + " for " + spec.key()));
            resolved.put(dependency, handle);
        }
        return resolved;
    }

    private Instant now() {
        return clock.instant();
    }
}
