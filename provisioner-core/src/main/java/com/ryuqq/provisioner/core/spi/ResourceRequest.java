package com.ryuqq.provisioner.core.spi;

import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.model.ResourceKey;
import com.ryuqq.provisioner.core.model.RunSuffix;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Input of {@link ResourceProvider#create(ResourceRequest)}.
 *
 * @param name physical name resolved from the run suffix
 * @param runSuffix run suffix of the deployment
 * @param dependencies handles of every declared dependency, keyed by resource key
 * @param roleArn execution role ARN, null unless the resource requires one
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record ResourceRequest(
    String name,
    RunSuffix runSuffix,
    Map<ResourceKey, ResourceHandle> dependencies,
    String roleArn
) {

    public ResourceRequest {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (runSuffix == null) {
            throw new IllegalArgumentException("runSuffix cannot be null");
        }
        if (dependencies == null) {
            throw new IllegalArgumentException("dependencies cannot be null");
        }
        dependencies = Collections.unmodifiableMap(new LinkedHashMap<>(dependencies));
    }

    /**
     * Request without dependencies or role.
     */
    public static ResourceRequest of(String name, RunSuffix runSuffix) {
        return new ResourceRequest(name, runSuffix, Map.of(), null);
    }

    /**
     * Handle of a declared dependency.
     *
     * @param key dependency key
     * @return handle
     * @throws IllegalStateException if the dependency was not resolved for this request
     */
    public ResourceHandle dependency(ResourceKey key) {
        ResourceHandle handle = dependencies.get(key);
        if (handle == null) {
            throw new IllegalStateException("Dependency not resolved for " + name + ": " + key);
        }
        return handle;
    }

    public Optional<String> role() {
        return Optional.ofNullable(roleArn);
    }

    /**
     * Role ARN, required by providers that always run with a role.
     *
     * @throws IllegalStateException if no role was resolved
     */
    public String requireRole() {
        if (roleArn == null || roleArn.isBlank()) {
            throw new IllegalStateException("Role ARN not resolved for " + name);
        }
        return roleArn;
    }
}
