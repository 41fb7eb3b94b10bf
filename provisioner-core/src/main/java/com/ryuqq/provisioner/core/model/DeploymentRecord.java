package com.ryuqq.provisioner.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persisted state of one deployment: its run suffix, the handle of every resource
 * provisioned so far, and operator-facing outputs (endpoint URLs, bucket names).
 *
 * <p><strong>Lifecycle:</strong></p>
 * <ul>
 *   <li>created on the first run, when the State Store returns nothing</li>
 *   <li>read and incrementally replaced on every subsequent apply or destroy</li>
 *   <li>cleared only at the end of a successful teardown</li>
 * </ul>
 *
 * <p><strong>Immutability:</strong> every mutator returns a copy. Handles keep the order in
 * which they were first recorded, which is the apply order.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class DeploymentRecord {

    private final RunSuffix runSuffix;
    private final Map<ResourceKey, ResourceHandle> resources;
    private final Map<String, String> outputs;

    private DeploymentRecord(RunSuffix runSuffix,
                             Map<ResourceKey, ResourceHandle> resources,
                             Map<String, String> outputs) {
        if (runSuffix == null) {
            throw new IllegalArgumentException("runSuffix cannot be null");
        }
        if (resources == null) {
            throw new IllegalArgumentException("resources cannot be null");
        }
        if (outputs == null) {
            throw new IllegalArgumentException("outputs cannot be null");
        }
        for (Map.Entry<ResourceKey, ResourceHandle> entry : resources.entrySet()) {
            if (!entry.getKey().equals(entry.getValue().key())) {
                throw new IllegalArgumentException(
                    "Handle key mismatch: " + entry.getKey() + " -> " + entry.getValue().key());
            }
        }
        this.runSuffix = runSuffix;
        this.resources = Collections.unmodifiableMap(new LinkedHashMap<>(resources));
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }

    /**
     * Fresh record with no resources.
     */
    public static DeploymentRecord start(RunSuffix runSuffix) {
        return new DeploymentRecord(runSuffix, Map.of(), Map.of());
    }

    /**
     * Restores a record from persisted parts.
     */
    public static DeploymentRecord restore(RunSuffix runSuffix,
                                           Map<ResourceKey, ResourceHandle> resources,
                                           Map<String, String> outputs) {
        return new DeploymentRecord(runSuffix, resources, outputs);
    }

    public RunSuffix runSuffix() {
        return runSuffix;
    }

    public Map<ResourceKey, ResourceHandle> resources() {
        return resources;
    }

    public Map<String, String> outputs() {
        return outputs;
    }

    public Optional<ResourceHandle> handle(ResourceKey key) {
        return Optional.ofNullable(resources.get(key));
    }

    /**
     * Handles that still point at (possibly) live resources, in apply order.
     */
    public List<ResourceHandle> liveHandles() {
        return resources.values().stream()
            .filter(handle -> !handle.isDeleted())
            .toList();
    }

    public DeploymentRecord withHandle(ResourceHandle handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        Map<ResourceKey, ResourceHandle> copy = new LinkedHashMap<>(resources);
        copy.put(handle.key(), handle);
        return new DeploymentRecord(runSuffix, copy, outputs);
    }

    public DeploymentRecord withOutput(String name, String value) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("output name cannot be null or blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("output value cannot be null");
        }
        Map<String, String> copy = new LinkedHashMap<>(outputs);
        copy.put(name, value);
        return new DeploymentRecord(runSuffix, resources, copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeploymentRecord that = (DeploymentRecord) o;
        return runSuffix.equals(that.runSuffix)
            && resources.equals(that.resources)
            && outputs.equals(that.outputs);
    }

    @Override
    public int hashCode() {
        int result = runSuffix.hashCode();
        result = 31 * result + resources.hashCode();
        result = 31 * result + outputs.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "DeploymentRecord{runSuffix=" + runSuffix + ", resources=" + resources.keySet() + "}";
    }
}
