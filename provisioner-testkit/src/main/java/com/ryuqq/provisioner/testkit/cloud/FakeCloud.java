package com.ryuqq.provisioner.testkit.cloud;

import com.ryuqq.provisioner.core.exception.ErrorCategory;
import com.ryuqq.provisioner.core.exception.ProvisioningException;
import com.ryuqq.provisioner.core.model.ResourceKind;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory stand-in for the cloud account that fake providers act on.
 *
 * <p><strong>Capabilities:</strong></p>
 * <ul>
 *   <li>remembers every live resource by kind and physical name</li>
 *   <li>counts create and delete calls per physical name</li>
 *   <li>removes resources out of band, as an operator would from the console</li>
 *   <li>injects create or delete failures for a given name</li>
 *   <li>binds wiring resources (gateways, triggers) to the identifiers of their dependencies</li>
 * </ul>
 *
 * <p>Identifiers are {@code kind/name#generation}: recreating a resource after an
 * out-of-band deletion yields a new identifier. A wiring resource whose dependencies changed
 * identifier is rebound under a new generation, while its name stays live throughout.</p>
 *
 * <p>Not thread-safe; engines are single-threaded.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class FakeCloud {

    private final Map<ResourceKind, Map<String, String>> live = new HashMap<>();
    private final Map<String, AtomicInteger> generations = new HashMap<>();
    private final Map<String, AtomicInteger> creates = new HashMap<>();
    private final Map<String, AtomicInteger> deletes = new HashMap<>();
    private final Set<String> failingCreates = new HashSet<>();
    private final Set<String> failingDeletes = new HashSet<>();
    private final List<String> deletionLog = new ArrayList<>();
    private final Map<String, List<String>> bindings = new HashMap<>();

    public FakeResourceProvider provider(ResourceKind kind) {
        return new FakeResourceProvider(this, kind, false);
    }

    /**
     * Provider for a resource that connects its dependencies, such as a trigger.
     *
     * <p>{@code exists} only sees the name, as the real describe calls do. Only {@code create}
     * notices that a dependency now has another identifier.</p>
     */
    public FakeResourceProvider wiringProvider(ResourceKind kind) {
        return new FakeResourceProvider(this, kind, true);
    }

    // ========== operations used by FakeResourceProvider ==========

    boolean exists(ResourceKind kind, String name) {
        return resources(kind).containsKey(name);
    }

    String create(ResourceKind kind, String name) {
        creates.computeIfAbsent(name, n -> new AtomicInteger()).incrementAndGet();
        if (failingCreates.contains(name)) {
            throw new ProvisioningException(ErrorCategory.FATAL, "Injected create failure for " + name);
        }
        return resources(kind).computeIfAbsent(name, n ->
            kind.name() + "/" + n + "#" + generations.computeIfAbsent(n, g -> new AtomicInteger()).incrementAndGet());
    }

    String wire(ResourceKind kind, String name, List<String> dependencyIdentifiers) {
        String bindingKey = kind.name() + ":" + name;
        if (exists(kind, name) && !dependencyIdentifiers.equals(bindings.get(bindingKey))) {
            resources(kind).remove(name);
        }
        String identifier = create(kind, name);
        bindings.put(bindingKey, List.copyOf(dependencyIdentifiers));
        return identifier;
    }

    Optional<String> nameOf(ResourceKind kind, String identifier) {
        return resources(kind).entrySet().stream()
            .filter(entry -> entry.getValue().equals(identifier))
            .map(Map.Entry::getKey)
            .findFirst();
    }

    void delete(ResourceKind kind, String name, String identifier) {
        deletes.computeIfAbsent(name, n -> new AtomicInteger()).incrementAndGet();
        if (failingDeletes.contains(name)) {
            throw new ProvisioningException(ErrorCategory.FATAL, "Injected delete failure for " + name);
        }
        Map<String, String> resources = resources(kind);
        // not found is success
        if (identifier.equals(resources.get(name))) {
            resources.remove(name);
            bindings.remove(kind.name() + ":" + name);
        }
        deletionLog.add(kind.name() + ":" + name);
    }

    // ========== test controls ==========

    /**
     * Removes a resource without going through a provider.
     */
    public void deleteOutOfBand(ResourceKind kind, String name) {
        resources(kind).remove(name);
    }

    public void failCreate(String name) {
        failingCreates.add(name);
    }

    public void failDelete(String name) {
        failingDeletes.add(name);
    }

    public void heal() {
        failingCreates.clear();
        failingDeletes.clear();
    }

    // ========== inspection ==========

    public boolean isLive(ResourceKind kind, String name) {
        return exists(kind, name);
    }

    public Optional<String> identifierOf(ResourceKind kind, String name) {
        return Optional.ofNullable(resources(kind).get(name));
    }

    /**
     * Dependency identifiers a wiring resource is currently bound to, empty when unbound.
     */
    public List<String> bindingOf(ResourceKind kind, String name) {
        return bindings.getOrDefault(kind.name() + ":" + name, List.of());
    }

    public int createCount(String name) {
        AtomicInteger count = creates.get(name);
        return count == null ? 0 : count.get();
    }

    public int deleteCount(String name) {
        AtomicInteger count = deletes.get(name);
        return count == null ? 0 : count.get();
    }

    public int totalCreates() {
        return creates.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    public int liveCount() {
        return live.values().stream().mapToInt(Map::size).sum();
    }

    /**
     * Successful deletions as {@code KIND:name}, in call order.
     */
    public List<String> deletionLog() {
        return List.copyOf(deletionLog);
    }

    private Map<String, String> resources(ResourceKind kind) {
        return live.computeIfAbsent(kind, k -> new LinkedHashMap<>());
    }
}
