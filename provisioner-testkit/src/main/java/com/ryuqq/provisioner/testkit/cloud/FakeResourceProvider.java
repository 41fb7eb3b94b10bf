package com.ryuqq.provisioner.testkit.cloud;

import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.model.ResourceKind;
import com.ryuqq.provisioner.core.spi.ResourceDetails;
import com.ryuqq.provisioner.core.spi.ResourceProvider;
import com.ryuqq.provisioner.core.spi.ResourceRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link ResourceProvider} backed by a {@link FakeCloud}.
 *
 * <p>Honors the provider contract: create returns the existing identifier when the name
 * is already live, delete of a missing resource succeeds. A wiring provider rebinds when a
 * dependency identifier changed.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class FakeResourceProvider implements ResourceProvider {

    private final FakeCloud cloud;
    private final ResourceKind kind;
    private final boolean wiring;
    private final List<ResourceRequest> requests = new ArrayList<>();

    FakeResourceProvider(FakeCloud cloud, ResourceKind kind, boolean wiring) {
        if (cloud == null) {
            throw new IllegalArgumentException("cloud cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.cloud = cloud;
        this.kind = kind;
        this.wiring = wiring;
    }

    @Override
    public ResourceKind kind() {
        return kind;
    }

    @Override
    public boolean exists(String name) {
        return cloud.exists(kind, name);
    }

    @Override
    public String create(ResourceRequest request) {
        requests.add(request);
        if (wiring) {
            List<String> bound = request.dependencies().values().stream()
                .map(ResourceHandle::identifier)
                .collect(Collectors.toList());
            return cloud.wire(kind, request.name(), bound);
        }
        return cloud.create(kind, request.name());
    }

    @Override
    public Optional<ResourceDetails> describe(String identifier) {
        return cloud.nameOf(kind, identifier)
            .map(name -> new ResourceDetails(identifier, Map.of("name", name)));
    }

    @Override
    public void delete(ResourceHandle handle) {
        cloud.delete(kind, handle.name(), handle.identifier());
    }

    /**
     * Every create request received, in call order.
     */
    public List<ResourceRequest> requests() {
        return List.copyOf(requests);
    }
}
