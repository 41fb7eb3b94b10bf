package com.ryuqq.provisioner.core.spi;

import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.model.ResourceKind;

import java.util.Optional;

/**
 * Cloud resource provider SPI: the capability set every resource kind implements.
 *
 * <p><strong>Idempotency contract:</strong></p>
 * <ul>
 *   <li>{@link #create(ResourceRequest)} is safe when the resource already exists. It
 *       checks first or attempts creation and treats a conflict as success, then falls
 *       through to update or skip. Calling it twice without remote change returns the same
 *       identifier.</li>
 *   <li>{@link #delete(ResourceHandle)} treats "not found" as success.</li>
 * </ul>
 *
 * <p><strong>Error Handling:</strong> recoverable conflicts (already exists, not found) are
 * absorbed inside the provider. Everything else surfaces as a
 * {@link com.ryuqq.provisioner.core.exception.ProvisioningException}.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public interface ResourceProvider {

    /**
     * @return kind of resource this provider manages
     */
    ResourceKind kind();

    /**
     * Checks whether a resource with the given physical name exists remotely.
     *
     * @param name physical name
     * @return true if it exists
     */
    boolean exists(String name);

    /**
     * Creates the resource, or converges an existing one.
     *
     * @param request resolved name, dependencies and role
     * @return provider identifier (ARN, id or URL)
     */
    String create(ResourceRequest request);

    /**
     * Reads remote attributes of a resource.
     *
     * @param identifier provider identifier
     * @return details, or empty when the resource does not exist
     */
    Optional<ResourceDetails> describe(String identifier);

    /**
     * Whether the identifier has the shape this provider records.
     *
     * <p>Used to route a recorded handle whose key is no longer planned to a provider of its
     * kind. Providers sharing a kind override it.</p>
     *
     * @param identifier provider identifier from a recorded handle
     * @return true if this provider can delete it
     */
    default boolean recognizes(String identifier) {
        return true;
    }

    /**
     * Deletes the resource. Deleting a missing resource succeeds.
     *
     * @param handle recorded handle (name and identifier)
     */
    void delete(ResourceHandle handle);
}
