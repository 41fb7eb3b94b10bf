package com.ryuqq.provisioner.adapter.aws.trigger;

import com.ryuqq.provisioner.core.exception.ProvisioningException;
import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.model.ResourceKey;
import com.ryuqq.provisioner.core.model.ResourceKind;
import com.ryuqq.provisioner.core.spi.ResourceDetails;
import com.ryuqq.provisioner.core.spi.ResourceProvider;
import com.ryuqq.provisioner.core.spi.ResourceRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.lambda.model.CreateEventSourceMappingRequest;
import software.amazon.awssdk.services.lambda.model.DeleteEventSourceMappingRequest;
import software.amazon.awssdk.services.lambda.model.EventSourceMappingConfiguration;
import software.amazon.awssdk.services.lambda.model.EventSourcePosition;
import software.amazon.awssdk.services.lambda.model.GetEventSourceMappingRequest;
import software.amazon.awssdk.services.lambda.model.ListEventSourceMappingsRequest;
import software.amazon.awssdk.services.lambda.model.ResourceConflictException;
import software.amazon.awssdk.services.lambda.model.ResourceNotFoundException;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Table stream → function trigger.
 *
 * <p>The stream ARN is read through the table provider. An existing mapping for the same
 * stream and function is reused. Identifier is the mapping UUID.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class StreamMappingTriggerProvider implements ResourceProvider {

    private static final Logger log = LoggerFactory.getLogger(StreamMappingTriggerProvider.class);

    static final int BATCH_SIZE = 1;

    private static final Pattern MAPPING_UUID =
        Pattern.compile("[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    private final LambdaClient lambda;
    private final ResourceKey tableKey;
    private final ResourceProvider tableProvider;
    private final ResourceKey functionKey;

    /**
     * @param lambda Lambda client
     * @param tableKey dependency holding the table
     * @param tableProvider provider that exposes the stream ARN
     * @param functionKey dependency holding the function
     */
    public StreamMappingTriggerProvider(LambdaClient lambda, ResourceKey tableKey, ResourceProvider tableProvider,
                                        ResourceKey functionKey) {
        if (lambda == null) {
            throw new IllegalArgumentException("lambda cannot be null");
        }
        if (tableKey == null) {
            throw new IllegalArgumentException("tableKey cannot be null");
        }
        if (tableProvider == null) {
            throw new IllegalArgumentException("tableProvider cannot be null");
        }
        if (functionKey == null) {
            throw new IllegalArgumentException("functionKey cannot be null");
        }
        this.lambda = lambda;
        this.tableKey = tableKey;
        this.tableProvider = tableProvider;
        this.functionKey = functionKey;
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.TRIGGER;
    }

    /**
     * Does not tell which stream the mapping reads, so the stack converges this trigger on
     * every apply.
     *
     * @param name function name
     * @return true if any event-source mapping targets the function
     */
    @Override
    public boolean exists(String name) {
        return !lambda.listEventSourceMappings(ListEventSourceMappingsRequest.builder().functionName(name).build())
            .eventSourceMappings().isEmpty();
    }

    @Override
    public String create(ResourceRequest request) {
        String streamArn = streamArn(request.dependency(tableKey));
        String function = request.dependency(functionKey).name();

        Optional<String> existing = findMapping(streamArn, function);
        if (existing.isPresent()) {
            log.info("[Lambda] Stream already connected to {} ({})", function, existing.get());
            return existing.get();
        }
        try {
            String uuid = lambda.createEventSourceMapping(CreateEventSourceMappingRequest.builder()
                .eventSourceArn(streamArn)
                .functionName(function)
                .startingPosition(EventSourcePosition.LATEST)
                .batchSize(BATCH_SIZE)
                .enabled(true)
                .build()).uuid();
            log.info("[Lambda] Stream connected to {} ({})", function, uuid);
            return uuid;
        } catch (ResourceConflictException e) {
            return findMapping(streamArn, function).orElseThrow(() -> ProvisioningException.fatal(
                "Mapping from " + streamArn + " to " + function + " conflicts but cannot be found", e));
        }
    }

    @Override
    public Optional<ResourceDetails> describe(String identifier) {
        try {
            String state = lambda.getEventSourceMapping(GetEventSourceMappingRequest.builder().uuid(identifier).build())
                .state();
            return Optional.of(new ResourceDetails(identifier,
                state == null ? Map.of() : Map.of(ResourceDetails.STATUS, state)));
        } catch (ResourceNotFoundException e) {
            return Optional.empty();
        }
    }

    /**
     * @return true for a mapping UUID
     */
    @Override
    public boolean recognizes(String identifier) {
        return MAPPING_UUID.matcher(identifier).matches();
    }

    @Override
    public void delete(ResourceHandle handle) {
        try {
            lambda.deleteEventSourceMapping(DeleteEventSourceMappingRequest.builder().uuid(handle.identifier()).build());
            log.info("[Lambda] Stream mapping deleted: {} ({})", handle.name(), handle.identifier());
        } catch (ResourceNotFoundException e) {
            log.info("[Lambda] Stream mapping {} no longer exists", handle.identifier());
        }
    }

    private String streamArn(ResourceHandle table) {
        return tableProvider.describe(table.identifier())
            .flatMap(details -> details.attribute(ResourceDetails.STREAM_ARN))
            .orElseThrow(() -> ProvisioningException.fatal("Table " + table.name() + " has no stream"));
    }

    private Optional<String> findMapping(String streamArn, String function) {
        return lambda.listEventSourceMappings(ListEventSourceMappingsRequest.builder()
                .eventSourceArn(streamArn)
                .functionName(function)
                .build())
            .eventSourceMappings().stream()
            .map(EventSourceMappingConfiguration::uuid)
            .findFirst();
    }
}
