package com.ryuqq.provisioner.core.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Remote view of a provisioned resource, as returned by {@link ResourceProvider#describe(String)}.
 *
 * @param identifier provider identifier
 * @param attributes kind-specific attributes (e.g. {@code streamArn}, {@code endpoint})
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record ResourceDetails(String identifier, Map<String, String> attributes) {

    public static final String STREAM_ARN = "streamArn";
    public static final String ENDPOINT = "endpoint";
    public static final String STATUS = "status";

    public ResourceDetails {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("identifier cannot be null or blank");
        }
        if (attributes == null) {
            throw new IllegalArgumentException("attributes cannot be null");
        }
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static ResourceDetails of(String identifier) {
        return new ResourceDetails(identifier, Map.of());
    }

    public Optional<String> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }
}
