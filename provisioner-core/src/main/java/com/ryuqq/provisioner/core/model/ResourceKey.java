package com.ryuqq.provisioner.core.model;

/**
 * Unique key of a resource inside a deployment: kind + logical name.
 *
 * <p>Rendered as {@code KIND:logicalName}, e.g. {@code STORAGE:uploads}. The rendered form
 * is what the state file uses as map key, so {@link #parse(String)} must accept every
 * value produced by {@link #toString()}.</p>
 *
 * <p><strong>Validation:</strong></p>
 * <ul>
 *   <li>kind cannot be null</li>
 *   <li>logicalName: 1~64 chars, alphanumeric, hyphen, underscore</li>
 * </ul>
 *
 * @param kind resource kind
 * @param logicalName logical name, unique per kind
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record ResourceKey(ResourceKind kind, String logicalName) {

    private static final String SEPARATOR = ":";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if kind is null or logicalName is invalid
     */
    public ResourceKey {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (logicalName == null || logicalName.isBlank()) {
            throw new IllegalArgumentException("logicalName cannot be null or blank");
        }
        if (logicalName.length() > 64) {
            throw new IllegalArgumentException("logicalName length cannot exceed 64 characters");
        }
        if (!logicalName.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException(
                "logicalName contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
    }

    public static ResourceKey of(ResourceKind kind, String logicalName) {
        return new ResourceKey(kind, logicalName);
    }

    /**
     * Parses the rendered {@code KIND:logicalName} form.
     *
     * @param rendered rendered key
     * @return ResourceKey
     * @throws IllegalArgumentException if the value is not a rendered key
     */
    public static ResourceKey parse(String rendered) {
        if (rendered == null || rendered.isBlank()) {
            throw new IllegalArgumentException("rendered key cannot be null or blank");
        }
        int idx = rendered.indexOf(SEPARATOR);
        if (idx <= 0 || idx == rendered.length() - 1) {
            throw new IllegalArgumentException("Malformed resource key: " + rendered);
        }
        ResourceKind kind;
        try {
            kind = ResourceKind.valueOf(rendered.substring(0, idx));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown resource kind in key: " + rendered, e);
        }
        return new ResourceKey(kind, rendered.substring(idx + 1));
    }

    @Override
    public String toString() {
        return kind.name() + SEPARATOR + logicalName;
    }
}
