package com.ryuqq.provisioner.core.model;

/**
 * Deterministic physical names derived from a {@link RunSuffix}.
 *
 * <p>Names depend on nothing but the suffix, so two runs sharing a State Store always
 * target the same physical resources.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class ResourceNames {

    public static final String UPLOADS_BUCKET_PREFIX = "inventory-uploads-";
    public static final String WEB_BUCKET_PREFIX = "inventory-web-";
    public static final String TOPIC_PREFIX = "NoStock-";

    private ResourceNames() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String uploadsBucket(RunSuffix suffix) {
        return suffixed(UPLOADS_BUCKET_PREFIX, suffix);
    }

    public static String webBucket(RunSuffix suffix) {
        return suffixed(WEB_BUCKET_PREFIX, suffix);
    }

    public static String lowStockTopic(RunSuffix suffix) {
        return suffixed(TOPIC_PREFIX, suffix);
    }

    /**
     * {@code prefix + suffix}.
     *
     * @throws IllegalArgumentException if prefix is blank or suffix is null
     */
    public static String suffixed(String prefix, RunSuffix suffix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix cannot be null or blank");
        }
        if (suffix == null) {
            throw new IllegalArgumentException("suffix cannot be null");
        }
        return prefix + suffix.getValue();
    }
}
