package com.ryuqq.provisioner.core.spec;

import com.ryuqq.provisioner.core.model.ResourceNames;
import com.ryuqq.provisioner.core.model.RunSuffix;

/**
 * Deterministic function from a {@link RunSuffix} to a physical resource name.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface NameRule {

    String resolve(RunSuffix suffix);

    /**
     * Name that does not depend on the suffix (table, functions, gateway).
     */
    static NameRule fixed(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        return suffix -> name;
    }

    /**
     * {@code prefix + suffix}.
     */
    static NameRule suffixed(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix cannot be null or blank");
        }
        return suffix -> ResourceNames.suffixed(prefix, suffix);
    }
}
