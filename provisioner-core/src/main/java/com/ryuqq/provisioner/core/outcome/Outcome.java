package com.ryuqq.provisioner.core.outcome;

import com.ryuqq.provisioner.core.model.ResourceKey;

/**
 * Result of one provisioning or teardown step.
 *
 * <ul>
 *   <li>{@link Ok}: the resource reached its target status</li>
 *   <li>{@link Fail}: the step failed; the error is attributed to the resource</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Fail {

    /**
     * @return key of the resource the step worked on
     */
    ResourceKey key();

    default boolean isOk() {
        return this instanceof Ok;
    }

    default boolean isFail() {
        return this instanceof Fail;
    }
}
