package com.ryuqq.provisioner.cli;

import com.ryuqq.provisioner.adapter.aws.stack.DeploymentConfig;

/**
 * Opens a {@link Deployment} for the resolved configuration.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface DeploymentFactory {

    Deployment open(DeploymentConfig config);
}
