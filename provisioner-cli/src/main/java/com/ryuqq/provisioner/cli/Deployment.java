package com.ryuqq.provisioner.cli;

import com.ryuqq.provisioner.application.orchestrator.Orchestrator;
import com.ryuqq.provisioner.application.teardown.Teardown;

/**
 * Engines wired for one CLI invocation.
 *
 * <p>Closing releases the cloud clients.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public interface Deployment extends AutoCloseable {

    Orchestrator orchestrator();

    Teardown teardown();

    @Override
    void close();
}
