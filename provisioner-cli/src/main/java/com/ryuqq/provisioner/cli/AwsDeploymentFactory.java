package com.ryuqq.provisioner.cli;

import com.ryuqq.provisioner.adapter.aws.account.StsAccountResolver;
import com.ryuqq.provisioner.adapter.aws.stack.AwsClients;
import com.ryuqq.provisioner.adapter.aws.stack.DeploymentConfig;
import com.ryuqq.provisioner.adapter.aws.stack.InventoryStack;
import com.ryuqq.provisioner.adapter.file.store.FileStateStore;
import com.ryuqq.provisioner.adapter.runner.OrchestratorConfig;
import com.ryuqq.provisioner.adapter.runner.SequentialOrchestrator;
import com.ryuqq.provisioner.adapter.runner.TeardownEngine;
import com.ryuqq.provisioner.application.orchestrator.Orchestrator;
import com.ryuqq.provisioner.application.teardown.Teardown;
import com.ryuqq.provisioner.core.spi.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.regions.Region;

import java.time.Clock;

/**
 * Production wiring: AWS clients, the inventory stack and the JSON state file.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class AwsDeploymentFactory implements DeploymentFactory {

    private static final Logger log = LoggerFactory.getLogger(AwsDeploymentFactory.class);

    private final Clock clock;

    public AwsDeploymentFactory() {
        this(Clock.systemUTC());
    }

    public AwsDeploymentFactory(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public Deployment open(DeploymentConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        log.info("Region {}, state file {}", config.region(), config.stateFile().toAbsolutePath());
        return new AwsDeployment(config, AwsClients.create(Region.of(config.region())), clock);
    }

    private static final class AwsDeployment implements Deployment {

        private final DeploymentConfig config;
        private final AwsClients clients;
        private final Clock clock;
        private final StateStore store;
        private final InventoryStack stack;

        AwsDeployment(DeploymentConfig config, AwsClients clients, Clock clock) {
            this.config = config;
            this.clients = clients;
            this.clock = clock;
            this.store = new FileStateStore(config.stateFile());
            this.stack = new InventoryStack(config, clients);
        }

        @Override
        public Orchestrator orchestrator() {
            return new SequentialOrchestrator(store, stack.applyPlan(), new StsAccountResolver(clients.sts()),
                new OrchestratorConfig().withRoleName(config.roleName()), clock);
        }

        @Override
        public Teardown teardown() {
            return new TeardownEngine(store, stack.teardownPlan(), clock);
        }

        @Override
        public void close() {
            clients.close();
        }
    }
}
